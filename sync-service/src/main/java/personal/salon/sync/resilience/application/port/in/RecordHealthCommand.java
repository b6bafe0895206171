package personal.salon.sync.resilience.application.port.in;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.resilience.domain.model.HealthStatus;

import java.math.BigDecimal;

public record RecordHealthCommand(
        String service,
        String environment,
        HealthStatus status,
        Long responseTimeMs,
        BigDecimal errorRate,
        String lastError) {

    public RecordHealthCommand {
        if (service == null || service.isBlank() || environment == null || environment.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service and environment are required");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Health status cannot be null");
        }
        if (responseTimeMs != null && responseTimeMs < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Response time cannot be negative");
        }
    }
}
