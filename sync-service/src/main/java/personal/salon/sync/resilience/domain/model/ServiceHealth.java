package personal.salon.sync.resilience.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Service Health Domain Model
 * (service, environment)당 한 행
 */
public record ServiceHealth(
        Long id,
        String service,
        String environment,
        HealthStatus status,
        Instant lastCheck,
        Long responseTimeMs,
        BigDecimal errorRate,
        int consecutiveFailures,
        String lastError) {

    public ServiceHealth {
        if (service == null || service.isBlank() || environment == null || environment.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service and environment are required");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Health status cannot be null");
        }
    }

    public static ServiceHealth unknown(String service, String environment) {
        return new ServiceHealth(null, service, environment, HealthStatus.UNKNOWN, null, null, null, 0, null);
    }

    /**
     * 점검 결과 반영
     * UNHEALTHY: 연속 실패 +1 / HEALTHY: 0으로 초기화 / DEGRADED, UNKNOWN: 유지
     */
    public ServiceHealth record(HealthStatus newStatus, Long responseTime, BigDecimal newErrorRate,
                                String error, Instant now) {
        int failures = switch (newStatus) {
            case UNHEALTHY -> consecutiveFailures + 1;
            case HEALTHY -> 0;
            case DEGRADED, UNKNOWN -> consecutiveFailures;
        };
        return new ServiceHealth(id, service, environment, newStatus, now, responseTime, newErrorRate,
                failures, error != null ? error : (newStatus == HealthStatus.HEALTHY ? null : lastError));
    }
}
