package personal.salon.sync.resilience.adapter.in.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import personal.salon.sync.resilience.application.port.in.RecordHealthCommand;
import personal.salon.sync.resilience.domain.model.HealthStatus;

import java.math.BigDecimal;

public record RecordHealthRequest(
        @NotBlank(message = "status는 필수입니다.")
        String status,

        @PositiveOrZero
        Long responseTimeMs,

        @DecimalMin("0.00")
        @DecimalMax("100.00")
        BigDecimal errorRate,

        @Size(max = 1000)
        String lastError
) {
    public RecordHealthCommand toCommand(String service, String environment) {
        return new RecordHealthCommand(service, environment, HealthStatus.from(status),
                responseTimeMs, errorRate, lastError);
    }
}
