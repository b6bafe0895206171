package personal.salon.sync.resilience.adapter.in.web.dto;

import personal.salon.sync.resilience.domain.model.ServiceHealth;

import java.math.BigDecimal;
import java.time.Instant;

public record ServiceHealthResponse(
        String service,
        String environment,
        String status,
        Instant lastCheck,
        Long responseTimeMs,
        BigDecimal errorRate,
        int consecutiveFailures,
        String lastError
) {
    public static ServiceHealthResponse from(ServiceHealth health) {
        return new ServiceHealthResponse(
                health.service(),
                health.environment(),
                health.status().name(),
                health.lastCheck(),
                health.responseTimeMs(),
                health.errorRate(),
                health.consecutiveFailures(),
                health.lastError());
    }
}
