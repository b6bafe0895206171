package personal.salon.sync.resilience.adapter.in.web.dto;

import personal.salon.sync.resilience.domain.model.CircuitBreakerState;

import java.time.Instant;

public record CircuitStateResponse(
        String service,
        String environment,
        String state,
        int failureCount,
        int successCount,
        Instant lastFailureTime,
        Instant nextRetryTime,
        int failureThreshold,
        int successThreshold,
        long timeoutSeconds
) {
    public static CircuitStateResponse from(CircuitBreakerState circuit) {
        return new CircuitStateResponse(
                circuit.service(),
                circuit.environment(),
                circuit.state().name(),
                circuit.failureCount(),
                circuit.successCount(),
                circuit.lastFailureTime(),
                circuit.nextRetryTime(),
                circuit.failureThreshold(),
                circuit.successThreshold(),
                circuit.timeoutSeconds());
    }
}
