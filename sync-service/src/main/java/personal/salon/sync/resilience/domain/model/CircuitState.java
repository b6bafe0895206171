package personal.salon.sync.resilience.domain.model;

/**
 * Circuit Breaker 상태
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
