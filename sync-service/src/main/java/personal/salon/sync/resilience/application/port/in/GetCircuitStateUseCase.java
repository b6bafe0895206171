package personal.salon.sync.resilience.application.port.in;

import personal.salon.sync.resilience.domain.model.CircuitBreakerState;

public interface GetCircuitStateUseCase {

    /**
     * 기록이 없으면 기본 임계값의 CLOSED 상태
     */
    CircuitBreakerState getState(String service, String environment);
}
