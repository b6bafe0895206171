package personal.salon.sync.resilience.application.port.in;

import personal.salon.sync.resilience.domain.model.CircuitBreakerState;

/**
 * Record Call Outcome Use Case
 */
public interface RecordCallOutcomeUseCase {

    /**
     * 호출 결과 반영 후 새 상태 반환
     */
    CircuitBreakerState recordCallOutcome(String service, String environment, boolean success);
}
