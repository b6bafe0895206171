package personal.salon.sync.resilience.application.port.out;

import personal.salon.sync.resilience.domain.model.CircuitBreakerState;

import java.util.Optional;

/**
 * Circuit Breaker State Repository Port
 * save는 version이 어긋나면 OptimisticLockingFailureException
 */
public interface CircuitBreakerStateRepository {

    Optional<CircuitBreakerState> findByServiceAndEnvironment(String service, String environment);

    CircuitBreakerState save(CircuitBreakerState circuit);
}
