package personal.salon.sync.resilience.application.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.sync.resilience.application.port.in.GetCircuitStateUseCase;
import personal.salon.sync.resilience.application.port.in.RecordCallOutcomeUseCase;
import personal.salon.sync.resilience.domain.model.CircuitBreakerState;
import personal.salon.sync.resilience.domain.service.CircuitStateUpdater;

import java.time.Clock;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Circuit Breaker Service
 * 영속화된 상태 머신 갱신을 낙관적 잠금 + resilience4j Retry로 보호
 *
 * Retry 대상 (application.yml resilience4j.retry.instances.circuitState):
 * - OptimisticLockingFailureException: 동시 갱신으로 version 불일치
 * - DataIntegrityViolationException: 최초 행 동시 생성
 */
@Slf4j
@Service
public class CircuitBreakerService implements RecordCallOutcomeUseCase, GetCircuitStateUseCase {

    static final String RETRY_NAME = "circuitState";

    private final CircuitStateUpdater circuitStateUpdater;
    private final Retry retry;
    private final Clock clock;

    public CircuitBreakerService(CircuitStateUpdater circuitStateUpdater, RetryRegistry retryRegistry, Clock clock) {
        this.circuitStateUpdater = circuitStateUpdater;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.clock = clock;
    }

    @Override
    public CircuitBreakerState recordCallOutcome(String service, String environment, boolean success) {
        Instant now = clock.instant();
        CircuitBreakerState updated = updateWithRetry(service, environment, circuit -> circuit.record(success, now));
        log.debug("Call outcome recorded: service={}, environment={}, success={}, state={}, failureCount={}",
                service, environment, success, updated.state(), updated.failureCount());
        return updated;
    }

    @Override
    public CircuitBreakerState getState(String service, String environment) {
        return circuitStateUpdater.load(service, environment);
    }

    /**
     * 호출 허용 확인
     * OPEN이고 재시도 시각 이전이면 CircuitOpenException (네트워크 호출 없음)
     * 재시도 시각이 지났으면 HALF_OPEN 전이를 저장
     */
    public CircuitBreakerState acquirePermission(String service, String environment) {
        Instant now = clock.instant();
        CircuitBreakerState current = circuitStateUpdater.load(service, environment);
        CircuitBreakerState permitted = current.acquirePermission(now);
        if (permitted == current) {
            return current;
        }
        return updateWithRetry(service, environment, circuit -> circuit.acquirePermission(now));
    }

    private CircuitBreakerState updateWithRetry(String service, String environment,
                                                UnaryOperator<CircuitBreakerState> transition) {
        return Retry.decorateSupplier(retry,
                () -> circuitStateUpdater.update(service, environment, transition)).get();
    }
}
