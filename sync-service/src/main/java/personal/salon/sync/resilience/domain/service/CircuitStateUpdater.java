package personal.salon.sync.resilience.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.resilience.application.port.out.CircuitBreakerStateRepository;
import personal.salon.sync.resilience.domain.model.CircuitBreakerState;

import java.util.function.UnaryOperator;

/**
 * Circuit 상태 read-modify-write (단일 트랜잭션)
 * 충돌 시 재시도는 호출자 책임
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CircuitStateUpdater {

    private final CircuitBreakerStateRepository circuitBreakerStateRepository;
    private final SyncProperties syncProperties;

    @Transactional
    public CircuitBreakerState update(String service, String environment,
                                      UnaryOperator<CircuitBreakerState> transition) {
        CircuitBreakerState current = load(service, environment);
        CircuitBreakerState next = transition.apply(current);

        if (next.equals(current) && current.id() != null) {
            return current;
        }
        if (next.state() != current.state()) {
            log.info("Circuit state changed: service={}, environment={}, {} -> {}, failureCount={}",
                    service, environment, current.state(), next.state(), next.failureCount());
        }
        return circuitBreakerStateRepository.save(next);
    }

    @Transactional(readOnly = true)
    public CircuitBreakerState load(String service, String environment) {
        return circuitBreakerStateRepository.findByServiceAndEnvironment(service, environment)
                .orElseGet(() -> {
                    SyncProperties.Resilience defaults = syncProperties.resilience();
                    return CircuitBreakerState.closed(service, environment,
                            defaults.failureThreshold(), defaults.successThreshold(), defaults.timeoutSeconds());
                });
    }
}
