package personal.salon.sync.resilience.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.sync.resilience.application.port.out.CircuitBreakerStateRepository;
import personal.salon.sync.resilience.domain.model.CircuitBreakerState;

import java.time.Clock;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CircuitBreakerStatePersistenceAdapter implements CircuitBreakerStateRepository {

    private final JpaCircuitBreakerStateRepository jpaCircuitBreakerStateRepository;
    private final Clock clock;

    @Override
    public Optional<CircuitBreakerState> findByServiceAndEnvironment(String service, String environment) {
        return jpaCircuitBreakerStateRepository.findByServiceAndEnvironment(service, environment)
                .map(CircuitBreakerStateEntity::toDomain);
    }

    @Override
    public CircuitBreakerState save(CircuitBreakerState circuit) {
        CircuitBreakerStateEntity entity = CircuitBreakerStateEntity.fromDomain(circuit, clock.instant());
        return jpaCircuitBreakerStateRepository.saveAndFlush(entity).toDomain();
    }
}
