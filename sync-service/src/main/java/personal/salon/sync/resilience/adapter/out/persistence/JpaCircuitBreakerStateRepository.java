package personal.salon.sync.resilience.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JpaCircuitBreakerStateRepository extends JpaRepository<CircuitBreakerStateEntity, Long> {

    Optional<CircuitBreakerStateEntity> findByServiceAndEnvironment(String service, String environment);
}
