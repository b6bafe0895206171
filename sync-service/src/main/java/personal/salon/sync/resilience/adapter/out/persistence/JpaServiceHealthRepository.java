package personal.salon.sync.resilience.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JpaServiceHealthRepository extends JpaRepository<ServiceHealthEntity, Long> {

    Optional<ServiceHealthEntity> findByServiceAndEnvironment(String service, String environment);
}
