package personal.salon.sync.resilience.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.sync.resilience.application.port.out.ServiceHealthRepository;
import personal.salon.sync.resilience.domain.model.ServiceHealth;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ServiceHealthPersistenceAdapter implements ServiceHealthRepository {

    private final JpaServiceHealthRepository jpaServiceHealthRepository;

    @Override
    public Optional<ServiceHealth> findByServiceAndEnvironment(String service, String environment) {
        return jpaServiceHealthRepository.findByServiceAndEnvironment(service, environment)
                .map(ServiceHealthEntity::toDomain);
    }

    @Override
    public ServiceHealth save(ServiceHealth health) {
        return jpaServiceHealthRepository.saveAndFlush(ServiceHealthEntity.fromDomain(health)).toDomain();
    }

    @Override
    public List<ServiceHealth> findAll() {
        return jpaServiceHealthRepository.findAll().stream()
                .map(ServiceHealthEntity::toDomain)
                .toList();
    }
}
