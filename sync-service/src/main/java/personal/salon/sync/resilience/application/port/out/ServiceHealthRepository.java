package personal.salon.sync.resilience.application.port.out;

import personal.salon.sync.resilience.domain.model.ServiceHealth;

import java.util.List;
import java.util.Optional;

public interface ServiceHealthRepository {

    Optional<ServiceHealth> findByServiceAndEnvironment(String service, String environment);

    ServiceHealth save(ServiceHealth health);

    List<ServiceHealth> findAll();
}
