package personal.salon.sync.resilience.application.port.in;

import personal.salon.sync.resilience.domain.model.HealthStatus;
import personal.salon.sync.resilience.domain.model.ServiceHealth;

import java.util.List;
import java.util.Map;

/**
 * Service Health Use Case
 */
public interface ServiceHealthUseCase {

    /**
     * (service, environment) 행 upsert
     */
    ServiceHealth recordHealth(RecordHealthCommand command);

    /**
     * 상태별 서비스 수 (모든 상태 키 포함)
     */
    Map<HealthStatus, Long> healthSummary();

    List<ServiceHealth> listHealth();
}
