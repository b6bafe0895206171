package personal.salon.sync.resilience.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.resilience.application.port.in.RecordHealthCommand;
import personal.salon.sync.resilience.application.port.in.ServiceHealthUseCase;
import personal.salon.sync.resilience.application.port.out.ServiceHealthRepository;
import personal.salon.sync.resilience.domain.model.HealthStatus;
import personal.salon.sync.resilience.domain.model.ServiceHealth;
import personal.salon.sync.resilience.domain.service.ServiceHealthRecorder;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service Health Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceHealthService implements ServiceHealthUseCase {

    private final ServiceHealthRecorder serviceHealthRecorder;
    private final ServiceHealthRepository serviceHealthRepository;
    private final Clock clock;

    @Override
    public ServiceHealth recordHealth(RecordHealthCommand command) {
        ServiceHealth recorded;
        try {
            recorded = serviceHealthRecorder.upsert(command, clock.instant());
        } catch (DataIntegrityViolationException e) {
            // 최초 행 동시 생성 → 다른 쪽이 만든 행에 1회 재시도
            log.warn("Concurrent health upsert detected, retrying: service={}, environment={}",
                    command.service(), command.environment());
            recorded = serviceHealthRecorder.upsert(command, clock.instant());
        }

        if (recorded.status() == HealthStatus.UNHEALTHY) {
            log.warn("Service unhealthy: service={}, environment={}, consecutiveFailures={}, lastError={}",
                    recorded.service(), recorded.environment(), recorded.consecutiveFailures(), recorded.lastError());
        } else {
            log.debug("Service health recorded: service={}, environment={}, status={}, responseTimeMs={}",
                    recorded.service(), recorded.environment(), recorded.status(), recorded.responseTimeMs());
        }
        return recorded;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<HealthStatus, Long> healthSummary() {
        Map<HealthStatus, Long> summary = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            summary.put(status, 0L);
        }
        serviceHealthRepository.findAll()
                .forEach(health -> summary.merge(health.status(), 1L, Long::sum));
        return summary;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ServiceHealth> listHealth() {
        return serviceHealthRepository.findAll();
    }
}
