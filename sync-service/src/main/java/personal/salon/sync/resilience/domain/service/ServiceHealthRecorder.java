package personal.salon.sync.resilience.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.resilience.application.port.in.RecordHealthCommand;
import personal.salon.sync.resilience.application.port.out.ServiceHealthRepository;
import personal.salon.sync.resilience.domain.model.ServiceHealth;

import java.time.Instant;

/**
 * 헬스 행 upsert (단일 트랜잭션)
 */
@Component
@RequiredArgsConstructor
public class ServiceHealthRecorder {

    private final ServiceHealthRepository serviceHealthRepository;

    @Transactional
    public ServiceHealth upsert(RecordHealthCommand command, Instant now) {
        ServiceHealth current = serviceHealthRepository
                .findByServiceAndEnvironment(command.service(), command.environment())
                .orElseGet(() -> ServiceHealth.unknown(command.service(), command.environment()));

        return serviceHealthRepository.save(current.record(
                command.status(), command.responseTimeMs(), command.errorRate(), command.lastError(), now));
    }
}
