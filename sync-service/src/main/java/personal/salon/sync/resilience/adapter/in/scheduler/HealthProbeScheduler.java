package personal.salon.sync.resilience.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.salon.sync.resilience.application.port.in.ProbeServicesUseCase;

/**
 * Health Probe Scheduler
 * 주기: sync.scheduler.health-probe-interval-ms (기본 60초)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HealthProbeScheduler {

    private final ProbeServicesUseCase probeServicesUseCase;

    @Scheduled(fixedDelayString = "${sync.scheduler.health-probe-interval-ms:60000}")
    public void probeServices() {
        try {
            int probed = probeServicesUseCase.probeAll();
            log.debug("Health probe completed: targets={}", probed);
        } catch (Exception e) {
            log.error("Health probe scheduler failed", e);
        }
    }
}
