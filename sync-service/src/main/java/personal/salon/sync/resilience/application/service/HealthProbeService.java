package personal.salon.sync.resilience.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.resilience.application.port.in.ProbeServicesUseCase;
import personal.salon.sync.resilience.application.port.in.RecordHealthCommand;
import personal.salon.sync.resilience.application.port.in.ServiceHealthUseCase;
import personal.salon.sync.resilience.application.port.out.HealthProbePort;
import personal.salon.sync.resilience.application.port.out.HealthProbePort.ProbeResult;
import personal.salon.sync.resilience.domain.model.HealthStatus;

import java.util.List;

/**
 * Health Probe Service
 * 2xx + 임계값 미만 → HEALTHY / 2xx + 임계값 이상 → DEGRADED / 그 외 → UNHEALTHY
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthProbeService implements ProbeServicesUseCase {

    private final HealthProbePort healthProbePort;
    private final ServiceHealthUseCase serviceHealthUseCase;
    private final SyncProperties syncProperties;

    @Override
    public int probeAll() {
        List<SyncProperties.Health.ProbeTarget> targets = syncProperties.health().targets();
        if (targets == null || targets.isEmpty()) {
            return 0;
        }

        String environment = syncProperties.resilience().environment();
        long degradedThresholdMs = syncProperties.health().degradedThresholdMs();

        for (SyncProperties.Health.ProbeTarget target : targets) {
            ProbeResult result = healthProbePort.probe(target.url());
            HealthStatus status = classify(result, degradedThresholdMs);

            serviceHealthUseCase.recordHealth(new RecordHealthCommand(
                    target.service(),
                    environment,
                    status,
                    result.responseTimeMs(),
                    null,
                    status == HealthStatus.UNHEALTHY ? describeFailure(result) : null));
        }
        return targets.size();
    }

    static HealthStatus classify(ProbeResult result, long degradedThresholdMs) {
        if (!result.isSuccessful()) {
            return HealthStatus.UNHEALTHY;
        }
        return result.responseTimeMs() < degradedThresholdMs ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
    }

    private static String describeFailure(ProbeResult result) {
        if (result.statusCode() != null) {
            return "HTTP " + result.statusCode();
        }
        return result.error();
    }
}
