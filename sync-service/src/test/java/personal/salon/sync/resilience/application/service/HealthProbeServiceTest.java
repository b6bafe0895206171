package personal.salon.sync.resilience.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.resilience.application.port.in.RecordHealthCommand;
import personal.salon.sync.resilience.application.port.in.ServiceHealthUseCase;
import personal.salon.sync.resilience.application.port.out.HealthProbePort;
import personal.salon.sync.resilience.application.port.out.HealthProbePort.ProbeResult;
import personal.salon.sync.resilience.domain.model.HealthStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthProbeService 단위 테스트")
class HealthProbeServiceTest {

    private static final String URL = "http://booking-service/actuator/health";

    @Mock
    private HealthProbePort healthProbePort;
    @Mock
    private ServiceHealthUseCase serviceHealthUseCase;

    private HealthProbeService service(List<SyncProperties.Health.ProbeTarget> targets) {
        SyncProperties properties = new SyncProperties(null, null,
                new SyncProperties.Resilience("production", 5, 1, 60), null,
                new SyncProperties.Health(1000, targets));
        return new HealthProbeService(healthProbePort, serviceHealthUseCase, properties);
    }

    @Test
    @DisplayName("2xx 응답은 응답 시간 임계값을 기준으로 HEALTHY와 DEGRADED로 나뉜다")
    void classifySuccessfulResponses() {
        assertThat(HealthProbeService.classify(new ProbeResult(200, 999, null), 1000)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthProbeService.classify(new ProbeResult(204, 1000, null), 1000)).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    @DisplayName("2xx가 아니거나 연결에 실패하면 UNHEALTHY")
    void classifyFailures() {
        assertThat(HealthProbeService.classify(new ProbeResult(503, 20, null), 1000)).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(HealthProbeService.classify(new ProbeResult(null, 3000, "timeout"), 1000))
                .isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("프로브 결과를 대상 서비스의 헬스 이력으로 기록한다")
    void probeAllRecordsHealth() {
        // given
        given(healthProbePort.probe(URL)).willReturn(new ProbeResult(503, 42, null));
        ArgumentCaptor<RecordHealthCommand> captor = ArgumentCaptor.forClass(RecordHealthCommand.class);

        // when
        int probed = service(List.of(new SyncProperties.Health.ProbeTarget("booking-service", URL))).probeAll();

        // then
        assertThat(probed).isEqualTo(1);
        verify(serviceHealthUseCase).recordHealth(captor.capture());
        RecordHealthCommand command = captor.getValue();
        assertThat(command.service()).isEqualTo("booking-service");
        assertThat(command.environment()).isEqualTo("production");
        assertThat(command.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(command.responseTimeMs()).isEqualTo(42L);
        assertThat(command.lastError()).isEqualTo("HTTP 503");
    }

    @Test
    @DisplayName("프로브 대상이 없으면 아무것도 하지 않는다")
    void noTargets() {
        // when
        int probed = service(List.of()).probeAll();

        // then
        assertThat(probed).isZero();
        verifyNoInteractions(healthProbePort, serviceHealthUseCase);
    }
}
