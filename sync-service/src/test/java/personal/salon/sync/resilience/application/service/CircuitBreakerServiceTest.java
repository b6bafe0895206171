package personal.salon.sync.resilience.application.service;

import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import personal.salon.sync.resilience.domain.model.CircuitBreakerState;
import personal.salon.sync.resilience.domain.model.CircuitState;
import personal.salon.sync.resilience.domain.service.CircuitStateUpdater;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("CircuitBreakerService 단위 테스트")
class CircuitBreakerServiceTest {

    private static final String SERVICE = "booking-service";
    private static final String ENVIRONMENT = "production";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private CircuitStateUpdater circuitStateUpdater;

    private CircuitBreakerService circuitBreakerService;

    @BeforeEach
    void setUp() {
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(OptimisticLockingFailureException.class)
                .build());
        circuitBreakerService = new CircuitBreakerService(
                circuitStateUpdater, retryRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CircuitBreakerState closed() {
        return CircuitBreakerState.closed(SERVICE, ENVIRONMENT, 5, 1, 60);
    }

    @Test
    @DisplayName("동시 갱신으로 version 충돌이 나면 다시 읽고 재적용한다")
    void retriesOnOptimisticLockConflict() {
        // given
        CircuitBreakerState updated = closed().onFailure(NOW);
        given(circuitStateUpdater.update(eq(SERVICE), eq(ENVIRONMENT), any()))
                .willThrow(new OptimisticLockingFailureException("version mismatch"))
                .willReturn(updated);

        // when
        CircuitBreakerState result = circuitBreakerService.recordCallOutcome(SERVICE, ENVIRONMENT, false);

        // then
        assertThat(result.failureCount()).isEqualTo(1);
        verify(circuitStateUpdater, times(2)).update(eq(SERVICE), eq(ENVIRONMENT), any());
    }

    @Test
    @DisplayName("재시도 횟수를 넘는 충돌은 호출자에게 전파된다")
    void givesUpAfterMaxAttempts() {
        // given
        given(circuitStateUpdater.update(eq(SERVICE), eq(ENVIRONMENT), any()))
                .willThrow(new OptimisticLockingFailureException("version mismatch"));

        // when & then
        assertThatThrownBy(() -> circuitBreakerService.recordCallOutcome(SERVICE, ENVIRONMENT, true))
                .isInstanceOf(OptimisticLockingFailureException.class);
        verify(circuitStateUpdater, times(3)).update(eq(SERVICE), eq(ENVIRONMENT), any());
    }

    @Test
    @DisplayName("CLOSED 상태에서는 상태를 저장하지 않고 호출을 허용한다")
    void closedPermitsWithoutWrite() {
        // given
        CircuitBreakerState current = closed();
        given(circuitStateUpdater.load(SERVICE, ENVIRONMENT)).willReturn(current);

        // when
        CircuitBreakerState result = circuitBreakerService.acquirePermission(SERVICE, ENVIRONMENT);

        // then
        assertThat(result).isSameAs(current);
        verify(circuitStateUpdater, never()).update(any(), any(), any());
    }

    @Test
    @DisplayName("재시도 시각이 지난 OPEN은 HALF_OPEN 전이를 저장한다")
    void expiredOpenTransitionsToHalfOpen() {
        // given
        CircuitBreakerState open = closed();
        Instant openedAt = NOW.minusSeconds(120);
        for (int i = 0; i < 5; i++) {
            open = open.onFailure(openedAt);
        }
        CircuitBreakerState opened = open;
        given(circuitStateUpdater.load(SERVICE, ENVIRONMENT)).willReturn(opened);
        given(circuitStateUpdater.update(eq(SERVICE), eq(ENVIRONMENT), any()))
                .willAnswer(invocation -> invocation.<UnaryOperator<CircuitBreakerState>>getArgument(2).apply(opened));

        // when
        CircuitBreakerState result = circuitBreakerService.acquirePermission(SERVICE, ENVIRONMENT);

        // then
        assertThat(opened.state()).isEqualTo(CircuitState.OPEN);
        assertThat(result.state()).isEqualTo(CircuitState.HALF_OPEN);
    }
}
