package personal.salon.sync.resilience.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.resilience.domain.exception.CircuitOpenException;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit Breaker State Domain Model
 * (service, environment)별 상태 머신 (불변, version으로 낙관적 잠금)
 *
 * CLOSED --(failureCount >= failureThreshold)--> OPEN
 * OPEN --(nextRetryTime 이후 호출)--> HALF_OPEN
 * HALF_OPEN --(successCount >= successThreshold)--> CLOSED
 * HALF_OPEN --(실패)--> OPEN (새 timeout)
 */
public record CircuitBreakerState(
        Long id,
        String service,
        String environment,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailureTime,
        Instant nextRetryTime,
        int failureThreshold,
        int successThreshold,
        long timeoutSeconds,
        Long version) {

    public CircuitBreakerState {
        if (service == null || service.isBlank() || environment == null || environment.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service and environment are required");
        }
        if (failureThreshold < 1 || successThreshold < 1 || timeoutSeconds < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Circuit thresholds must be positive");
        }
    }

    public static CircuitBreakerState closed(String service, String environment,
                                             int failureThreshold, int successThreshold, long timeoutSeconds) {
        return new CircuitBreakerState(null, service, environment, CircuitState.CLOSED, 0, 0, null, null,
                failureThreshold, successThreshold, timeoutSeconds, null);
    }

    /**
     * 호출 허용 여부 확인
     * OPEN이고 재시도 시각이 지났으면 HALF_OPEN으로 전이한 상태 반환
     *
     * @throws CircuitOpenException OPEN이고 재시도 시각 이전
     */
    public CircuitBreakerState acquirePermission(Instant now) {
        if (state != CircuitState.OPEN) {
            return this;
        }
        if (now.isBefore(nextRetryTime)) {
            throw new CircuitOpenException(service, environment, nextRetryTime);
        }
        return halfOpen();
    }

    public boolean isCallPermitted(Instant now) {
        return state != CircuitState.OPEN || !now.isBefore(nextRetryTime);
    }

    public CircuitBreakerState record(boolean success, Instant now) {
        return success ? onSuccess(now) : onFailure(now);
    }

    public CircuitBreakerState onSuccess(Instant now) {
        return switch (state) {
            case CLOSED -> with(CircuitState.CLOSED, 0, 0, lastFailureTime, null);
            case HALF_OPEN -> {
                int successes = successCount + 1;
                yield successes >= successThreshold
                        ? with(CircuitState.CLOSED, 0, 0, lastFailureTime, null)
                        : with(CircuitState.HALF_OPEN, failureCount, successes, lastFailureTime, nextRetryTime);
            }
            // 재시도 시각 이전의 OPEN에서 보고된 성공은 상태를 바꾸지 않음
            case OPEN -> now.isBefore(nextRetryTime) ? this : halfOpen().onSuccess(now);
        };
    }

    public CircuitBreakerState onFailure(Instant now) {
        return switch (state) {
            case CLOSED -> {
                int failures = failureCount + 1;
                yield failures >= failureThreshold
                        ? open(failures, now)
                        : with(CircuitState.CLOSED, failures, 0, now, null);
            }
            case HALF_OPEN -> open(failureCount + 1, now);
            case OPEN -> now.isBefore(nextRetryTime)
                    ? with(CircuitState.OPEN, failureCount + 1, 0, now, nextRetryTime)
                    : halfOpen().onFailure(now);
        };
    }

    private CircuitBreakerState open(int failures, Instant now) {
        return with(CircuitState.OPEN, failures, 0, now, now.plus(Duration.ofSeconds(timeoutSeconds)));
    }

    private CircuitBreakerState halfOpen() {
        return with(CircuitState.HALF_OPEN, failureCount, 0, lastFailureTime, nextRetryTime);
    }

    private CircuitBreakerState with(CircuitState newState, int failures, int successes,
                                     Instant lastFailure, Instant nextRetry) {
        return new CircuitBreakerState(id, service, environment, newState, failures, successes, lastFailure,
                nextRetry, failureThreshold, successThreshold, timeoutSeconds, version);
    }
}
