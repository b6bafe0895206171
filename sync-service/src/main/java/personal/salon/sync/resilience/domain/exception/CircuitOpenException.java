package personal.salon.sync.resilience.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Circuit Open Exception
 * OPEN 상태에서 재시도 시각 이전 호출 → 네트워크 호출 없이 즉시 실패
 */
public class CircuitOpenException extends BusinessException {
    public CircuitOpenException(String service, String environment, Instant nextRetryTime) {
        super(ErrorCode.CIRCUIT_OPEN,
                String.format("Circuit is open: service=%s, environment=%s, nextRetryTime=%s",
                        service, environment, nextRetryTime));
    }
}
