package personal.salon.sync.offline.application.port.in;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.offline.domain.model.OperationType;

import java.util.Map;
import java.util.UUID;

/**
 * 오프라인 작업 제출 Command
 *
 * @param priority   null이면 기본값 (sync.offline-queue.default-priority)
 * @param maxRetries null이면 기본값 (sync.offline-queue.default-max-retries)
 */
public record EnqueueOperationCommand(
        UUID userId,
        String deviceId,
        OperationType operationType,
        String idempotencyKey,
        Map<String, Object> payload,
        Integer priority,
        Integer maxRetries) {

    public EnqueueOperationCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Device ID cannot be null or blank");
        }
        if (operationType == null) {
            throw new BusinessException(ErrorCode.UNKNOWN_OPERATION_TYPE, "Operation type cannot be null");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Idempotency key cannot be null or blank");
        }
    }
}
