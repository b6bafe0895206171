package personal.salon.sync.offline.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.offline.domain.exception.InvalidOperationStateException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Queued Operation Domain Model
 * 디바이스 오프라인 중 제출된 작업 (불변, version으로 낙관적 잠금)
 *
 * 실패 시 retryCount + 1, nextRetryAt = now + 2^retryCount 분
 * retryCount == maxRetries 이면 종결(dead letter), nextRetryAt 없음
 */
public record QueuedOperation(
        Long id,
        UUID userId,
        String deviceId,
        OperationType operationType,
        String idempotencyKey,
        Map<String, Object> payload,
        int priority,
        int retryCount,
        int maxRetries,
        OperationStatus status,
        Instant nextRetryAt,
        Instant claimedAt,
        String errorMessage,
        Instant createdAt,
        Instant processedAt,
        Long version) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;
    private static final int MAX_ERROR_LENGTH = 1000;

    public QueuedOperation {
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
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Priority must be between %d and %d", MIN_PRIORITY, MAX_PRIORITY));
        }
        if (maxRetries < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Max retries must be positive");
        }
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalStateException(
                    String.format("Retry count out of range: retryCount=%d, maxRetries=%d", retryCount, maxRetries));
        }
        payload = payload == null ? Map.of() : payload;
    }

    public static QueuedOperation enqueue(UUID userId, String deviceId, OperationType operationType,
                                          String idempotencyKey, Map<String, Object> payload,
                                          int priority, int maxRetries, Instant now) {
        return new QueuedOperation(null, userId, deviceId, operationType, idempotencyKey, payload, priority,
                0, maxRetries, OperationStatus.PENDING, null, null, null, now, null, null);
    }

    /**
     * N번째 재시도 대기 시간 = 2^N 분
     */
    public static Duration backoff(int retryCount) {
        return Duration.ofMinutes(1L << retryCount);
    }

    public OfflineOperation toOperation() {
        return OfflineOperation.of(operationType, payload);
    }

    public OperationContext context() {
        return new OperationContext(userId, deviceId, idempotencyKey);
    }

    public boolean isDue(Instant now) {
        return status == OperationStatus.PENDING
                && retryCount < maxRetries
                && (nextRetryAt == null || !nextRetryAt.isAfter(now));
    }

    public boolean isDeadLettered() {
        return status == OperationStatus.FAILED && retryCount >= maxRetries;
    }

    /**
     * PENDING → PROCESSING
     */
    public QueuedOperation claim(Instant now) {
        if (status != OperationStatus.PENDING) {
            throw new InvalidOperationStateException(id, status, "claim");
        }
        return with(OperationStatus.PROCESSING, retryCount, nextRetryAt, now, errorMessage, processedAt);
    }

    /**
     * PROCESSING → COMPLETED
     */
    public QueuedOperation complete(Instant now) {
        if (status != OperationStatus.PROCESSING) {
            throw new InvalidOperationStateException(id, status, "complete");
        }
        return with(OperationStatus.COMPLETED, retryCount, null, claimedAt, null, now);
    }

    /**
     * PROCESSING → FAILED
     * 재시도 예산이 남았으면 다음 시도 시각 설정, 소진되면 dead letter
     */
    public QueuedOperation fail(String error, Instant now) {
        if (status != OperationStatus.PROCESSING) {
            throw new InvalidOperationStateException(id, status, "fail");
        }
        int retries = retryCount + 1;
        Instant nextRetry = retries < maxRetries ? now.plus(backoff(retries)) : null;
        return with(OperationStatus.FAILED, retries, nextRetry, claimedAt, truncate(error), now);
    }

    /**
     * FAILED(재시도 남음) → PENDING
     */
    public QueuedOperation requeue() {
        if (status != OperationStatus.FAILED || isDeadLettered()) {
            throw new InvalidOperationStateException(id, status, "requeue");
        }
        return with(OperationStatus.PENDING, retryCount, nextRetryAt, null, errorMessage, processedAt);
    }

    /**
     * 운영자 재처리: dead letter → PENDING, 재시도 예산 초기화
     */
    public QueuedOperation resetForManualRetry() {
        if (!isDeadLettered()) {
            throw new InvalidOperationStateException(id, status, "manually requeue");
        }
        return with(OperationStatus.PENDING, 0, null, null, errorMessage, null);
    }

    /**
     * PENDING에서만 취소 가능 (PROCESSING은 끝까지 처리)
     */
    public QueuedOperation cancel(Instant now) {
        if (status != OperationStatus.PENDING) {
            throw new InvalidOperationStateException(id, status, "cancel");
        }
        return with(OperationStatus.CANCELLED, retryCount, null, claimedAt, errorMessage, now);
    }

    private QueuedOperation with(OperationStatus newStatus, int retries, Instant nextRetry, Instant claimed,
                                 String error, Instant processed) {
        return new QueuedOperation(id, userId, deviceId, operationType, idempotencyKey, payload, priority,
                retries, maxRetries, newStatus, nextRetry, claimed, error, createdAt, processed, version);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
