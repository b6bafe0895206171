package personal.salon.sync.offline.adapter.in.web.dto;

import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Instant;

/**
 * 오프라인 작업 상태 응답
 */
public record OperationResponse(
        Long operationId,
        String deviceId,
        String operationType,
        String idempotencyKey,
        String status,
        int priority,
        int retryCount,
        int maxRetries,
        Instant nextRetryAt,
        String errorMessage,
        Instant createdAt,
        Instant processedAt
) {
    public static OperationResponse from(QueuedOperation operation) {
        return new OperationResponse(
                operation.id(),
                operation.deviceId(),
                operation.operationType().name(),
                operation.idempotencyKey(),
                operation.status().name(),
                operation.priority(),
                operation.retryCount(),
                operation.maxRetries(),
                operation.nextRetryAt(),
                operation.errorMessage(),
                operation.createdAt(),
                operation.processedAt());
    }
}
