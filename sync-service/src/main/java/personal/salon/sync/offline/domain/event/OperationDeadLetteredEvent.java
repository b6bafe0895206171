package personal.salon.sync.offline.domain.event;

import personal.salon.sync.offline.domain.model.OperationType;

import java.util.UUID;

/**
 * 재시도 예산을 소진한 작업 (운영자 확인 대상)
 */
public record OperationDeadLetteredEvent(
        Long operationId,
        UUID userId,
        String deviceId,
        OperationType operationType,
        int retryCount,
        String errorMessage) {
}
