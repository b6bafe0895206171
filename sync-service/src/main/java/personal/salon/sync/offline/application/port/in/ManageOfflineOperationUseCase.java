package personal.salon.sync.offline.application.port.in;

import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.util.List;
import java.util.UUID;

/**
 * 작업 조회/취소 및 운영자 조치
 */
public interface ManageOfflineOperationUseCase {

    QueuedOperation getOperation(UUID userId, Long operationId);

    /**
     * PENDING 상태에서만 취소 가능
     */
    QueuedOperation cancel(UUID userId, Long operationId);

    List<QueuedOperation> deadLetters();

    /**
     * dead letter 재처리 (재시도 예산 초기화)
     */
    QueuedOperation requeueDeadLetter(Long operationId);
}
