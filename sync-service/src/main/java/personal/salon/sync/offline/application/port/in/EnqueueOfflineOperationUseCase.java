package personal.salon.sync.offline.application.port.in;

import personal.salon.sync.offline.domain.model.QueuedOperation;

public interface EnqueueOfflineOperationUseCase {

    /**
     * 작업 제출 (즉시 수락, 처리는 drain에서)
     * 같은 (deviceId, idempotencyKey)로 재제출하면 기존 작업 반환
     */
    QueuedOperation enqueue(EnqueueOperationCommand command);
}
