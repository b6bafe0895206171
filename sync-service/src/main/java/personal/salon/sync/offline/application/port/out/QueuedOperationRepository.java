package personal.salon.sync.offline.application.port.out;

import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queued Operation Repository Port
 */
public interface QueuedOperationRepository {

    QueuedOperation save(QueuedOperation operation);

    Optional<QueuedOperation> findById(Long id);

    /**
     * 멱등 키는 (사용자, 디바이스) 범위에서 유일
     */
    Optional<QueuedOperation> findByUserIdAndDeviceIdAndIdempotencyKey(UUID userId, String deviceId, String idempotencyKey);

    /**
     * 처리 시점이 된 PENDING 작업을 잠금 조회 후 PROCESSING으로 전환
     * (priority desc, created_at asc 순서, 다른 워커가 잠근 행 제외)
     */
    List<QueuedOperation> claimDue(Instant now, int limit);

    int requeueRetryableFailures();

    int releaseStaleClaims(Instant cutoff);

    List<QueuedOperation> findDeadLetters();
}
