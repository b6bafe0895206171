package personal.salon.sync.offline.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.salon.sync.offline.domain.model.OperationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Offline Operation JPA Repository
 */
public interface JpaQueuedOperationRepository extends JpaRepository<QueuedOperationEntity, Long> {

    Optional<QueuedOperationEntity> findByUserIdAndDeviceIdAndIdempotencyKey(
            UUID userId, String deviceId, String idempotencyKey);

    /**
     * 처리 대상 잠금 조회 (MySQL 8)
     * FOR UPDATE SKIP LOCKED: 다른 drain 워커가 잠근 행은 건너뜀 → 중복 처리 방지
     */
    @Query(value = "SELECT * FROM offline_operations " +
            "WHERE status = 'PENDING' " +
            "AND retry_count < max_retries " +
            "AND (next_retry_at IS NULL OR next_retry_at <= :now) " +
            "ORDER BY priority DESC, created_at ASC, id ASC " +
            "LIMIT :limit " +
            "FOR UPDATE SKIP LOCKED",
            nativeQuery = true)
    List<QueuedOperationEntity> lockDuePending(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * 재시도 예산이 남은 FAILED → PENDING
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE QueuedOperationEntity o SET o.status = :pending, o.version = o.version + 1 " +
            "WHERE o.status = :failed AND o.retryCount < o.maxRetries")
    int requeueRetryable(@Param("failed") OperationStatus failed, @Param("pending") OperationStatus pending);

    /**
     * claim 후 완료/실패 기록 없이 timeout을 넘긴 PROCESSING → PENDING (워커 비정상 종료 복구)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE QueuedOperationEntity o SET o.status = :pending, o.claimedAt = NULL, o.version = o.version + 1 " +
            "WHERE o.status = :processing AND o.claimedAt < :cutoff")
    int releaseStaleClaims(@Param("processing") OperationStatus processing,
                           @Param("pending") OperationStatus pending,
                           @Param("cutoff") Instant cutoff);

    @Query("SELECT o FROM QueuedOperationEntity o " +
            "WHERE o.status = :failed AND o.retryCount >= o.maxRetries " +
            "ORDER BY o.createdAt ASC")
    List<QueuedOperationEntity> findDeadLetters(@Param("failed") OperationStatus failed);
}
