package personal.salon.sync.ledger.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync Log Entry JPA Repository
 */
public interface JpaSyncLogEntryRepository extends JpaRepository<SyncLogEntryEntity, Long> {

    List<SyncLogEntryEntity> findByEntityTypeAndEntityIdOrderByIdAsc(EntityType entityType, String entityId);

    /**
     * 상태를 담은 완료 기록을 최신순으로 조회
     */
    @Query("SELECT e FROM SyncLogEntryEntity e " +
            "WHERE e.entityType = :entityType AND e.entityId = :entityId " +
            "AND e.status = :status " +
            "AND (e.dataAfter IS NOT NULL OR e.operation = :deleteOperation) " +
            "ORDER BY e.id DESC")
    List<SyncLogEntryEntity> findStateCarrying(@Param("entityType") EntityType entityType,
                                               @Param("entityId") String entityId,
                                               @Param("status") SyncStatus status,
                                               @Param("deleteOperation") SyncOperation deleteOperation,
                                               Pageable pageable);

    Optional<SyncLogEntryEntity> findFirstByUserIdAndEntityTypeAndEntityIdAndDeviceIdOrderByIdDesc(
            UUID userId, EntityType entityType, String entityId, String deviceId);

    long countByUserIdAndCreatedAtGreaterThanEqual(UUID userId, Instant since);

    long countByUserIdAndStatusAndCreatedAtGreaterThanEqual(UUID userId, SyncStatus status, Instant since);
}
