package personal.salon.sync.ledger.application.port.out;

import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync Log Repository Port
 * Insert 전용
 */
public interface SyncLogRepository {

    SyncLogEntry append(SyncLogEntry entry);

    List<SyncLogEntry> findByEntity(EntityType entityType, String entityId);

    Optional<SyncLogEntry> findLatestState(EntityType entityType, String entityId);

    Optional<SyncLogEntry> findLatestByDevice(UUID userId, EntityType entityType, String entityId, String deviceId);

    long countByUserSince(UUID userId, Instant since);

    long countByUserAndStatusSince(UUID userId, SyncStatus status, Instant since);
}
