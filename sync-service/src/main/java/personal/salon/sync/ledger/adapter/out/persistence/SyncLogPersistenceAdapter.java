package personal.salon.sync.ledger.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.salon.sync.ledger.application.port.out.SyncLogRepository;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync Log Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class SyncLogPersistenceAdapter implements SyncLogRepository {

    private final JpaSyncLogEntryRepository jpaSyncLogEntryRepository;

    @Override
    public SyncLogEntry append(SyncLogEntry entry) {
        return jpaSyncLogEntryRepository.save(SyncLogEntryEntity.fromDomain(entry)).toDomain();
    }

    @Override
    public List<SyncLogEntry> findByEntity(EntityType entityType, String entityId) {
        return jpaSyncLogEntryRepository.findByEntityTypeAndEntityIdOrderByIdAsc(entityType, entityId)
                .stream()
                .map(SyncLogEntryEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<SyncLogEntry> findLatestState(EntityType entityType, String entityId) {
        return jpaSyncLogEntryRepository.findStateCarrying(
                        entityType, entityId, SyncStatus.COMPLETED, SyncOperation.DELETE, PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(SyncLogEntryEntity::toDomain);
    }

    @Override
    public Optional<SyncLogEntry> findLatestByDevice(UUID userId, EntityType entityType, String entityId,
                                                     String deviceId) {
        return jpaSyncLogEntryRepository
                .findFirstByUserIdAndEntityTypeAndEntityIdAndDeviceIdOrderByIdDesc(userId, entityType, entityId, deviceId)
                .map(SyncLogEntryEntity::toDomain);
    }

    @Override
    public long countByUserSince(UUID userId, Instant since) {
        return jpaSyncLogEntryRepository.countByUserIdAndCreatedAtGreaterThanEqual(userId, since);
    }

    @Override
    public long countByUserAndStatusSince(UUID userId, SyncStatus status, Instant since) {
        return jpaSyncLogEntryRepository.countByUserIdAndStatusAndCreatedAtGreaterThanEqual(userId, status, since);
    }
}
