package personal.salon.sync.ledger.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import personal.salon.sync.common.persistence.JsonMapConverter;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.ResolutionAction;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Sync Log Entry JPA Entity
 * 모든 컬럼 updatable=false, Hibernate @Immutable로 UPDATE 자체를 차단
 */
@Entity
@Immutable
@Table(name = "sync_log_entries", indexes = {
        @Index(name = "idx_entity", columnList = "entity_type, entity_id"),
        @Index(name = "idx_user_entity_device", columnList = "user_id, entity_type, entity_id, device_id"),
        @Index(name = "idx_user_created", columnList = "user_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SyncLogEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "device_id", updatable = false, length = 128)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 30)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false, length = 128)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private SyncOperation operation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private SyncStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "data_before", updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> dataBefore;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "data_after", updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> dataAfter;

    @Column(name = "conflict_detected", nullable = false, updatable = false)
    private boolean conflictDetected;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_action", updatable = false, length = 20)
    private ResolutionAction resolutionAction;

    @Column(name = "error_message", updatable = false, length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static SyncLogEntryEntity fromDomain(SyncLogEntry entry) {
        SyncLogEntryEntity entity = new SyncLogEntryEntity();
        entity.userId = entry.userId();
        entity.deviceId = entry.deviceId();
        entity.entityType = entry.entityType();
        entity.entityId = entry.entityId();
        entity.operation = entry.operation();
        entity.status = entry.status();
        entity.dataBefore = entry.dataBefore();
        entity.dataAfter = entry.dataAfter();
        entity.conflictDetected = entry.conflictDetected();
        entity.resolutionAction = entry.resolutionAction();
        entity.errorMessage = entry.errorMessage();
        entity.createdAt = entry.createdAt();
        return entity;
    }


    public SyncLogEntry toDomain() {
        return new SyncLogEntry(id, userId, deviceId, entityType, entityId, operation, status,
                dataBefore, dataAfter, conflictDetected, resolutionAction, errorMessage, createdAt);
    }
}
