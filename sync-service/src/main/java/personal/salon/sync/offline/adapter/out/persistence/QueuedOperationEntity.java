package personal.salon.sync.offline.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.sync.common.persistence.JsonMapConverter;
import personal.salon.sync.offline.domain.model.OperationStatus;
import personal.salon.sync.offline.domain.model.OperationType;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Offline Operation JPA Entity
 */
@Entity
@Table(name = "offline_operations",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_user_device_idempotency",
                        columnNames = {"user_id", "device_id", "idempotency_key"})
        },
        indexes = {
                @Index(name = "idx_status_priority_created", columnList = "status, priority, created_at"),
                @Index(name = "idx_user_created", columnList = "user_id, created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class QueuedOperationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "device_id", nullable = false, updatable = false, length = 128)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, updatable = false, length = 30)
    private OperationType operationType;

    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 128)
    private String idempotencyKey;

    @Convert(converter = JsonMapConverter.class)
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> payload;

    @Column(nullable = false)
    private int priority;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OperationStatus status;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Version
    private Long version;

    public static QueuedOperationEntity fromDomain(QueuedOperation operation) {
        QueuedOperationEntity entity = new QueuedOperationEntity();
        entity.id = operation.id();
        entity.userId = operation.userId();
        entity.deviceId = operation.deviceId();
        entity.operationType = operation.operationType();
        entity.idempotencyKey = operation.idempotencyKey();
        entity.payload = operation.payload();
        entity.priority = operation.priority();
        entity.retryCount = operation.retryCount();
        entity.maxRetries = operation.maxRetries();
        entity.status = operation.status();
        entity.nextRetryAt = operation.nextRetryAt();
        entity.claimedAt = operation.claimedAt();
        entity.errorMessage = operation.errorMessage();
        entity.createdAt = operation.createdAt();
        entity.processedAt = operation.processedAt();
        entity.version = operation.version();
        return entity;
    }


    public QueuedOperation toDomain() {
        return new QueuedOperation(id, userId, deviceId, operationType, idempotencyKey, payload, priority,
                retryCount, maxRetries, status, nextRetryAt, claimedAt, errorMessage, createdAt, processedAt, version);
    }
}
