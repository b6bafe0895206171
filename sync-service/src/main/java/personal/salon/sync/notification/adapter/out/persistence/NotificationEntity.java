package personal.salon.sync.notification.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.sync.common.persistence.JsonMapConverter;
import personal.salon.sync.common.persistence.JsonStringListConverter;
import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;
import personal.salon.sync.notification.domain.model.NotificationPriority;
import personal.salon.sync.notification.domain.model.NotificationStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Notification JPA Entity
 * delivery_status는 {deviceId: "SENT"|"FAILED"|"EXPIRED"} JSON으로 저장
 */
@Entity
@Table(name = "notifications",
        indexes = {
                @Index(name = "idx_notification_status_scheduled", columnList = "status, scheduled_at"),
                @Index(name = "idx_notification_user_created", columnList = "user_id, created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, length = 200)
    private String title;

    @Column(nullable = false, updatable = false, length = 2000)
    private String message;

    @Column(nullable = false, updatable = false, length = 50)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private NotificationPriority priority;

    @Convert(converter = JsonMapConverter.class)
    @Column(updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> data;

    @Convert(converter = JsonStringListConverter.class)
    @Column(name = "target_devices", nullable = false, updatable = false, columnDefinition = "TEXT")
    private List<String> targetDevices;

    @Convert(converter = JsonStringListConverter.class)
    @Column(name = "exclude_devices", nullable = false, updatable = false, columnDefinition = "TEXT")
    private List<String> excludeDevices;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "delivery_status", columnDefinition = "TEXT")
    private Map<String, Object> deliveryStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private NotificationStatus status;

    @Column(name = "scheduled_at", nullable = false, updatable = false)
    private Instant scheduledAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public static NotificationEntity fromDomain(Notification notification) {
        NotificationEntity entity = new NotificationEntity();
        entity.id = notification.id();
        entity.userId = notification.userId();
        entity.title = notification.title();
        entity.message = notification.message();
        entity.type = notification.type();
        entity.priority = notification.priority();
        entity.data = notification.data();
        entity.targetDevices = notification.targetDevices();
        entity.excludeDevices = notification.excludeDevices();
        entity.deliveryStatus = new LinkedHashMap<>();
        notification.deliveryStatus().forEach((deviceId, outcome) -> entity.deliveryStatus.put(deviceId, outcome.name()));
        entity.status = notification.status();
        entity.scheduledAt = notification.scheduledAt();
        entity.expiresAt = notification.expiresAt();
        entity.sentAt = notification.sentAt();
        entity.createdAt = notification.createdAt();
        entity.version = notification.version();
        return entity;
    }


    public Notification toDomain() {
        Map<String, DeliveryOutcome> outcomes = new LinkedHashMap<>();
        if (deliveryStatus != null) {
            deliveryStatus.forEach((deviceId, outcome) -> outcomes.put(deviceId, DeliveryOutcome.from(String.valueOf(outcome))));
        }
        return new Notification(id, userId, title, message, type, priority, data, targetDevices, excludeDevices,
                outcomes, status, scheduledAt, expiresAt, sentAt, createdAt, version);
    }
}
