package personal.salon.sync.device.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.sync.common.persistence.JsonMapConverter;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.Platform;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Device JPA Entity
 * 디바이스 테이블 매핑
 *
 * primary_slot: Primary이면 TRUE, 아니면 NULL
 * MySQL Unique Index는 NULL 중복을 허용하므로 (user_id, platform, primary_slot) 조합으로
 * "플랫폼별 Primary 최대 1개"를 DB 레벨에서 보장
 */
@Entity
@Table(name = "devices",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_user_device", columnNames = {"user_id", "device_id"}),
                @UniqueConstraint(name = "uk_user_platform_primary", columnNames = {"user_id", "platform", "primary_slot"})
        },
        indexes = {
                @Index(name = "idx_user_active", columnList = "user_id, is_active")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeviceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "device_id", nullable = false, updatable = false, length = 128)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "device_name", length = 100)
    private String deviceName;

    @Column(name = "app_version", length = 50)
    private String appVersion;

    @Column(name = "os_version", length = 50)
    private String osVersion;

    @Column(name = "push_token", length = 512)
    private String pushToken;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    @Column(name = "primary_slot")
    private Boolean primarySlot;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "preferences", columnDefinition = "TEXT")
    private Map<String, Object> preferences;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     *
     * @param savedAt 주입된 Clock 기준 저장 시각 (updated_at)
     */
    public static DeviceEntity fromDomain(Device device, Instant savedAt) {
        DeviceEntity entity = new DeviceEntity();
        entity.id = device.id();
        entity.userId = device.userId();
        entity.deviceId = device.deviceId();
        entity.platform = device.platform();
        entity.deviceName = device.deviceName();
        entity.appVersion = device.appVersion();
        entity.osVersion = device.osVersion();
        entity.pushToken = device.pushToken();
        entity.active = device.active();
        entity.primary = device.primary();
        entity.primarySlot = device.primary() ? Boolean.TRUE : null;
        entity.lastSeenAt = device.lastSeenAt();
        entity.preferences = device.preferences();
        entity.createdAt = device.createdAt();
        entity.updatedAt = savedAt;
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Device toDomain() {
        return new Device(id, userId, deviceId, platform, deviceName, appVersion, osVersion, pushToken,
                active, primary, lastSeenAt, preferences, createdAt);
    }
}
