package personal.salon.sync.device.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Device Domain Model
 * 사용자 한 명의 클라이언트 인스턴스 (불변)
 * 하드 삭제 없이 active 플래그로 비활성화
 */
public record Device(
        Long id,
        UUID userId,
        String deviceId,
        Platform platform,
        String deviceName,
        String appVersion,
        String osVersion,
        String pushToken,
        boolean active,
        boolean primary,
        Instant lastSeenAt,
        Map<String, Object> preferences,
        Instant createdAt) {

    public Device {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Device ID cannot be null or blank");
        }
        if (platform == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Platform cannot be null");
        }
        preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
    }

    /**
     * 최초 등록
     *
     * @param primary 해당 플랫폼의 첫 활성 디바이스이면 true
     */
    public static Device register(UUID userId, String deviceId, Platform platform,
                                  DeviceMetadata metadata, boolean primary, Instant now) {
        return new Device(
                null,
                userId,
                deviceId,
                platform,
                metadata.deviceName(),
                metadata.appVersion(),
                metadata.osVersion(),
                metadata.pushToken(),
                true,
                primary,
                now,
                metadata.preferences(),
                now);
    }

    /**
     * 재등록/하트비트 (메타데이터 갱신, last_seen_at 갱신, 재활성화)
     *
     * @param electPrimary 재활성화 시 플랫폼에 Primary가 없으면 true
     */
    public Device refresh(DeviceMetadata metadata, boolean electPrimary, Instant now) {
        return new Device(
                id,
                userId,
                deviceId,
                platform,
                metadata.deviceName() != null ? metadata.deviceName() : deviceName,
                metadata.appVersion() != null ? metadata.appVersion() : appVersion,
                metadata.osVersion() != null ? metadata.osVersion() : osVersion,
                metadata.pushToken() != null ? metadata.pushToken() : pushToken,
                true,
                primary || electPrimary,
                now,
                metadata.preferences() != null ? metadata.preferences() : preferences,
                createdAt);
    }

    /**
     * 클라이언트 등록 해제 (soft delete)
     * 비활성 디바이스는 Primary가 될 수 없음
     */
    public Device deactivate(Instant now) {
        return new Device(id, userId, deviceId, platform, deviceName, appVersion, osVersion, pushToken,
                false, false, now, preferences, createdAt);
    }

    public Device promote() {
        if (!active) {
            throw new BusinessException(ErrorCode.DEVICE_INACTIVE,
                    String.format("Inactive device cannot be primary: deviceId=%s", deviceId));
        }
        return new Device(id, userId, deviceId, platform, deviceName, appVersion, osVersion, pushToken,
                true, true, lastSeenAt, preferences, createdAt);
    }

    public Device demote() {
        return new Device(id, userId, deviceId, platform, deviceName, appVersion, osVersion, pushToken,
                active, false, lastSeenAt, preferences, createdAt);
    }

    public boolean hasPushToken() {
        return pushToken != null && !pushToken.isBlank();
    }
}
