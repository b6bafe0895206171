package personal.salon.sync.device.application.port.out;

import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.Platform;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Device Repository (Output Port)
 */
public interface DeviceRepository {

    Device save(Device device);

    Optional<Device> findByUserIdAndDeviceId(UUID userId, String deviceId);

    /**
     * 사용자의 활성 디바이스 목록 (last_seen_at 내림차순)
     */
    List<Device> findActiveByUserId(UUID userId);

    boolean existsActivePrimary(UUID userId, Platform platform);

    Optional<Device> findActivePrimary(UUID userId, Platform platform);

    /**
     * Primary 승계 후보: 동일 플랫폼에서 가장 최근에 접속한 활성 디바이스
     */
    Optional<Device> findMostRecentlySeenActive(UUID userId, Platform platform, String excludeDeviceId);
}
