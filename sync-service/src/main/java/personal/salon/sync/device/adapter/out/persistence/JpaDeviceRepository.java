package personal.salon.sync.device.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.salon.sync.device.domain.model.Platform;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Device
 */
public interface JpaDeviceRepository extends JpaRepository<DeviceEntity, Long> {

    Optional<DeviceEntity> findByUserIdAndDeviceId(UUID userId, String deviceId);

    List<DeviceEntity> findByUserIdAndActiveTrueOrderByLastSeenAtDesc(UUID userId);

    boolean existsByUserIdAndPlatformAndActiveTrueAndPrimaryTrue(UUID userId, Platform platform);

    Optional<DeviceEntity> findFirstByUserIdAndPlatformAndActiveTrueAndPrimaryTrue(UUID userId, Platform platform);

    /**
     * Primary 승계 후보 조회 (해제 대상 디바이스 제외)
     */
    Optional<DeviceEntity> findFirstByUserIdAndPlatformAndActiveTrueAndDeviceIdNotOrderByLastSeenAtDesc(
            UUID userId, Platform platform, String deviceId);
}
