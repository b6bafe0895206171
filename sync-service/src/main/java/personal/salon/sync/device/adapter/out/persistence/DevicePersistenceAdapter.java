package personal.salon.sync.device.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.sync.device.application.port.out.DeviceRepository;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.Platform;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Device Persistence Adapter
 * DeviceRepository 구현체
 *
 * saveAndFlush: Primary 해제 → 승격 순서를 DB에 그대로 반영하고,
 * Unique 제약 위반을 호출한 트랜잭션 안에서 즉시 드러내기 위함
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DevicePersistenceAdapter implements DeviceRepository {

    private final JpaDeviceRepository jpaDeviceRepository;
    private final Clock clock;

    @Override
    public Device save(Device device) {
        log.debug("Saving device: userId={}, deviceId={}, active={}, primary={}",
                device.userId(), device.deviceId(), device.active(), device.primary());
        DeviceEntity saved = jpaDeviceRepository.saveAndFlush(DeviceEntity.fromDomain(device, clock.instant()));
        return saved.toDomain();
    }

    @Override
    public Optional<Device> findByUserIdAndDeviceId(UUID userId, String deviceId) {
        return jpaDeviceRepository.findByUserIdAndDeviceId(userId, deviceId)
                .map(DeviceEntity::toDomain);
    }

    @Override
    public List<Device> findActiveByUserId(UUID userId) {
        return jpaDeviceRepository.findByUserIdAndActiveTrueOrderByLastSeenAtDesc(userId)
                .stream()
                .map(DeviceEntity::toDomain)
                .toList();
    }

    @Override
    public boolean existsActivePrimary(UUID userId, Platform platform) {
        return jpaDeviceRepository.existsByUserIdAndPlatformAndActiveTrueAndPrimaryTrue(userId, platform);
    }

    @Override
    public Optional<Device> findActivePrimary(UUID userId, Platform platform) {
        return jpaDeviceRepository.findFirstByUserIdAndPlatformAndActiveTrueAndPrimaryTrue(userId, platform)
                .map(DeviceEntity::toDomain);
    }

    @Override
    public Optional<Device> findMostRecentlySeenActive(UUID userId, Platform platform, String excludeDeviceId) {
        return jpaDeviceRepository
                .findFirstByUserIdAndPlatformAndActiveTrueAndDeviceIdNotOrderByLastSeenAtDesc(
                        userId, platform, excludeDeviceId)
                .map(DeviceEntity::toDomain);
    }
}
