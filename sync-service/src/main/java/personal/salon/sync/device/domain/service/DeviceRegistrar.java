package personal.salon.sync.device.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.device.application.port.in.RegisterDeviceCommand;
import personal.salon.sync.device.application.port.out.DeviceRepository;
import personal.salon.sync.device.domain.exception.DeviceNotFoundException;
import personal.salon.sync.device.domain.model.Device;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Device Domain Service (Transaction Manager)
 * 등록/해제/Primary 전환을 트랜잭션 단위로 실행
 * Primary 유일성은 DB Unique Index (user_id, platform, primary_slot)가 최종 보장
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceRegistrar {

    private final DeviceRepository deviceRepository;
    private final Clock clock;

    /**
     * 등록 또는 갱신 (단일 write)
     *
     * @param allowPrimaryElection false면 Primary 선출 없이 저장 (선출 경합에서 밀린 재시도)
     */
    @Transactional
    public Device registerInTransaction(RegisterDeviceCommand command, boolean allowPrimaryElection) {
        Instant now = Instant.now(clock);

        return deviceRepository.findByUserIdAndDeviceId(command.userId(), command.deviceId())
                .map(existing -> {
                    boolean electPrimary = allowPrimaryElection
                            && !existing.active()
                            && !deviceRepository.existsActivePrimary(command.userId(), command.platform());
                    Device refreshed = existing.refresh(command.metadata(), electPrimary, now);
                    log.debug("Refreshing device: userId={}, deviceId={}, primary={}",
                            command.userId(), command.deviceId(), refreshed.primary());
                    return deviceRepository.save(refreshed);
                })
                .orElseGet(() -> {
                    boolean electPrimary = allowPrimaryElection
                            && !deviceRepository.existsActivePrimary(command.userId(), command.platform());
                    Device created = Device.register(command.userId(), command.deviceId(), command.platform(),
                            command.metadata(), electPrimary, now);
                    log.info("Registering new device: userId={}, deviceId={}, platform={}, primary={}",
                            command.userId(), command.deviceId(), command.platform(), electPrimary);
                    return deviceRepository.save(created);
                });
    }

    @Transactional
    public Device unregisterInTransaction(UUID userId, String deviceId) {
        Device device = deviceRepository.findByUserIdAndDeviceId(userId, deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(userId, deviceId));

        if (!device.active()) {
            log.debug("Device already inactive: userId={}, deviceId={}", userId, deviceId);
            return device;
        }

        Device deactivated = deviceRepository.save(device.deactivate(Instant.now(clock)));

        // Primary 승계
        if (device.primary()) {
            deviceRepository.findMostRecentlySeenActive(userId, device.platform(), deviceId)
                    .ifPresent(successor -> {
                        deviceRepository.save(successor.promote());
                        log.info("Primary handed over: userId={}, platform={}, from={}, to={}",
                                userId, device.platform(), deviceId, successor.deviceId());
                    });
        }
        return deactivated;
    }

    @Transactional
    public Device promoteInTransaction(UUID userId, String deviceId) {
        Device device = deviceRepository.findByUserIdAndDeviceId(userId, deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(userId, deviceId));

        if (device.primary()) {
            return device;
        }

        // 기존 Primary 해제 후 승격 (Unique Index 위반 방지를 위해 flush 순서 유지)
        deviceRepository.findActivePrimary(userId, device.platform())
                .ifPresent(current -> deviceRepository.save(current.demote()));

        return deviceRepository.save(device.promote());
    }
}
