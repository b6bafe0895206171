package personal.salon.sync.device.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.device.application.port.in.ManageDeviceUseCase;
import personal.salon.sync.device.application.port.in.RegisterDeviceCommand;
import personal.salon.sync.device.application.port.in.RegisterDeviceUseCase;
import personal.salon.sync.device.application.port.out.DeviceRepository;
import personal.salon.sync.device.domain.exception.DeviceNotFoundException;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.service.DeviceRegistrar;

import java.util.List;
import java.util.UUID;

/**
 * Device Registry Service
 * 사용자-디바이스 레코드 관리 및 플랫폼별 Primary 선출
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceRegistryService implements RegisterDeviceUseCase, ManageDeviceUseCase, GetDevicesUseCase {

    private final DeviceRegistrar deviceRegistrar;
    private final DeviceRepository deviceRepository;

    @Override
    public Device registerOrRefresh(RegisterDeviceCommand command) {
        try {
            return deviceRegistrar.registerInTransaction(command, true);
        } catch (DataIntegrityViolationException e) {
            // 동시 등록으로 Primary 선출 또는 (user, device) 유일성 경합 발생 → Primary 없이 1회 재시도
            log.warn("Concurrent device registration detected, retrying without primary election: userId={}, deviceId={}",
                    command.userId(), command.deviceId());
            return deviceRegistrar.registerInTransaction(command, false);
        }
    }

    @Override
    public Device unregister(UUID userId, String deviceId) {
        return deviceRegistrar.unregisterInTransaction(userId, deviceId);
    }

    @Override
    public Device promoteToPrimary(UUID userId, String deviceId) {
        return deviceRegistrar.promoteInTransaction(userId, deviceId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Device> getActiveDevices(UUID userId) {
        return deviceRepository.findActiveByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Device getDevice(UUID userId, String deviceId) {
        return deviceRepository.findByUserIdAndDeviceId(userId, deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(userId, deviceId));
    }
}
