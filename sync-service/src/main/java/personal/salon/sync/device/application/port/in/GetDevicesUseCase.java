package personal.salon.sync.device.application.port.in;

import personal.salon.sync.device.domain.model.Device;

import java.util.List;
import java.util.UUID;

/**
 * Get Devices UseCase (Input Port)
 */
public interface GetDevicesUseCase {

    List<Device> getActiveDevices(UUID userId);

    /**
     * @throws personal.salon.sync.device.domain.exception.DeviceNotFoundException 디바이스가 없을 때
     */
    Device getDevice(UUID userId, String deviceId);
}
