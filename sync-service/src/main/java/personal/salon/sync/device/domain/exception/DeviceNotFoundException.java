package personal.salon.sync.device.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Device Not Found Exception
 */
public class DeviceNotFoundException extends BusinessException {
    public DeviceNotFoundException(UUID userId, String deviceId) {
        super(ErrorCode.DEVICE_NOT_FOUND,
                String.format("Device not found: userId=%s, deviceId=%s", userId, deviceId));
    }
}
