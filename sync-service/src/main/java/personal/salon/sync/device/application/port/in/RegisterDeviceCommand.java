package personal.salon.sync.device.application.port.in;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.device.domain.model.DeviceMetadata;
import personal.salon.sync.device.domain.model.Platform;

import java.util.UUID;

/**
 * Register Device Command
 * 디바이스 최초 등록 또는 재등록(하트비트) 커맨드
 */
public record RegisterDeviceCommand(
        UUID userId,
        String deviceId,
        Platform platform,
        DeviceMetadata metadata
) {
    public RegisterDeviceCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Device ID cannot be null or blank");
        }
        if (platform == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Platform cannot be null");
        }
        if (metadata == null) {
            metadata = DeviceMetadata.empty();
        }
    }
}
