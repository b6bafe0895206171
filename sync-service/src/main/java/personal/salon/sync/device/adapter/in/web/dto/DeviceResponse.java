package personal.salon.sync.device.adapter.in.web.dto;

import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.Platform;

import java.time.Instant;

/**
 * 디바이스 응답 DTO (푸시 토큰은 노출하지 않음)
 */
public record DeviceResponse(
        String deviceId,
        Platform platform,
        String deviceName,
        String appVersion,
        String osVersion,
        boolean active,
        boolean primary,
        Instant lastSeenAt
) {
    public static DeviceResponse from(Device device) {
        return new DeviceResponse(
                device.deviceId(),
                device.platform(),
                device.deviceName(),
                device.appVersion(),
                device.osVersion(),
                device.active(),
                device.primary(),
                device.lastSeenAt());
    }
}
