package personal.salon.sync.device.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.salon.sync.device.application.port.in.RegisterDeviceCommand;
import personal.salon.sync.device.domain.model.DeviceMetadata;
import personal.salon.sync.device.domain.model.Platform;

import java.util.Map;
import java.util.UUID;

/**
 * 디바이스 등록 요청 DTO
 */
public record RegisterDeviceRequest(
        @NotBlank(message = "디바이스 ID는 필수입니다.")
        @Size(max = 128, message = "디바이스 ID는 128자 이하여야 합니다.")
        String deviceId,

        @NotBlank(message = "플랫폼은 필수입니다.")
        String platform,

        String deviceName,
        String appVersion,
        String osVersion,
        String pushToken,
        Map<String, Object> preferences
) {
    public RegisterDeviceCommand toCommand(UUID userId) {
        return new RegisterDeviceCommand(
                userId,
                deviceId,
                Platform.from(platform),
                new DeviceMetadata(deviceName, appVersion, osVersion, pushToken, preferences));
    }
}
