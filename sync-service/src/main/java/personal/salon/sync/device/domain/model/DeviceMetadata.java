package personal.salon.sync.device.domain.model;

import java.util.Map;

/**
 * 디바이스 표시용 메타데이터 및 푸시 토큰
 * null 필드는 갱신 시 기존 값을 유지
 */
public record DeviceMetadata(
        String deviceName,
        String appVersion,
        String osVersion,
        String pushToken,
        Map<String, Object> preferences
) {
    public static DeviceMetadata empty() {
        return new DeviceMetadata(null, null, null, null, null);
    }
}
