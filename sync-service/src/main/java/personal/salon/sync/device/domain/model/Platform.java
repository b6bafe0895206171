package personal.salon.sync.device.domain.model;

import personal.salon.sync.device.domain.exception.UnknownPlatformException;

import java.util.Locale;

/**
 * Device Platform
 * 플랫폼별로 Primary 디바이스가 하나씩 선출됨
 */
public enum Platform {
    WEB,
    IOS,
    ANDROID;

    /**
     * 클라이언트가 보낸 문자열을 Platform으로 변환 (대소문자 무시)
     *
     * @throws UnknownPlatformException 지원하지 않는 값일 때
     */
    public static Platform from(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownPlatformException(value);
        }
        try {
            return Platform.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownPlatformException(value);
        }
    }
}
