package personal.salon.sync.device.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * Unknown Platform Exception
 * web / ios / android 이외의 플랫폼으로 등록을 시도할 때 발생
 */
public class UnknownPlatformException extends BusinessException {
    public UnknownPlatformException(String platform) {
        super(ErrorCode.UNKNOWN_PLATFORM, String.format("Unknown platform: %s", platform));
    }
}
