package personal.salon.sync.notification.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 푸시 전송 실패
 * 토큰 누락(PUSH_TOKEN_MISSING)은 4xx 계열이라 Circuit 실패로 집계되지 않음
 */
public class PushDeliveryException extends BusinessException {

    public PushDeliveryException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static PushDeliveryException missingToken(Long notificationId, String deviceId) {
        return new PushDeliveryException(ErrorCode.PUSH_TOKEN_MISSING,
                String.format("No push token: notificationId=%d, deviceId=%s", notificationId, deviceId));
    }
}
