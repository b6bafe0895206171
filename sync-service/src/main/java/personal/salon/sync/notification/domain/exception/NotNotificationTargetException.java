package personal.salon.sync.notification.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public class NotNotificationTargetException extends BusinessException {
    public NotNotificationTargetException(Long notificationId, String deviceId) {
        super(ErrorCode.NOT_NOTIFICATION_TARGET,
                String.format("Device is not a target of notification: id=%d, deviceId=%s", notificationId, deviceId));
    }
}
