package personal.salon.sync.notification.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.notification.domain.model.NotificationStatus;

public class InvalidNotificationStateException extends BusinessException {
    public InvalidNotificationStateException(Long notificationId, NotificationStatus status, String action) {
        super(ErrorCode.INVALID_NOTIFICATION_STATE,
                String.format("Cannot %s notification in %s state: id=%d", action, status, notificationId));
    }
}
