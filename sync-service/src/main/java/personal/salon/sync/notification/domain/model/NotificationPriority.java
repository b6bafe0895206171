package personal.salon.sync.notification.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    public static NotificationPriority from(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown notification priority: " + value);
        }
    }
}
