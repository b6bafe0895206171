package personal.salon.sync.notification.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 디바이스별 전달 결과
 */
public enum DeliveryOutcome {
    SENT,
    FAILED,
    EXPIRED;

    public static DeliveryOutcome from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Delivery outcome cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown delivery outcome: " + value);
        }
    }
}
