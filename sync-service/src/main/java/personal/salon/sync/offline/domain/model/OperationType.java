package personal.salon.sync.offline.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.util.Locale;

/**
 * 오프라인 작업 유형
 */
public enum OperationType {
    CREATE_BOOKING,
    UPDATE_PROFILE,
    CANCEL_BOOKING,
    UPDATE_PREFERENCES;

    /**
     * "create_booking", "CREATE_BOOKING" 모두 허용
     */
    public static OperationType from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.UNKNOWN_OPERATION_TYPE, "Operation type cannot be null or blank");
        }
        try {
            return OperationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNKNOWN_OPERATION_TYPE,
                    String.format("Unknown operation type: %s", value));
        }
    }
}
