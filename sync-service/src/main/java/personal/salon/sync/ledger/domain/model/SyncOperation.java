package personal.salon.sync.ledger.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.util.Locale;

/**
 * 원장에 기록되는 변경 유형
 * SYNC: 충돌 해결 결과 기록
 */
public enum SyncOperation {
    CREATE,
    UPDATE,
    DELETE,
    SYNC;

    public static SyncOperation from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Operation cannot be null or blank");
        }
        try {
            return SyncOperation.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, String.format("Unknown sync operation: %s", value));
        }
    }
}
