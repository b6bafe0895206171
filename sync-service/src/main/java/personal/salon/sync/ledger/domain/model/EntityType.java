package personal.salon.sync.ledger.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.util.Locale;

/**
 * 동기화 대상 엔티티 타입
 */
public enum EntityType {
    BOOKING,
    PROFILE,
    PREFERENCES;

    public static EntityType from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.UNKNOWN_ENTITY_TYPE, "Entity type cannot be null or blank");
        }
        try {
            return EntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNKNOWN_ENTITY_TYPE, String.format("Unknown entity type: %s", value));
        }
    }
}
