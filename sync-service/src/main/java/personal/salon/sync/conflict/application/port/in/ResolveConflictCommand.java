package personal.salon.sync.conflict.application.port.in;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncTimestamps;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 충돌 판정 Command
 *
 * @param payload 수신 값, updated_at 필수 / last_synced_at 선택
 */
public record ResolveConflictCommand(
        UUID userId,
        String deviceId,
        EntityType entityType,
        String entityId,
        Map<String, Object> payload) {

    public ResolveConflictCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Device ID cannot be null or blank");
        }
        if (entityType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entity type cannot be null");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entity ID cannot be null or blank");
        }
        if (payload == null) {
            throw new BusinessException(ErrorCode.INVALID_SYNC_PAYLOAD, "Payload cannot be null");
        }
    }

    /**
     * 동기화 메타데이터(last_synced_at)를 제외한 엔티티 값
     */
    public Map<String, Object> value() {
        Map<String, Object> value = new LinkedHashMap<>(payload);
        value.remove(SyncTimestamps.LAST_SYNCED_AT);
        return value;
    }
}
