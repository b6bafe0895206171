package personal.salon.sync.ledger.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Sync Log Entry Domain Model
 * 동기화 원장의 한 줄 (append-only, 불변)
 *
 * @param deviceId 서버 측 쓰기(디바이스 없음)이면 null
 */
public record SyncLogEntry(
        Long id,
        UUID userId,
        String deviceId,
        EntityType entityType,
        String entityId,
        SyncOperation operation,
        SyncStatus status,
        Map<String, Object> dataBefore,
        Map<String, Object> dataAfter,
        boolean conflictDetected,
        ResolutionAction resolutionAction,
        String errorMessage,
        Instant createdAt) {

    public SyncLogEntry {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (entityType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entity type cannot be null");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entity ID cannot be null or blank");
        }
        if (operation == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Operation cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Status cannot be null");
        }
    }

    /**
     * 원장 기록 생성 (id는 저장 시 부여)
     */
    public static SyncLogEntry append(UUID userId, String deviceId, EntityType entityType, String entityId,
                                      SyncOperation operation, SyncStatus status,
                                      Map<String, Object> dataBefore, Map<String, Object> dataAfter,
                                      boolean conflictDetected, ResolutionAction resolutionAction,
                                      String errorMessage, Instant now) {
        return new SyncLogEntry(null, userId, deviceId, entityType, entityId, operation, status,
                dataBefore, dataAfter, conflictDetected, resolutionAction, errorMessage, now);
    }

    /**
     * 엔티티의 현재 상태를 나타내는 기록인지 (완료 + 상태 보유)
     */
    public boolean carriesState() {
        return status == SyncStatus.COMPLETED && (dataAfter != null || operation == SyncOperation.DELETE);
    }

    /**
     * DELETE로 종결된 엔티티 여부
     */
    public boolean isDeletion() {
        return operation == SyncOperation.DELETE;
    }
}
