package personal.salon.sync.ledger.domain.event;

import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.ResolutionAction;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.util.Map;
import java.util.UUID;

/**
 * 동기화 대상 엔티티 변경 이벤트
 * 쓰기 경로가 발행하고, 원장 리스너가 발행자의 트랜잭션 안에서 정확히 한 줄을 기록
 */
public record SyncableEntityChangedEvent(
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
        String errorMessage) {

    /**
     * 소유 쓰기 경로의 변경 (data_after만 기록)
     */
    public static SyncableEntityChangedEvent selfWrite(UUID userId, String deviceId, EntityType entityType,
                                                       String entityId, SyncOperation operation,
                                                       Map<String, Object> dataAfter) {
        return new SyncableEntityChangedEvent(userId, deviceId, entityType, entityId, operation,
                SyncStatus.COMPLETED, null, dataAfter, false, null, null);
    }

    /**
     * 충돌 판정을 거친 변경 (이전/이후 상태와 판정 결과 기록)
     */
    public static SyncableEntityChangedEvent resolved(UUID userId, String deviceId, EntityType entityType,
                                                      String entityId, SyncOperation operation,
                                                      Map<String, Object> dataBefore, Map<String, Object> dataAfter,
                                                      boolean conflictDetected, ResolutionAction resolutionAction) {
        return new SyncableEntityChangedEvent(userId, deviceId, entityType, entityId, operation,
                SyncStatus.COMPLETED, dataBefore, dataAfter, conflictDetected, resolutionAction, null);
    }
}
