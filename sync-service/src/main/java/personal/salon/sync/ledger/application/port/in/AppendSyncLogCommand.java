package personal.salon.sync.ledger.application.port.in;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.ledger.domain.event.SyncableEntityChangedEvent;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.ResolutionAction;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.util.Map;
import java.util.UUID;

/**
 * 원장 기록 Command
 */
public record AppendSyncLogCommand(
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

    public AppendSyncLogCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (entityType == null || operation == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entity type and operation are required");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entity ID cannot be null or blank");
        }
        if (status == null) {
            status = SyncStatus.COMPLETED;
        }
    }

    public static AppendSyncLogCommand from(SyncableEntityChangedEvent event) {
        return new AppendSyncLogCommand(
                event.userId(),
                event.deviceId(),
                event.entityType(),
                event.entityId(),
                event.operation(),
                event.status(),
                event.dataBefore(),
                event.dataAfter(),
                event.conflictDetected(),
                event.resolutionAction(),
                event.errorMessage());
    }
}
