package personal.salon.sync.ledger.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogCommand;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.ResolutionAction;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.util.Map;
import java.util.UUID;

/**
 * 외부 쓰기 경로의 원장 기록 요청
 */
public record AppendSyncLogRequest(
        @Size(max = 128)
        String deviceId,

        @NotBlank(message = "entityType은 필수입니다.")
        String entityType,

        @NotBlank(message = "entityId는 필수입니다.")
        @Size(max = 128)
        String entityId,

        @NotBlank(message = "operation은 필수입니다.")
        String operation,

        SyncStatus status,
        Map<String, Object> dataBefore,
        Map<String, Object> dataAfter,
        boolean conflictDetected,
        ResolutionAction resolutionAction,

        @Size(max = 1000)
        String errorMessage
) {
    public AppendSyncLogCommand toCommand(UUID userId) {
        return new AppendSyncLogCommand(
                userId,
                deviceId,
                EntityType.from(entityType),
                entityId,
                SyncOperation.from(operation),
                status,
                dataBefore,
                dataAfter,
                conflictDetected,
                resolutionAction,
                errorMessage);
    }
}
