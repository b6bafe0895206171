package personal.salon.sync.conflict.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.salon.sync.conflict.application.port.in.ResolveConflictCommand;
import personal.salon.sync.ledger.domain.model.EntityType;

import java.util.Map;
import java.util.UUID;

/**
 * 충돌 판정 요청
 */
public record ResolveConflictRequest(
        @NotBlank(message = "deviceId는 필수입니다.")
        @Size(max = 128)
        String deviceId,

        @NotBlank(message = "entityType은 필수입니다.")
        String entityType,

        @NotBlank(message = "entityId는 필수입니다.")
        @Size(max = 128)
        String entityId,

        @NotNull(message = "payload는 필수입니다.")
        Map<String, Object> payload
) {
    public ResolveConflictCommand toCommand(UUID userId) {
        return new ResolveConflictCommand(userId, deviceId, EntityType.from(entityType), entityId, payload);
    }
}
