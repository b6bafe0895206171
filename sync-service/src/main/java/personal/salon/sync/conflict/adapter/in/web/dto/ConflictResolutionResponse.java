package personal.salon.sync.conflict.adapter.in.web.dto;

import personal.salon.sync.conflict.domain.model.ConflictResolution;

import java.util.Map;

/**
 * 충돌 판정 응답
 * action: "use_latest" | "keep_existing"
 */
public record ConflictResolutionResponse(
        boolean conflict,
        String action,
        Map<String, Object> resolvedValue
) {
    public static ConflictResolutionResponse from(ConflictResolution resolution) {
        return new ConflictResolutionResponse(
                resolution.conflictDetected(),
                resolution.action().wireValue(),
                resolution.resolvedValue());
    }
}
