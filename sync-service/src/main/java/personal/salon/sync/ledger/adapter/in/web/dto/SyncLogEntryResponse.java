package personal.salon.sync.ledger.adapter.in.web.dto;

import personal.salon.sync.ledger.domain.model.SyncLogEntry;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 원장 기록 응답
 */
public record SyncLogEntryResponse(
        Long id,
        UUID userId,
        String deviceId,
        String entityType,
        String entityId,
        String operation,
        String status,
        Map<String, Object> dataBefore,
        Map<String, Object> dataAfter,
        boolean conflictDetected,
        String resolutionAction,
        String errorMessage,
        Instant createdAt
) {
    public static SyncLogEntryResponse from(SyncLogEntry entry) {
        return new SyncLogEntryResponse(
                entry.id(),
                entry.userId(),
                entry.deviceId(),
                entry.entityType().name(),
                entry.entityId(),
                entry.operation().name(),
                entry.status().name(),
                entry.dataBefore(),
                entry.dataAfter(),
                entry.conflictDetected(),
                entry.resolutionAction() != null ? entry.resolutionAction().wireValue() : null,
                entry.errorMessage(),
                entry.createdAt());
    }
}
