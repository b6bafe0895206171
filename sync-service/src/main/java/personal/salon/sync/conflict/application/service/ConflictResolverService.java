package personal.salon.sync.conflict.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.conflict.application.port.in.ResolveConflictCommand;
import personal.salon.sync.conflict.application.port.in.ResolveConflictUseCase;
import personal.salon.sync.conflict.application.port.out.EntityStatePort;
import personal.salon.sync.conflict.domain.model.ConflictResolution;
import personal.salon.sync.conflict.domain.model.ServerState;
import personal.salon.sync.conflict.domain.service.LastWriterWinsPolicy;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogCommand;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogUseCase;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncStatus;
import personal.salon.sync.ledger.domain.model.SyncTimestamps;

import java.time.Instant;

/**
 * Conflict Resolver Service
 * 판정 시점의 최신 커밋 상태를 기준으로 Last-Writer-Wins 적용
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictResolverService implements ResolveConflictUseCase {

    private final EntityStatePort entityStatePort;
    private final LastWriterWinsPolicy lastWriterWinsPolicy;
    private final GetDevicesUseCase getDevicesUseCase;
    private final AppendSyncLogUseCase appendSyncLogUseCase;

    @Override
    @Transactional
    public ConflictResolution resolve(ResolveConflictCommand command) {
        ConflictResolution resolution = decide(command);

        appendSyncLogUseCase.append(new AppendSyncLogCommand(
                command.userId(),
                command.deviceId(),
                command.entityType(),
                command.entityId(),
                SyncOperation.SYNC,
                SyncStatus.COMPLETED,
                resolution.serverValue(),
                resolution.resolvedValue(),
                resolution.conflictDetected(),
                resolution.action(),
                null));

        return resolution;
    }

    @Override
    @Transactional(readOnly = true)
    public ConflictResolution decide(ResolveConflictCommand command) {
        // 디바이스 귀속 확인 (DeviceNotFoundException 전파)
        getDevicesUseCase.getDevice(command.userId(), command.deviceId());

        Instant incomingUpdatedAt = SyncTimestamps.updatedAtOf(command.payload())
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_SYNC_PAYLOAD,
                        String.format("Payload requires a valid updated_at: entityId=%s", command.entityId())));

        ServerState server = entityStatePort.currentState(command.entityType(), command.entityId())
                .orElse(null);

        Instant deviceLastKnown = SyncTimestamps.lastSyncedAtOf(command.payload())
                .or(() -> entityStatePort.lastObservedBy(
                        command.userId(), command.entityType(), command.entityId(), command.deviceId()))
                .orElse(null);

        ConflictResolution resolution = lastWriterWinsPolicy.decide(
                command.value(), incomingUpdatedAt, server, deviceLastKnown);

        if (resolution.conflictDetected()) {
            log.info("Conflict detected: entityType={}, entityId={}, deviceId={}, action={}, incomingUpdatedAt={}, serverUpdatedAt={}",
                    command.entityType(), command.entityId(), command.deviceId(), resolution.action(),
                    incomingUpdatedAt, server != null ? server.updatedAt() : null);
        } else {
            log.debug("No conflict: entityType={}, entityId={}, deviceId={}, action={}",
                    command.entityType(), command.entityId(), command.deviceId(), resolution.action());
        }
        return resolution;
    }
}
