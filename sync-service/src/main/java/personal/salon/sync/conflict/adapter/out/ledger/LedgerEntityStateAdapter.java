package personal.salon.sync.conflict.adapter.out.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.sync.conflict.application.port.out.EntityStatePort;
import personal.salon.sync.conflict.domain.model.ServerState;
import personal.salon.sync.ledger.application.port.in.QuerySyncLedgerUseCase;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;
import personal.salon.sync.ledger.domain.model.SyncTimestamps;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * 원장 기반 EntityStatePort 구현
 * 최신 COMPLETED 기록의 data_after가 현재 값, updated_at이 없으면 기록 시각 사용
 */
@Component
@RequiredArgsConstructor
public class LedgerEntityStateAdapter implements EntityStatePort {

    private final QuerySyncLedgerUseCase querySyncLedgerUseCase;

    @Override
    public Optional<ServerState> currentState(EntityType entityType, String entityId) {
        return querySyncLedgerUseCase.latestState(entityType, entityId)
                .filter(entry -> !entry.isDeletion())
                .map(entry -> new ServerState(entry.dataAfter(), observedAt(entry)));
    }

    @Override
    public Optional<Instant> lastObservedBy(UUID userId, EntityType entityType, String entityId, String deviceId) {
        return querySyncLedgerUseCase.latestByDevice(userId, entityType, entityId, deviceId)
                .map(LedgerEntityStateAdapter::observedAt);
    }

    private static Instant observedAt(SyncLogEntry entry) {
        return SyncTimestamps.updatedAtOf(entry.dataAfter()).orElse(entry.createdAt());
    }
}
