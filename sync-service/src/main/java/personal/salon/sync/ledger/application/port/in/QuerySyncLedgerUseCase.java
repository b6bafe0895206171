package personal.salon.sync.ledger.application.port.in;

import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Query Sync Ledger Use Case
 */
public interface QuerySyncLedgerUseCase {

    /**
     * 엔티티 변경 이력 (커밋 순서)
     */
    List<SyncLogEntry> history(EntityType entityType, String entityId);

    /**
     * 엔티티의 현재 서버 상태를 담은 최신 기록
     * DELETE 기록이면 엔티티는 존재하지 않는 것으로 취급
     */
    Optional<SyncLogEntry> latestState(EntityType entityType, String entityId);

    /**
     * 사용자의 디바이스가 해당 엔티티에 대해 남긴 최신 기록
     * 디바이스 ID는 사용자 단위로만 유일
     */
    Optional<SyncLogEntry> latestByDevice(UUID userId, EntityType entityType, String entityId, String deviceId);

    /**
     * 최근 days일 동안의 동기화 성공률 (%), 기록이 없으면 0
     */
    BigDecimal successRate(UUID userId, int days);
}
