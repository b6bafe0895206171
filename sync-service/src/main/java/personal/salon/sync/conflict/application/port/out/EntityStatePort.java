package personal.salon.sync.conflict.application.port.out;

import personal.salon.sync.conflict.domain.model.ServerState;
import personal.salon.sync.ledger.domain.model.EntityType;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * 서버 측 현재 상태 조회 Port
 */
public interface EntityStatePort {

    /**
     * 최신 커밋 상태 (없거나 삭제되었으면 empty)
     */
    Optional<ServerState> currentState(EntityType entityType, String entityId);

    /**
     * 사용자의 디바이스가 해당 엔티티에 대해 마지막으로 관측한 updated_at
     */
    Optional<Instant> lastObservedBy(UUID userId, EntityType entityType, String entityId, String deviceId);
}
