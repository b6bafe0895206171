package personal.salon.sync.conflict.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * 충돌 판정 시점의 서버 측 최신 커밋 상태
 */
public record ServerState(
        Map<String, Object> value,
        Instant updatedAt) {

    public ServerState {
        if (value == null || updatedAt == null) {
            throw new IllegalArgumentException("Server state requires value and updated_at");
        }
    }
}
