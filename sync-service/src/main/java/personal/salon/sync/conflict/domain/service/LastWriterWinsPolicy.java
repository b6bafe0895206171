package personal.salon.sync.conflict.domain.service;

import org.springframework.stereotype.Component;
import personal.salon.sync.conflict.domain.model.ConflictResolution;
import personal.salon.sync.conflict.domain.model.ServerState;
import personal.salon.sync.ledger.domain.model.ResolutionAction;

import java.time.Instant;
import java.util.Map;

/**
 * Last-Writer-Wins 정책
 * 필드 단위 병합 없이 updated_at 비교만으로 결정 (동일 입력 → 동일 결과)
 *
 * 모든 동기화 대상 엔티티 타입(BOOKING, PROFILE, PREFERENCES)에 동일하게 적용
 */
@Component
public class LastWriterWinsPolicy {

    /**
     * @param incoming          수신 값
     * @param incomingUpdatedAt 수신 값의 updated_at
     * @param server            서버 상태 (엔티티가 없으면 null)
     * @param deviceLastKnown   디바이스가 마지막으로 관측한 서버 시각 (관측한 적 없으면 null)
     */
    public ConflictResolution decide(Map<String, Object> incoming, Instant incomingUpdatedAt,
                                     ServerState server, Instant deviceLastKnown) {
        if (server == null) {
            // 엔티티 없음 → 생성으로 취급
            return new ConflictResolution(false, ResolutionAction.USE_LATEST, incoming, null);
        }

        if (incomingUpdatedAt.isAfter(server.updatedAt())) {
            boolean diverged = deviceLastKnown == null || server.updatedAt().isAfter(deviceLastKnown);
            return new ConflictResolution(diverged, ResolutionAction.USE_LATEST, incoming, server.value());
        }

        // 서버 값이 같거나 더 최신: 동일 값 재전송이 아니면 충돌
        boolean conflict = !server.value().equals(incoming);
        return new ConflictResolution(conflict, ResolutionAction.KEEP_EXISTING, server.value(), server.value());
    }
}
