package personal.salon.sync.conflict.domain.model;

import personal.salon.sync.ledger.domain.model.ResolutionAction;

import java.util.Map;

/**
 * 충돌 판정 결과
 *
 * @param conflictDetected 두 작성자가 갈라졌거나 서버 값이 수신 값을 이긴 경우 true
 * @param resolvedValue    채택된 값
 * @param serverValue      판정 시점의 서버 값 (엔티티가 없으면 null)
 */
public record ConflictResolution(
        boolean conflictDetected,
        ResolutionAction action,
        Map<String, Object> resolvedValue,
        Map<String, Object> serverValue) {

    public boolean useLatest() {
        return action == ResolutionAction.USE_LATEST;
    }
}
