package personal.salon.sync.conflict.application.port.in;

import personal.salon.sync.conflict.domain.model.ConflictResolution;

/**
 * Resolve Conflict Use Case
 */
public interface ResolveConflictUseCase {

    /**
     * 판정 + 원장 기록 (이전/이후 상태 포함)
     */
    ConflictResolution resolve(ResolveConflictCommand command);

    /**
     * 판정만 수행 (부수 효과 없음)
     * 호출자가 하위 서비스 결과를 확인한 뒤 직접 원장에 기록하는 경우 사용
     */
    ConflictResolution decide(ResolveConflictCommand command);
}
