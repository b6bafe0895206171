package personal.salon.sync.ledger.application.port.in;

import personal.salon.sync.ledger.domain.model.SyncLogEntry;

/**
 * Append Sync Log Use Case
 * 원장은 추가만 가능 (수정/삭제 API 없음)
 */
public interface AppendSyncLogUseCase {

    /**
     * 원장에 한 줄 기록
     * 디바이스가 지정되면 해당 사용자의 디바이스여야 함
     *
     * @return 저장된 기록 (id = 커밋 순서)
     */
    SyncLogEntry append(AppendSyncLogCommand command);
}
