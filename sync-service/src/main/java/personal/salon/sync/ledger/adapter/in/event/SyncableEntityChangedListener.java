package personal.salon.sync.ledger.adapter.in.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogCommand;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogUseCase;
import personal.salon.sync.ledger.domain.event.SyncableEntityChangedEvent;

/**
 * 엔티티 변경 이벤트 → 원장 기록
 * 동기 리스너: 발행자의 트랜잭션에 참여하므로 기록 실패 시 변경도 함께 롤백
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncableEntityChangedListener {

    private final AppendSyncLogUseCase appendSyncLogUseCase;

    @EventListener
    public void onEntityChanged(SyncableEntityChangedEvent event) {
        log.debug("Entity changed: entityType={}, entityId={}, operation={}, deviceId={}",
                event.entityType(), event.entityId(), event.operation(), event.deviceId());
        appendSyncLogUseCase.append(AppendSyncLogCommand.from(event));
    }
}
