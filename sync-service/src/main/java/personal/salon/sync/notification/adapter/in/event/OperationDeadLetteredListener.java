package personal.salon.sync.notification.adapter.in.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import personal.salon.sync.notification.application.port.in.QueueNotificationCommand;
import personal.salon.sync.notification.application.port.in.QueueNotificationUseCase;
import personal.salon.sync.notification.domain.model.NotificationPriority;
import personal.salon.sync.offline.domain.event.OperationDeadLetteredEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * dead letter 확정(커밋) 후 사용자의 활성 디바이스 전체에 알림 등록
 * 알림 등록 실패가 작업 상태 기록을 되돌리지 않도록 커밋 이후 별도 트랜잭션에서 처리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperationDeadLetteredListener {

    static final String NOTIFICATION_TYPE = "OFFLINE_OPERATION_FAILED";

    private final QueueNotificationUseCase queueNotificationUseCase;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onDeadLettered(OperationDeadLetteredEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation_id", event.operationId());
        data.put("operation_type", event.operationType().name());
        data.put("device_id", event.deviceId());
        data.put("retry_count", event.retryCount());
        if (event.errorMessage() != null) {
            data.put("error", event.errorMessage());
        }

        try {
            queueNotificationUseCase.enqueue(new QueueNotificationCommand(
                    event.userId(),
                    "오프라인 작업을 처리하지 못했습니다",
                    String.format("%s 작업이 %d회 재시도 후 실패했습니다.", event.operationType(), event.retryCount()),
                    NOTIFICATION_TYPE,
                    NotificationPriority.HIGH,
                    data,
                    List.of(),
                    List.of(),
                    null,
                    null));
        } catch (RuntimeException e) {
            // 작업은 이미 dead letter로 커밋됨, 운영자 조회(dead-letters)로 확인 가능
            log.error("Failed to queue dead-letter notification: operationId={}, userId={}",
                    event.operationId(), event.userId(), e);
        }
    }
}
