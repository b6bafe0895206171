package personal.salon.sync.offline.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.conflict.domain.model.ConflictResolution;
import personal.salon.sync.ledger.domain.event.SyncableEntityChangedEvent;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.offline.application.port.out.QueuedOperationRepository;
import personal.salon.sync.offline.domain.event.OperationDeadLetteredEvent;
import personal.salon.sync.offline.domain.model.OfflineOperation;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Instant;

/**
 * 작업 1건의 처리 결과 기록 (작업별 독립 트랜잭션)
 * 상태 전이와 원장 기록이 같은 트랜잭션에서 커밋됨 → 작업당 원장 기록 정확히 1건
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperationOutcomeRecorder {

    private final QueuedOperationRepository queuedOperationRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 하위 서비스 적용 성공 (use_latest)
     */
    @Transactional
    public QueuedOperation recordApplied(QueuedOperation claimed, OfflineOperation operation,
                                         ConflictResolution resolution, Instant now) {
        QueuedOperation completed = queuedOperationRepository.save(claimed.complete(now));
        eventPublisher.publishEvent(SyncableEntityChangedEvent.resolved(
                claimed.userId(),
                claimed.deviceId(),
                operation.entityType(),
                operation.entityId(),
                operation.syncOperation(),
                resolution.serverValue(),
                resolution.resolvedValue(),
                resolution.conflictDetected(),
                resolution.action()));

        log.debug("Offline operation applied: operationId={}, type={}, entityId={}, conflict={}",
                claimed.id(), claimed.operationType(), operation.entityId(), resolution.conflictDetected());
        return completed;
    }

    /**
     * 서버 값 유지 (keep_existing): 하위 호출 없이 완료, 충돌을 원장에 기록
     */
    @Transactional
    public QueuedOperation recordKeptExisting(QueuedOperation claimed, OfflineOperation operation,
                                              ConflictResolution resolution, Instant now) {
        QueuedOperation completed = queuedOperationRepository.save(claimed.complete(now));
        eventPublisher.publishEvent(SyncableEntityChangedEvent.resolved(
                claimed.userId(),
                claimed.deviceId(),
                operation.entityType(),
                operation.entityId(),
                SyncOperation.SYNC,
                resolution.serverValue(),
                resolution.resolvedValue(),
                resolution.conflictDetected(),
                resolution.action()));

        log.info("Offline operation superseded by server state: operationId={}, type={}, entityId={}, conflict={}",
                claimed.id(), claimed.operationType(), operation.entityId(), resolution.conflictDetected());
        return completed;
    }

    /**
     * 실패 기록, 재시도 예산 소진 시 dead letter 이벤트 발행
     */
    @Transactional
    public QueuedOperation recordFailure(QueuedOperation claimed, String error, Instant now) {
        QueuedOperation failed = queuedOperationRepository.save(claimed.fail(error, now));

        if (failed.isDeadLettered()) {
            log.error("Offline operation dead-lettered: operationId={}, type={}, retryCount={}, error={}",
                    failed.id(), failed.operationType(), failed.retryCount(), failed.errorMessage());
            eventPublisher.publishEvent(new OperationDeadLetteredEvent(
                    failed.id(),
                    failed.userId(),
                    failed.deviceId(),
                    failed.operationType(),
                    failed.retryCount(),
                    failed.errorMessage()));
        } else {
            log.warn("Offline operation failed, will retry: operationId={}, type={}, retryCount={}, nextRetryAt={}, error={}",
                    failed.id(), failed.operationType(), failed.retryCount(), failed.nextRetryAt(), error);
        }
        return failed;
    }
}
