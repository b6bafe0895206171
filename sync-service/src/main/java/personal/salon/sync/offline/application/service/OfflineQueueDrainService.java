package personal.salon.sync.offline.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.conflict.application.port.in.ResolveConflictCommand;
import personal.salon.sync.conflict.application.port.in.ResolveConflictUseCase;
import personal.salon.sync.conflict.domain.model.ConflictResolution;
import personal.salon.sync.offline.application.port.in.DrainOfflineQueueUseCase;
import personal.salon.sync.offline.application.port.in.DrainResult;
import personal.salon.sync.offline.application.port.out.BookingCommandPort;
import personal.salon.sync.offline.application.port.out.ProfileCommandPort;
import personal.salon.sync.offline.domain.model.OfflineOperation;
import personal.salon.sync.offline.domain.model.QueuedOperation;
import personal.salon.sync.offline.domain.service.OperationClaimer;
import personal.salon.sync.offline.domain.service.OperationOutcomeRecorder;
import personal.salon.sync.resilience.application.port.in.ResilienceGuard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Offline Queue Drain Service
 *
 * 1. 재시도 예산이 남은 FAILED → PENDING
 * 2. 처리 시점이 된 PENDING을 SKIP LOCKED로 claim (PROCESSING)
 * 3. 작업별: 충돌 판정 → keep_existing이면 하위 호출 없이 완료,
 *    use_latest이면 ResilienceGuard를 거쳐 적용 → 결과 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineQueueDrainService implements DrainOfflineQueueUseCase {

    static final String DOWNSTREAM_SERVICE = "booking-service";

    private final OperationClaimer operationClaimer;
    private final OperationOutcomeRecorder operationOutcomeRecorder;
    private final ResolveConflictUseCase resolveConflictUseCase;
    private final ResilienceGuard resilienceGuard;
    private final BookingCommandPort bookingCommandPort;
    private final ProfileCommandPort profileCommandPort;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Override
    public DrainResult drain() {
        int requeued = operationClaimer.requeueRetryableFailures();

        List<QueuedOperation> claimed = operationClaimer.claimDue(
                clock.instant(), syncProperties.offlineQueue().batchSize());
        if (claimed.isEmpty()) {
            return DrainResult.empty(requeued);
        }

        int completed = 0;
        int keptExisting = 0;
        int failed = 0;
        int deadLettered = 0;

        for (QueuedOperation operation : claimed) {
            switch (process(operation)) {
                case APPLIED -> completed++;
                case KEPT_EXISTING -> {
                    completed++;
                    keptExisting++;
                }
                case FAILED -> failed++;
                case DEAD_LETTERED -> {
                    failed++;
                    deadLettered++;
                }
                case UNRECORDED -> log.debug("Outcome not recorded, left for stale claim recovery: operationId={}",
                        operation.id());
            }
        }

        DrainResult result = new DrainResult(requeued, claimed.size(), completed, keptExisting, failed, deadLettered);
        log.info("Offline queue drained: {}", result);
        return result;
    }

    @Override
    public int recoverStaleClaims() {
        Duration timeout = Duration.ofSeconds(syncProperties.offlineQueue().claimTimeoutSeconds());
        int released = operationClaimer.releaseStaleClaims(clock.instant().minus(timeout));
        if (released > 0) {
            log.warn("Stale offline operation claims released: count={}", released);
        }
        return released;
    }

    private Outcome process(QueuedOperation claimed) {
        try {
            OfflineOperation operation = claimed.toOperation();

            // 판정은 claim 시점의 스냅샷이 아닌 현재 커밋된 상태 기준
            ConflictResolution resolution = resolveConflictUseCase.decide(new ResolveConflictCommand(
                    claimed.userId(),
                    claimed.deviceId(),
                    operation.entityType(),
                    operation.entityId(),
                    operation.payload()));

            if (!resolution.useLatest()) {
                operationOutcomeRecorder.recordKeptExisting(claimed, operation, resolution, clock.instant());
                return Outcome.KEPT_EXISTING;
            }

            resilienceGuard.run(DOWNSTREAM_SERVICE,
                    () -> operation.apply(claimed.context(), bookingCommandPort, profileCommandPort));

            operationOutcomeRecorder.recordApplied(claimed, operation, resolution, clock.instant());
            return Outcome.APPLIED;
        } catch (Exception e) {
            return recordFailure(claimed, e);
        }
    }

    private Outcome recordFailure(QueuedOperation claimed, Exception cause) {
        try {
            QueuedOperation failed = operationOutcomeRecorder.recordFailure(
                    claimed, describe(cause), clock.instant());
            return failed.isDeadLettered() ? Outcome.DEAD_LETTERED : Outcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Failed to record offline operation failure: operationId={}", claimed.id(), e);
            return Outcome.UNRECORDED;
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? e.getClass().getSimpleName() + ": " + message : e.getClass().getSimpleName();
    }

    private enum Outcome {
        APPLIED,
        KEPT_EXISTING,
        FAILED,
        DEAD_LETTERED,
        UNRECORDED
    }
}
