package personal.salon.sync.offline.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.salon.sync.offline.application.port.in.DrainOfflineQueueUseCase;
import personal.salon.sync.offline.application.port.in.DrainResult;

/**
 * Offline Queue Scheduler
 * 고정 주기 drain 및 stale claim 복구
 *
 * 여러 인스턴스가 동시에 실행해도 claim이 SKIP LOCKED이므로 같은 작업을 중복 처리하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfflineQueueScheduler {

    private final DrainOfflineQueueUseCase drainOfflineQueueUseCase;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: sync.scheduler.drain-interval-ms (기본 60초)
     */
    @Scheduled(fixedDelayString = "${sync.scheduler.drain-interval-ms:60000}")
    public void drainOfflineQueue() {
        try {
            Timer.Sample sample = Timer.start(meterRegistry);

            DrainResult result = drainOfflineQueueUseCase.drain();

            sample.stop(Timer.builder("offline.queue.drain.duration")
                    .description("Time taken to drain one batch of offline operations")
                    .register(meterRegistry));

            record(result);
        } catch (Exception e) {
            log.error("Offline queue drain failed", e);
        }
    }

    /**
     * 주기: sync.scheduler.stale-recovery-interval-ms (기본 5분)
     */
    @Scheduled(fixedDelayString = "${sync.scheduler.stale-recovery-interval-ms:300000}")
    public void recoverStaleClaims() {
        try {
            int released = drainOfflineQueueUseCase.recoverStaleClaims();
            if (released > 0) {
                Counter.builder("offline.queue.operations.recovered")
                        .description("Number of stale processing claims returned to pending")
                        .register(meterRegistry)
                        .increment(released);
            }
        } catch (Exception e) {
            log.error("Stale claim recovery failed", e);
        }
    }

    private void record(DrainResult result) {
        if (result.processed() == 0) {
            log.debug("No due offline operations: requeued={}", result.requeued());
            return;
        }
        increment("completed", result.completed() - result.keptExisting());
        increment("kept_existing", result.keptExisting());
        increment("failed", result.failed() - result.deadLettered());
        increment("dead_lettered", result.deadLettered());
    }

    private void increment(String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder("offline.queue.operations.drained")
                .tag("outcome", outcome)
                .description("Number of offline operations processed by outcome")
                .register(meterRegistry)
                .increment(amount);
    }
}
