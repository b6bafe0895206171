package personal.salon.sync.acceptance.support;

import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.conflict.adapter.out.ledger.LedgerEntityStateAdapter;
import personal.salon.sync.conflict.application.service.ConflictResolverService;
import personal.salon.sync.conflict.domain.service.LastWriterWinsPolicy;
import personal.salon.sync.device.application.service.DeviceRegistryService;
import personal.salon.sync.device.domain.service.DeviceRegistrar;
import personal.salon.sync.ledger.adapter.in.event.SyncableEntityChangedListener;
import personal.salon.sync.ledger.application.service.SyncLedgerService;
import personal.salon.sync.notification.application.service.NotificationFanoutService;
import personal.salon.sync.notification.domain.service.NotificationUpdater;
import personal.salon.sync.offline.application.service.OfflineOperationService;
import personal.salon.sync.offline.application.service.OfflineQueueDrainService;
import personal.salon.sync.offline.domain.service.OperationClaimer;
import personal.salon.sync.offline.domain.service.OperationOutcomeRecorder;
import personal.salon.sync.resilience.application.service.CircuitBreakerService;
import personal.salon.sync.resilience.application.service.ResilienceGuardService;
import personal.salon.sync.resilience.domain.service.CircuitStateUpdater;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 인수 테스트용 애플리케이션 구성
 * 자동 설정 없이 필요한 서비스만 등록 (DB, 스케줄러, HTTP 클라이언트 제외)
 */
@Configuration
@Import({
        DeviceRegistryService.class, DeviceRegistrar.class,
        SyncLedgerService.class, SyncableEntityChangedListener.class,
        LedgerEntityStateAdapter.class, LastWriterWinsPolicy.class, ConflictResolverService.class,
        OfflineOperationService.class, OfflineQueueDrainService.class,
        OperationClaimer.class, OperationOutcomeRecorder.class,
        CircuitBreakerService.class, CircuitStateUpdater.class, ResilienceGuardService.class,
        NotificationFanoutService.class, NotificationUpdater.class,
        InMemoryDeviceRepository.class, InMemorySyncLogRepository.class,
        InMemoryQueuedOperationRepository.class, InMemoryNotificationRepository.class,
        InMemoryCircuitBreakerStateRepository.class, FakeDownstreamAdapter.class,
        SyncTestContext.class
})
public class SyncAcceptanceConfiguration {

    public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");
    public static final String ENVIRONMENT = "test";

    @Bean
    public MutableClock clock() {
        return new MutableClock(START);
    }

    @Bean
    public SyncProperties syncProperties() {
        return new SyncProperties(
                new SyncProperties.OfflineQueue(100, 3, 5, 300),
                new SyncProperties.Notification(100, 24),
                new SyncProperties.Resilience(ENVIRONMENT, 5, 1, 60),
                null,
                new SyncProperties.Health(1000, List.of()));
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(OptimisticLockingFailureException.class)
                .build());
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }
}
