package personal.salon.sync.offline.adapter.out.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;
import personal.salon.sync.offline.domain.model.OperationStatus;
import personal.salon.sync.offline.domain.model.OperationType;
import personal.salon.sync.offline.domain.model.QueuedOperation;
import personal.salon.sync.support.TestContainersConfiguration;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 오프라인 작업 큐 영속성 어댑터 통합 테스트 (MySQL 8)
 * Docker가 없으면 건너뜀
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@Import({TestContainersConfiguration.class, QueuedOperationPersistenceAdapter.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class QueuedOperationPersistenceAdapterTest {

    private static final UUID USER_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Autowired
    private QueuedOperationPersistenceAdapter adapter;

    @Autowired
    private JpaQueuedOperationRepository jpaQueuedOperationRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        jpaQueuedOperationRepository.deleteAllInBatch();
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Test
    @DisplayName("처리 시점이 된 작업을 우선순위 높은 순으로 claim하고 PROCESSING으로 전환한다")
    void claimDue_OrdersByPriorityAndMarksProcessing() {
        // given
        QueuedOperation low = enqueue("key-low", 1, NOW.minusSeconds(30));
        QueuedOperation high = enqueue("key-high", 9, NOW.minusSeconds(10));
        enqueue("key-future", 10, NOW.plusSeconds(60), NOW.plusSeconds(600));

        // when
        List<QueuedOperation> claimed = transactionTemplate.execute(status -> adapter.claimDue(NOW, 10));

        // then
        assertThat(claimed).extracting(QueuedOperation::id).containsExactly(high.id(), low.id());
        assertThat(claimed).allSatisfy(operation -> {
            assertThat(operation.status()).isEqualTo(OperationStatus.PROCESSING);
            assertThat(operation.claimedAt()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("다른 워커가 잠근 작업은 건너뛰어 같은 작업을 두 번 claim하지 않는다")
    void claimDue_SkipsRowsLockedByAnotherWorker() throws Exception {
        // given
        for (int i = 0; i < 3; i++) {
            enqueue("key-" + i, 5, NOW.minusSeconds(60 - i));
        }
        AtomicBoolean firstClaimed = new AtomicBoolean(false);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        CompletableFuture<List<QueuedOperation>> firstWorker = CompletableFuture.supplyAsync(() ->
                transactionTemplate.execute(status -> {
                    List<QueuedOperation> claimed = adapter.claimDue(NOW, 1);
                    firstClaimed.set(true);
                    awaitRelease(releaseFirst);
                    return claimed;
                }));
        await().atMost(Duration.ofSeconds(10)).untilTrue(firstClaimed);

        // when
        List<QueuedOperation> second = transactionTemplate.execute(status -> adapter.claimDue(NOW, 10));
        releaseFirst.countDown();
        List<QueuedOperation> first = firstWorker.get(10, TimeUnit.SECONDS);

        // then
        assertThat(first).hasSize(1);
        assertThat(second).extracting(QueuedOperation::id)
                .doesNotContainAnyElementsOf(first.stream().map(QueuedOperation::id).toList());
        assertThat(jpaQueuedOperationRepository.findAll())
                .filteredOn(entity -> entity.getStatus() == OperationStatus.PROCESSING)
                .hasSize(first.size() + second.size());
    }

    @Test
    @DisplayName("claim timeout을 넘긴 PROCESSING 작업만 PENDING으로 복구한다")
    void releaseStaleClaims_ReleasesOnlyExpiredClaims() {
        // given
        QueuedOperation stale = enqueue("key-stale", 5, NOW.minusSeconds(900));
        transactionTemplate.execute(status -> adapter.claimDue(NOW.minusSeconds(600), 10));
        QueuedOperation fresh = enqueue("key-fresh", 5, NOW.minusSeconds(30));
        transactionTemplate.execute(status -> adapter.claimDue(NOW, 10));

        // when
        Integer released = transactionTemplate.execute(status -> adapter.releaseStaleClaims(NOW.minusSeconds(300)));

        // then
        assertThat(released).isEqualTo(1);
        assertThat(adapter.findById(stale.id())).get().satisfies(operation -> {
            assertThat(operation.status()).isEqualTo(OperationStatus.PENDING);
            assertThat(operation.claimedAt()).isNull();
        });
        assertThat(adapter.findById(fresh.id()).orElseThrow().status()).isEqualTo(OperationStatus.PROCESSING);
    }

    @Test
    @DisplayName("재시도 예산이 남은 실패 작업만 다시 대기시키고 소진된 작업은 dead letter로 남긴다")
    void requeueRetryableFailures_LeavesDeadLetters() {
        // given
        QueuedOperation retryable = failOnce(enqueue("key-retry", 5, NOW.minusSeconds(60), null, 3));
        QueuedOperation exhausted = failOnce(enqueue("key-dead", 5, NOW.minusSeconds(50), null, 1));

        // when
        Integer requeued = transactionTemplate.execute(status -> adapter.requeueRetryableFailures());

        // then
        assertThat(requeued).isEqualTo(1);
        assertThat(adapter.findById(retryable.id()).orElseThrow().status()).isEqualTo(OperationStatus.PENDING);
        assertThat(adapter.findDeadLetters()).extracting(QueuedOperation::id).containsExactly(exhausted.id());
    }

    @Test
    @DisplayName("멱등 키 유일성은 사용자 단위이므로 다른 사용자의 같은 디바이스 ID와 키는 함께 저장된다")
    void idempotencyKeyIsScopedPerUser() {
        // given
        UUID otherUser = UUID.randomUUID();
        QueuedOperation mine = enqueue("key-shared", 5, NOW.minusSeconds(30));

        // when
        QueuedOperation theirs = adapter.save(QueuedOperation.enqueue(otherUser, "device-1",
                OperationType.CREATE_BOOKING, "key-shared",
                Map.of("entity_id", "b-other", "updated_at", NOW.toString()), 5, 3, NOW));

        // then
        assertThat(theirs.id()).isNotEqualTo(mine.id());
        assertThat(adapter.findByUserIdAndDeviceIdAndIdempotencyKey(otherUser, "device-1", "key-shared"))
                .get()
                .extracting(QueuedOperation::id)
                .isEqualTo(theirs.id());
        assertThat(adapter.findByUserIdAndDeviceIdAndIdempotencyKey(USER_ID, "device-1", "key-shared"))
                .get()
                .extracting(QueuedOperation::id)
                .isEqualTo(mine.id());
    }

    private QueuedOperation enqueue(String idempotencyKey, int priority, Instant createdAt) {
        return enqueue(idempotencyKey, priority, createdAt, null);
    }

    private QueuedOperation enqueue(String idempotencyKey, int priority, Instant createdAt, Instant nextRetryAt) {
        return enqueue(idempotencyKey, priority, createdAt, nextRetryAt, 3);
    }

    private QueuedOperation enqueue(String idempotencyKey, int priority, Instant createdAt,
                                    Instant nextRetryAt, int maxRetries) {
        QueuedOperation operation = QueuedOperation.enqueue(USER_ID, "device-1", OperationType.CREATE_BOOKING,
                idempotencyKey, Map.of("entity_id", idempotencyKey, "updated_at", createdAt.toString()),
                priority, maxRetries, createdAt.truncatedTo(ChronoUnit.MICROS));
        if (nextRetryAt == null) {
            return adapter.save(operation);
        }
        return adapter.save(new QueuedOperation(null, operation.userId(), operation.deviceId(),
                operation.operationType(), operation.idempotencyKey(), operation.payload(), operation.priority(),
                operation.retryCount(), operation.maxRetries(), operation.status(), nextRetryAt, null, null,
                operation.createdAt(), null, null));
    }

    private QueuedOperation failOnce(QueuedOperation operation) {
        QueuedOperation claimed = adapter.save(operation.claim(NOW));
        return adapter.save(claimed.fail("HTTP 503", NOW));
    }

    private static void awaitRelease(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
