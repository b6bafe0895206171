package personal.salon.sync.offline.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.acceptance.support.InMemoryQueuedOperationRepository;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.offline.application.port.in.EnqueueOperationCommand;
import personal.salon.sync.offline.application.port.out.QueuedOperationRepository;
import personal.salon.sync.offline.domain.exception.InvalidOperationStateException;
import personal.salon.sync.offline.domain.exception.OperationNotFoundException;
import personal.salon.sync.offline.domain.model.OperationStatus;
import personal.salon.sync.offline.domain.model.OperationType;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OfflineOperationService 단위 테스트")
class OfflineOperationServiceTest {

    private static final UUID USER_ID = UUID.fromString("7f1c0c7e-7b9c-4d56-9c35-1f0e4a9b8d21");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final Map<String, Object> PAYLOAD = Map.of(
            "entity_id", "b-1", "updated_at", "2025-03-01T09:58:00Z", "service_id", "svc-7");

    @Mock
    private QueuedOperationRepository queuedOperationRepository;
    @Mock
    private GetDevicesUseCase getDevicesUseCase;

    private OfflineOperationService offlineOperationService;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties(
                new SyncProperties.OfflineQueue(100, 3, 5, 300), null, null, null, null);
        offlineOperationService = new OfflineOperationService(
                queuedOperationRepository, getDevicesUseCase, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private EnqueueOperationCommand command(Map<String, Object> payload) {
        return new EnqueueOperationCommand(USER_ID, "ios-1", OperationType.CREATE_BOOKING, "key-1", payload, null, null);
    }

    private QueuedOperation stored(long id) {
        QueuedOperation operation = QueuedOperation.enqueue(USER_ID, "ios-1", OperationType.CREATE_BOOKING, "key-1",
                PAYLOAD, 5, 3, NOW);
        return new QueuedOperation(id, operation.userId(), operation.deviceId(), operation.operationType(),
                operation.idempotencyKey(), operation.payload(), operation.priority(), 0, 3,
                OperationStatus.PENDING, null, null, null, NOW, null, 0L);
    }

    @Test
    @DisplayName("제출된 작업은 기본 우선순위와 재시도 횟수로 PENDING 저장된다")
    void enqueueAppliesDefaults() {
        // given
        given(queuedOperationRepository.findByUserIdAndDeviceIdAndIdempotencyKey(USER_ID, "ios-1", "key-1")).willReturn(Optional.empty());
        given(queuedOperationRepository.save(any(QueuedOperation.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        QueuedOperation result = offlineOperationService.enqueue(command(PAYLOAD));

        // then
        assertThat(result.status()).isEqualTo(OperationStatus.PENDING);
        assertThat(result.priority()).isEqualTo(5);
        assertThat(result.maxRetries()).isEqualTo(3);
        assertThat(result.retryCount()).isZero();
        assertThat(result.createdAt()).isEqualTo(NOW);
        verify(getDevicesUseCase).getDevice(USER_ID, "ios-1");
    }

    @Test
    @DisplayName("같은 멱등 키로 재제출하면 기존 작업을 반환하고 새로 저장하지 않는다")
    void duplicateSubmissionReturnsExisting() {
        // given
        QueuedOperation existing = stored(42L);
        given(queuedOperationRepository.findByUserIdAndDeviceIdAndIdempotencyKey(USER_ID, "ios-1", "key-1")).willReturn(Optional.of(existing));

        // when
        QueuedOperation result = offlineOperationService.enqueue(command(PAYLOAD));

        // then
        assertThat(result.id()).isEqualTo(42L);
        verify(queuedOperationRepository, never()).save(any());
    }

    @Test
    @DisplayName("다른 사용자가 같은 디바이스 ID와 멱등 키로 제출해도 각자의 작업으로 저장된다")
    void sameDeviceIdAndKeyAcrossUsersAreIndependent() {
        // given
        InMemoryQueuedOperationRepository repository = new InMemoryQueuedOperationRepository();
        OfflineOperationService service = new OfflineOperationService(repository, getDevicesUseCase,
                new SyncProperties(new SyncProperties.OfflineQueue(100, 3, 5, 300), null, null, null, null),
                Clock.fixed(NOW, ZoneOffset.UTC));
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        Map<String, Object> bobPayload = Map.of(
                "entity_id", "b-2", "updated_at", "2025-03-01T09:59:00Z", "service_id", "svc-9");

        QueuedOperation aliceOperation = service.enqueue(new EnqueueOperationCommand(
                alice, "browser", OperationType.CREATE_BOOKING, "k1", PAYLOAD, null, null));

        // when
        QueuedOperation bobOperation = service.enqueue(new EnqueueOperationCommand(
                bob, "browser", OperationType.CREATE_BOOKING, "k1", bobPayload, null, null));

        // then
        assertThat(bobOperation.id()).isNotEqualTo(aliceOperation.id());
        assertThat(bobOperation.userId()).isEqualTo(bob);
        assertThat(bobOperation.payload()).containsEntry("entity_id", "b-2");
        assertThat(repository.findByUserIdAndDeviceIdAndIdempotencyKey(alice, "browser", "k1"))
                .get()
                .extracting(QueuedOperation::payload)
                .isEqualTo(PAYLOAD);
    }

    @Test
    @DisplayName("동시 제출로 유일성 제약에 걸리면 먼저 저장된 작업을 반환한다")
    void concurrentDuplicateReReads() {
        // given
        QueuedOperation existing = stored(43L);
        given(queuedOperationRepository.findByUserIdAndDeviceIdAndIdempotencyKey(USER_ID, "ios-1", "key-1"))
                .willReturn(Optional.empty())
                .willReturn(Optional.of(existing));
        given(queuedOperationRepository.save(any(QueuedOperation.class)))
                .willThrow(new DataIntegrityViolationException("uk_user_device_idempotency"));

        // when
        QueuedOperation result = offlineOperationService.enqueue(command(PAYLOAD));

        // then
        assertThat(result.id()).isEqualTo(43L);
    }

    @Test
    @DisplayName("entity_id나 updated_at이 없는 페이로드는 제출 시점에 거부한다")
    void invalidPayloadRejected() {
        // when & then
        assertThatThrownBy(() -> offlineOperationService.enqueue(command(Map.of("service_id", "svc-7"))))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_SYNC_PAYLOAD);
        verify(queuedOperationRepository, never()).save(any());
    }

    @Test
    @DisplayName("다른 사용자의 작업은 조회할 수 없다")
    void getOperationOfAnotherUser() {
        // given
        given(queuedOperationRepository.findById(42L)).willReturn(Optional.of(stored(42L)));

        // when & then
        assertThatThrownBy(() -> offlineOperationService.getOperation(UUID.randomUUID(), 42L))
                .isInstanceOf(OperationNotFoundException.class);
    }

    @Test
    @DisplayName("PROCESSING 작업 취소는 거부된다")
    void cancelProcessingRejected() {
        // given
        given(queuedOperationRepository.findById(42L)).willReturn(Optional.of(stored(42L).claim(NOW)));

        // when & then
        assertThatThrownBy(() -> offlineOperationService.cancel(USER_ID, 42L))
                .isInstanceOf(InvalidOperationStateException.class);
        verify(queuedOperationRepository, never()).save(any());
    }

    @Test
    @DisplayName("dead letter 재처리는 재시도 예산을 초기화해 PENDING으로 되돌린다")
    void requeueDeadLetter() {
        // given
        QueuedOperation deadLetter = new QueuedOperation(42L, USER_ID, "ios-1", OperationType.CREATE_BOOKING,
                "key-1", PAYLOAD, 5, 3, 3, OperationStatus.FAILED, null, NOW, "boom", NOW, NOW, 4L);
        given(queuedOperationRepository.findById(42L)).willReturn(Optional.of(deadLetter));
        given(queuedOperationRepository.save(any(QueuedOperation.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        QueuedOperation result = offlineOperationService.requeueDeadLetter(42L);

        // then
        assertThat(result.status()).isEqualTo(OperationStatus.PENDING);
        assertThat(result.retryCount()).isZero();
    }

    @Test
    @DisplayName("dead letter 목록은 저장소 조회 결과를 그대로 반환한다")
    void deadLetters() {
        // given
        given(queuedOperationRepository.findDeadLetters()).willReturn(List.of());

        // when & then
        assertThat(offlineOperationService.deadLetters()).isEmpty();
    }
}
