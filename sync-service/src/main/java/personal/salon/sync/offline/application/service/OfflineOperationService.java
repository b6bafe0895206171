package personal.salon.sync.offline.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.offline.application.port.in.EnqueueOfflineOperationUseCase;
import personal.salon.sync.offline.application.port.in.EnqueueOperationCommand;
import personal.salon.sync.offline.application.port.in.ManageOfflineOperationUseCase;
import personal.salon.sync.offline.application.port.out.QueuedOperationRepository;
import personal.salon.sync.offline.domain.exception.OperationNotFoundException;
import personal.salon.sync.offline.domain.model.OfflineOperation;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Offline Operation Service
 * 작업 제출(멱등), 조회, 취소, dead letter 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineOperationService implements EnqueueOfflineOperationUseCase, ManageOfflineOperationUseCase {

    private final QueuedOperationRepository queuedOperationRepository;
    private final GetDevicesUseCase getDevicesUseCase;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Override
    public QueuedOperation enqueue(EnqueueOperationCommand command) {
        // 디바이스 확인 (DeviceNotFoundException 전파)
        getDevicesUseCase.getDevice(command.userId(), command.deviceId());

        // 페이로드 검증 (entity_id, updated_at): 제출 시점에 동기적으로 거부
        OfflineOperation.of(command.operationType(), command.payload());

        Optional<QueuedOperation> existing = findDuplicate(command);
        if (existing.isPresent()) {
            log.info("Duplicate offline operation submission: userId={}, deviceId={}, idempotencyKey={}, operationId={}",
                    command.userId(), command.deviceId(), command.idempotencyKey(), existing.get().id());
            return existing.get();
        }

        SyncProperties.OfflineQueue defaults = syncProperties.offlineQueue();
        QueuedOperation operation = QueuedOperation.enqueue(
                command.userId(),
                command.deviceId(),
                command.operationType(),
                command.idempotencyKey(),
                command.payload(),
                command.priority() != null ? command.priority() : defaults.defaultPriority(),
                command.maxRetries() != null ? command.maxRetries() : defaults.defaultMaxRetries(),
                clock.instant());

        try {
            QueuedOperation saved = queuedOperationRepository.save(operation);
            log.info("Offline operation queued: operationId={}, deviceId={}, type={}, priority={}",
                    saved.id(), saved.deviceId(), saved.operationType(), saved.priority());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 동일 키 동시 제출 → 먼저 저장된 작업 반환
            log.warn("Concurrent duplicate submission detected: deviceId={}, idempotencyKey={}",
                    command.deviceId(), command.idempotencyKey());
            return findDuplicate(command).orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public QueuedOperation getOperation(UUID userId, Long operationId) {
        return queuedOperationRepository.findById(operationId)
                .filter(operation -> operation.userId().equals(userId))
                .orElseThrow(() -> new OperationNotFoundException(operationId));
    }

    @Override
    @Transactional
    public QueuedOperation cancel(UUID userId, Long operationId) {
        QueuedOperation operation = getOperation(userId, operationId);
        QueuedOperation cancelled = queuedOperationRepository.save(operation.cancel(clock.instant()));
        log.info("Offline operation cancelled: operationId={}, userId={}", operationId, userId);
        return cancelled;
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueuedOperation> deadLetters() {
        return queuedOperationRepository.findDeadLetters();
    }

    @Override
    @Transactional
    public QueuedOperation requeueDeadLetter(Long operationId) {
        QueuedOperation operation = queuedOperationRepository.findById(operationId)
                .orElseThrow(() -> new OperationNotFoundException(operationId));
        QueuedOperation requeued = queuedOperationRepository.save(operation.resetForManualRetry());
        log.info("Dead-lettered operation requeued by operator: operationId={}", operationId);
        return requeued;
    }

    private Optional<QueuedOperation> findDuplicate(EnqueueOperationCommand command) {
        return queuedOperationRepository.findByUserIdAndDeviceIdAndIdempotencyKey(
                command.userId(), command.deviceId(), command.idempotencyKey());
    }
}
