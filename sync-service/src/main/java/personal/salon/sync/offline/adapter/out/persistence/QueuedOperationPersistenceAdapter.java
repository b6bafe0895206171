package personal.salon.sync.offline.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.sync.offline.application.port.out.QueuedOperationRepository;
import personal.salon.sync.offline.domain.model.OperationStatus;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queued Operation Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueuedOperationPersistenceAdapter implements QueuedOperationRepository {

    private final JpaQueuedOperationRepository jpaQueuedOperationRepository;

    @Override
    public QueuedOperation save(QueuedOperation operation) {
        return jpaQueuedOperationRepository.saveAndFlush(QueuedOperationEntity.fromDomain(operation)).toDomain();
    }

    @Override
    public Optional<QueuedOperation> findById(Long id) {
        return jpaQueuedOperationRepository.findById(id).map(QueuedOperationEntity::toDomain);
    }

    @Override
    public Optional<QueuedOperation> findByUserIdAndDeviceIdAndIdempotencyKey(UUID userId, String deviceId,
                                                                              String idempotencyKey) {
        return jpaQueuedOperationRepository.findByUserIdAndDeviceIdAndIdempotencyKey(userId, deviceId, idempotencyKey)
                .map(QueuedOperationEntity::toDomain);
    }

    @Override
    public List<QueuedOperation> claimDue(Instant now, int limit) {
        List<QueuedOperationEntity> locked = jpaQueuedOperationRepository.lockDuePending(now, limit);
        if (!locked.isEmpty()) {
            log.debug("Locked due operations: count={}", locked.size());
        }
        return locked.stream()
                .map(entity -> save(entity.toDomain().claim(now)))
                .toList();
    }

    @Override
    public int requeueRetryableFailures() {
        return jpaQueuedOperationRepository.requeueRetryable(OperationStatus.FAILED, OperationStatus.PENDING);
    }

    @Override
    public int releaseStaleClaims(Instant cutoff) {
        return jpaQueuedOperationRepository.releaseStaleClaims(
                OperationStatus.PROCESSING, OperationStatus.PENDING, cutoff);
    }

    @Override
    public List<QueuedOperation> findDeadLetters() {
        return jpaQueuedOperationRepository.findDeadLetters(OperationStatus.FAILED).stream()
                .map(QueuedOperationEntity::toDomain)
                .toList();
    }
}
