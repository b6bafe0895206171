package personal.salon.sync.offline.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.offline.application.port.out.QueuedOperationRepository;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Instant;
import java.util.List;

/**
 * 짧은 claim 트랜잭션
 * 행 잠금은 PROCESSING 전환 커밋과 함께 해제되고, 이후 처리는 잠금 없이 진행
 */
@Component
@RequiredArgsConstructor
public class OperationClaimer {

    private final QueuedOperationRepository queuedOperationRepository;

    @Transactional
    public int requeueRetryableFailures() {
        return queuedOperationRepository.requeueRetryableFailures();
    }

    @Transactional
    public List<QueuedOperation> claimDue(Instant now, int limit) {
        return queuedOperationRepository.claimDue(now, limit);
    }

    @Transactional
    public int releaseStaleClaims(Instant cutoff) {
        return queuedOperationRepository.releaseStaleClaims(cutoff);
    }
}
