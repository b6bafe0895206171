package personal.salon.sync.ledger.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogCommand;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogUseCase;
import personal.salon.sync.ledger.application.port.in.QuerySyncLedgerUseCase;
import personal.salon.sync.ledger.application.port.out.SyncLogRepository;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;
import personal.salon.sync.ledger.domain.model.SyncStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync Ledger Service
 * Append-only 동기화 원장 기록 및 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncLedgerService implements AppendSyncLogUseCase, QuerySyncLedgerUseCase {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SyncLogRepository syncLogRepository;
    private final GetDevicesUseCase getDevicesUseCase;
    private final Clock clock;

    @Override
    @Transactional
    public SyncLogEntry append(AppendSyncLogCommand command) {
        if (command.deviceId() != null) {
            // 디바이스 귀속 확인 (DeviceNotFoundException 전파)
            getDevicesUseCase.getDevice(command.userId(), command.deviceId());
        }

        SyncLogEntry saved = syncLogRepository.append(SyncLogEntry.append(
                command.userId(),
                command.deviceId(),
                command.entityType(),
                command.entityId(),
                command.operation(),
                command.status(),
                command.dataBefore(),
                command.dataAfter(),
                command.conflictDetected(),
                command.resolutionAction(),
                command.errorMessage(),
                clock.instant()));

        log.debug("Sync log appended: entryId={}, entityType={}, entityId={}, operation={}, conflict={}, resolution={}",
                saved.id(), saved.entityType(), saved.entityId(), saved.operation(),
                saved.conflictDetected(), saved.resolutionAction());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<SyncLogEntry> history(EntityType entityType, String entityId) {
        return syncLogRepository.findByEntity(entityType, entityId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SyncLogEntry> latestState(EntityType entityType, String entityId) {
        return syncLogRepository.findLatestState(entityType, entityId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SyncLogEntry> latestByDevice(UUID userId, EntityType entityType, String entityId,
                                                 String deviceId) {
        return syncLogRepository.findLatestByDevice(userId, entityType, entityId, deviceId);
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal successRate(UUID userId, int days) {
        if (days <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Days must be positive");
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));

        long total = syncLogRepository.countByUserSince(userId, since);
        if (total == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        long completed = syncLogRepository.countByUserAndStatusSince(userId, SyncStatus.COMPLETED, since);

        return BigDecimal.valueOf(completed)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}
