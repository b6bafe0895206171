package personal.salon.sync.ledger.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.ledger.adapter.in.web.dto.AppendSyncLogRequest;
import personal.salon.sync.ledger.adapter.in.web.dto.SuccessRateResponse;
import personal.salon.sync.ledger.adapter.in.web.dto.SyncLogEntryResponse;
import personal.salon.sync.ledger.application.port.in.AppendSyncLogUseCase;
import personal.salon.sync.ledger.application.port.in.QuerySyncLedgerUseCase;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Sync Ledger API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
public class SyncLedgerController {

    private final AppendSyncLogUseCase appendSyncLogUseCase;
    private final QuerySyncLedgerUseCase querySyncLedgerUseCase;

    /**
     * 외부 쓰기 경로의 변경 기록
     * POST /api/v1/sync/ledger
     */
    @PostMapping("/ledger")
    public ResponseEntity<SyncLogEntryResponse> append(
            @Valid @RequestBody AppendSyncLogRequest request,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Append sync log: userId={}, entityType={}, entityId={}, operation={}",
                userId, request.entityType(), request.entityId(), request.operation());

        SyncLogEntry entry = appendSyncLogUseCase.append(request.toCommand(userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(SyncLogEntryResponse.from(entry));
    }

    /**
     * 엔티티 변경 이력
     * GET /api/v1/sync/ledger/{entityType}/{entityId}
     */
    @GetMapping("/ledger/{entityType}/{entityId}")
    public ResponseEntity<List<SyncLogEntryResponse>> history(
            @PathVariable String entityType,
            @PathVariable String entityId
    ) {
        List<SyncLogEntryResponse> response = querySyncLedgerUseCase.history(EntityType.from(entityType), entityId)
                .stream()
                .map(SyncLogEntryResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 동기화 성공률
     * GET /api/v1/sync/success-rate?days=30
     */
    @GetMapping("/success-rate")
    public ResponseEntity<SuccessRateResponse> successRate(
            @RequestParam(defaultValue = "30") int days,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        BigDecimal rate = querySyncLedgerUseCase.successRate(userId, days);
        return ResponseEntity.ok(new SuccessRateResponse(userId, days, rate));
    }
}
