package personal.salon.sync.offline.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.offline.adapter.in.web.dto.EnqueueOperationRequest;
import personal.salon.sync.offline.adapter.in.web.dto.OperationResponse;
import personal.salon.sync.offline.application.port.in.EnqueueOfflineOperationUseCase;
import personal.salon.sync.offline.application.port.in.ManageOfflineOperationUseCase;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.util.UUID;

/**
 * Offline Operation API Controller
 * 제출은 항상 즉시 202 Accepted, 처리 결과는 상태 조회로 확인
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/offline-operations")
@RequiredArgsConstructor
public class OfflineOperationController {

    private final EnqueueOfflineOperationUseCase enqueueOfflineOperationUseCase;
    private final ManageOfflineOperationUseCase manageOfflineOperationUseCase;

    /**
     * POST /api/v1/offline-operations
     */
    @PostMapping
    public ResponseEntity<OperationResponse> enqueue(
            @Valid @RequestBody EnqueueOperationRequest request,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Enqueue offline operation: userId={}, deviceId={}, type={}, idempotencyKey={}",
                userId, request.deviceId(), request.operationType(), request.idempotencyKey());

        QueuedOperation operation = enqueueOfflineOperationUseCase.enqueue(request.toCommand(userId));

        return ResponseEntity.accepted().body(OperationResponse.from(operation));
    }

    /**
     * GET /api/v1/offline-operations/{operationId}
     */
    @GetMapping("/{operationId}")
    public ResponseEntity<OperationResponse> getOperation(
            @PathVariable Long operationId,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        return ResponseEntity.ok(OperationResponse.from(manageOfflineOperationUseCase.getOperation(userId, operationId)));
    }

    /**
     * PENDING 상태에서만 취소 가능 (그 외 409)
     * DELETE /api/v1/offline-operations/{operationId}
     */
    @DeleteMapping("/{operationId}")
    public ResponseEntity<OperationResponse> cancel(
            @PathVariable Long operationId,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Cancel offline operation: userId={}, operationId={}", userId, operationId);
        return ResponseEntity.ok(OperationResponse.from(manageOfflineOperationUseCase.cancel(userId, operationId)));
    }
}
