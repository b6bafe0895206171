package personal.salon.sync.offline.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.offline.adapter.in.web.dto.DrainResponse;
import personal.salon.sync.offline.adapter.in.web.dto.OperationResponse;
import personal.salon.sync.offline.application.port.in.DrainOfflineQueueUseCase;
import personal.salon.sync.offline.application.port.in.ManageOfflineOperationUseCase;

import java.util.List;

/**
 * Offline Operation 운영자 API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/offline-operations")
@RequiredArgsConstructor
public class OfflineOperationAdminController {

    private final ManageOfflineOperationUseCase manageOfflineOperationUseCase;
    private final DrainOfflineQueueUseCase drainOfflineQueueUseCase;

    /**
     * GET /api/v1/admin/offline-operations/dead-letters
     */
    @GetMapping("/dead-letters")
    public ResponseEntity<List<OperationResponse>> deadLetters() {
        return ResponseEntity.ok(manageOfflineOperationUseCase.deadLetters().stream()
                .map(OperationResponse::from)
                .toList());
    }

    /**
     * POST /api/v1/admin/offline-operations/{operationId}/requeue
     */
    @PostMapping("/{operationId}/requeue")
    public ResponseEntity<OperationResponse> requeue(@PathVariable Long operationId) {
        log.info("Requeue dead-lettered operation: operationId={}", operationId);
        return ResponseEntity.ok(OperationResponse.from(manageOfflineOperationUseCase.requeueDeadLetter(operationId)));
    }

    /**
     * 수동 drain (스케줄러와 동일 동작)
     * POST /api/v1/admin/offline-operations/drain
     */
    @PostMapping("/drain")
    public ResponseEntity<DrainResponse> drain() {
        log.info("Manual offline queue drain requested");
        return ResponseEntity.ok(DrainResponse.from(drainOfflineQueueUseCase.drain()));
    }
}
