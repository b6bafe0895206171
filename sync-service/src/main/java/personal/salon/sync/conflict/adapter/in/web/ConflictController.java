package personal.salon.sync.conflict.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.conflict.adapter.in.web.dto.ConflictResolutionResponse;
import personal.salon.sync.conflict.adapter.in.web.dto.ResolveConflictRequest;
import personal.salon.sync.conflict.application.port.in.ResolveConflictUseCase;
import personal.salon.sync.conflict.domain.model.ConflictResolution;

import java.util.UUID;

/**
 * Conflict API Controller
 * 충돌은 오류가 아닌 정상 결과로 200 응답
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sync/conflicts")
@RequiredArgsConstructor
public class ConflictController {

    private final ResolveConflictUseCase resolveConflictUseCase;

    /**
     * POST /api/v1/sync/conflicts/resolve
     */
    @PostMapping("/resolve")
    public ResponseEntity<ConflictResolutionResponse> resolve(
            @Valid @RequestBody ResolveConflictRequest request,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Resolve conflict: userId={}, deviceId={}, entityType={}, entityId={}",
                userId, request.deviceId(), request.entityType(), request.entityId());

        ConflictResolution resolution = resolveConflictUseCase.resolve(request.toCommand(userId));

        return ResponseEntity.ok(ConflictResolutionResponse.from(resolution));
    }
}
