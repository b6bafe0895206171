package personal.salon.sync.resilience.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.resilience.adapter.in.web.dto.CallOutcomeRequest;
import personal.salon.sync.resilience.adapter.in.web.dto.CircuitStateResponse;
import personal.salon.sync.resilience.application.port.in.GetCircuitStateUseCase;
import personal.salon.sync.resilience.application.port.in.RecordCallOutcomeUseCase;

/**
 * Circuit Breaker Admin API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/circuits")
@RequiredArgsConstructor
public class CircuitAdminController {

    private final GetCircuitStateUseCase getCircuitStateUseCase;
    private final RecordCallOutcomeUseCase recordCallOutcomeUseCase;

    /**
     * GET /api/v1/admin/circuits/{service}/{environment}
     */
    @GetMapping("/{service}/{environment}")
    public ResponseEntity<CircuitStateResponse> getState(
            @PathVariable String service,
            @PathVariable String environment
    ) {
        return ResponseEntity.ok(CircuitStateResponse.from(getCircuitStateUseCase.getState(service, environment)));
    }

    /**
     * 외부 호출자가 직접 수행한 호출 결과 보고
     * POST /api/v1/admin/circuits/{service}/{environment}/outcomes
     */
    @PostMapping("/{service}/{environment}/outcomes")
    public ResponseEntity<CircuitStateResponse> recordOutcome(
            @PathVariable String service,
            @PathVariable String environment,
            @Valid @RequestBody CallOutcomeRequest request
    ) {
        log.debug("Record call outcome: service={}, environment={}, success={}", service, environment, request.success());
        return ResponseEntity.ok(CircuitStateResponse.from(
                recordCallOutcomeUseCase.recordCallOutcome(service, environment, request.success())));
    }
}
