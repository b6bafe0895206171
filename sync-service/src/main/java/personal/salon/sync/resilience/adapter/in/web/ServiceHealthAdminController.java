package personal.salon.sync.resilience.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.resilience.adapter.in.web.dto.RecordHealthRequest;
import personal.salon.sync.resilience.adapter.in.web.dto.ServiceHealthResponse;
import personal.salon.sync.resilience.application.port.in.ServiceHealthUseCase;
import personal.salon.sync.resilience.domain.model.HealthStatus;

import java.util.List;
import java.util.Map;

/**
 * Service Health Admin API Controller
 */
@RestController
@RequestMapping("/api/v1/admin/health")
@RequiredArgsConstructor
public class ServiceHealthAdminController {

    private final ServiceHealthUseCase serviceHealthUseCase;

    /**
     * PUT /api/v1/admin/health/{service}/{environment}
     */
    @PutMapping("/{service}/{environment}")
    public ResponseEntity<ServiceHealthResponse> recordHealth(
            @PathVariable String service,
            @PathVariable String environment,
            @Valid @RequestBody RecordHealthRequest request
    ) {
        return ResponseEntity.ok(ServiceHealthResponse.from(
                serviceHealthUseCase.recordHealth(request.toCommand(service, environment))));
    }

    /**
     * GET /api/v1/admin/health/summary
     */
    @GetMapping("/summary")
    public ResponseEntity<Map<HealthStatus, Long>> summary() {
        return ResponseEntity.ok(serviceHealthUseCase.healthSummary());
    }

    @GetMapping
    public ResponseEntity<List<ServiceHealthResponse>> list() {
        return ResponseEntity.ok(serviceHealthUseCase.listHealth().stream()
                .map(ServiceHealthResponse::from)
                .toList());
    }
}
