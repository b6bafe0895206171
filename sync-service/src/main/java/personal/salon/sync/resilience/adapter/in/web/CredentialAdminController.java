package personal.salon.sync.resilience.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.resilience.adapter.in.web.dto.CredentialAuditResponse;
import personal.salon.sync.resilience.adapter.in.web.dto.CredentialResponse;
import personal.salon.sync.resilience.adapter.in.web.dto.RotateCredentialRequest;
import personal.salon.sync.resilience.adapter.in.web.dto.StoreCredentialRequest;
import personal.salon.sync.resilience.application.port.in.ManageCredentialUseCase;

import java.util.List;
import java.util.UUID;

/**
 * Credential Admin API Controller
 * 응답에는 키/시크릿을 포함하지 않음
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/credentials")
@RequiredArgsConstructor
public class CredentialAdminController {

    private final ManageCredentialUseCase manageCredentialUseCase;

    /**
     * POST /api/v1/admin/credentials
     */
    @PostMapping
    public ResponseEntity<CredentialResponse> store(
            @Valid @RequestBody StoreCredentialRequest request,
            @RequestHeader("X-User-Id") UUID operatorId
    ) {
        log.info("Store credential: service={}, environment={}, operator={}",
                request.service(), request.environment(), operatorId);
        CredentialResponse response = CredentialResponse.from(
                manageCredentialUseCase.store(request.toCommand(operatorId.toString())));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * PUT /api/v1/admin/credentials/{service}/{environment}/rotate
     */
    @PutMapping("/{service}/{environment}/rotate")
    public ResponseEntity<CredentialResponse> rotate(
            @PathVariable String service,
            @PathVariable String environment,
            @Valid @RequestBody RotateCredentialRequest request,
            @RequestHeader("X-User-Id") UUID operatorId
    ) {
        log.info("Rotate credential: service={}, environment={}, operator={}", service, environment, operatorId);
        return ResponseEntity.ok(CredentialResponse.from(
                manageCredentialUseCase.rotate(request.toCommand(service, environment, operatorId.toString()))));
    }

    /**
     * DELETE /api/v1/admin/credentials/{service}/{environment}
     * 삭제가 아닌 비활성화
     */
    @DeleteMapping("/{service}/{environment}")
    public ResponseEntity<CredentialResponse> deactivate(
            @PathVariable String service,
            @PathVariable String environment,
            @RequestHeader("X-User-Id") UUID operatorId
    ) {
        log.info("Deactivate credential: service={}, environment={}, operator={}", service, environment, operatorId);
        return ResponseEntity.ok(CredentialResponse.from(
                manageCredentialUseCase.deactivate(service, environment, operatorId.toString())));
    }

    /**
     * 감사 로그 (기록 순서)
     * GET /api/v1/admin/credentials/{service}/{environment}/audit
     */
    @GetMapping("/{service}/{environment}/audit")
    public ResponseEntity<List<CredentialAuditResponse>> auditTrail(
            @PathVariable String service,
            @PathVariable String environment
    ) {
        return ResponseEntity.ok(manageCredentialUseCase.auditTrail(service, environment).stream()
                .map(CredentialAuditResponse::from)
                .toList());
    }
}
