package personal.salon.sync.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.salon.common.dto.ApiResponse;
import personal.salon.common.health.HealthCheckService;
import personal.salon.sync.adapter.in.web.dto.HealthCheckResponse;
import personal.salon.sync.resilience.application.port.in.ServiceHealthUseCase;
import personal.salon.sync.resilience.domain.model.HealthStatus;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Health Check API Controller
 * 데이터베이스 연결과 외부 서비스 헬스 요약을 함께 반환
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final ServiceHealthUseCase serviceHealthUseCase;

    /**
     * GET /api/v1/health
     * 외부 서비스가 UNHEALTHY여도 이 서비스 자체는 동작하므로 DB 상태만으로 판정
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        Map<HealthStatus, Long> integrations = serviceHealthUseCase.healthSummary();

        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, integrations);

        if ("UP".equals(databaseStatus)) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
