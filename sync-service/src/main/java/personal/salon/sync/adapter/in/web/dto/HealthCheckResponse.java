package personal.salon.sync.adapter.in.web.dto;

import personal.salon.sync.resilience.domain.model.HealthStatus;

import java.util.Map;

/**
 * Health Check 응답
 *
 * @param database     "UP" | "DOWN"
 * @param integrations 외부 서비스 상태별 개수
 */
public record HealthCheckResponse(
        String database,
        Map<HealthStatus, Long> integrations
) {}
