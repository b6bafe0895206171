package personal.salon.sync.resilience.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.sync.resilience.domain.model.HealthStatus;
import personal.salon.sync.resilience.domain.model.ServiceHealth;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Service Health JPA Entity
 */
@Entity
@Table(name = "service_health", uniqueConstraints = {
        @UniqueConstraint(name = "uk_health_service_env", columnNames = {"service", "environment"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServiceHealthEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 100)
    private String service;

    @Column(nullable = false, updatable = false, length = 50)
    private String environment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private HealthStatus status;

    @Column(name = "last_check")
    private Instant lastCheck;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "error_rate", precision = 5, scale = 2)
    private BigDecimal errorRate;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    public static ServiceHealthEntity fromDomain(ServiceHealth health) {
        ServiceHealthEntity entity = new ServiceHealthEntity();
        entity.id = health.id();
        entity.service = health.service();
        entity.environment = health.environment();
        entity.status = health.status();
        entity.lastCheck = health.lastCheck();
        entity.responseTimeMs = health.responseTimeMs();
        entity.errorRate = health.errorRate();
        entity.consecutiveFailures = health.consecutiveFailures();
        entity.lastError = health.lastError();
        return entity;
    }

    public ServiceHealth toDomain() {
        return new ServiceHealth(id, service, environment, status, lastCheck, responseTimeMs, errorRate,
                consecutiveFailures, lastError);
    }
}
