package personal.salon.sync.resilience.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.sync.resilience.domain.model.CircuitBreakerState;
import personal.salon.sync.resilience.domain.model.CircuitState;

import java.time.Instant;

/**
 * Circuit Breaker State JPA Entity
 * version 컬럼으로 동시 갱신 시 lost update 방지
 */
@Entity
@Table(name = "circuit_breaker_states", uniqueConstraints = {
        @UniqueConstraint(name = "uk_circuit_service_env", columnNames = {"service", "environment"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CircuitBreakerStateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 100)
    private String service;

    @Column(nullable = false, updatable = false, length = 50)
    private String environment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CircuitState state;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "last_failure_time")
    private Instant lastFailureTime;

    @Column(name = "next_retry_time")
    private Instant nextRetryTime;

    @Column(name = "failure_threshold", nullable = false)
    private int failureThreshold;

    @Column(name = "success_threshold", nullable = false)
    private int successThreshold;

    @Column(name = "timeout_seconds", nullable = false)
    private long timeoutSeconds;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public static CircuitBreakerStateEntity fromDomain(CircuitBreakerState circuit, Instant savedAt) {
        CircuitBreakerStateEntity entity = new CircuitBreakerStateEntity();
        entity.id = circuit.id();
        entity.service = circuit.service();
        entity.environment = circuit.environment();
        entity.state = circuit.state();
        entity.failureCount = circuit.failureCount();
        entity.successCount = circuit.successCount();
        entity.lastFailureTime = circuit.lastFailureTime();
        entity.nextRetryTime = circuit.nextRetryTime();
        entity.failureThreshold = circuit.failureThreshold();
        entity.successThreshold = circuit.successThreshold();
        entity.timeoutSeconds = circuit.timeoutSeconds();
        entity.updatedAt = savedAt;
        entity.version = circuit.version();
        return entity;
    }

    public CircuitBreakerState toDomain() {
        return new CircuitBreakerState(id, service, environment, state, failureCount, successCount,
                lastFailureTime, nextRetryTime, failureThreshold, successThreshold, timeoutSeconds, version);
    }
}
