package personal.salon.sync.resilience.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import personal.salon.sync.resilience.domain.model.CredentialAuditAction;
import personal.salon.sync.resilience.domain.model.CredentialAuditEntry;

import java.time.Instant;

/**
 * Credential Audit Log JPA Entity (insert only)
 */
@Entity
@Immutable
@Table(name = "credential_audit_log", indexes = {
        @Index(name = "idx_audit_service_env", columnList = "service, environment, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CredentialAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "credential_id", nullable = false, updatable = false)
    private Long credentialId;

    @Column(name = "previous_credential_id", updatable = false)
    private Long previousCredentialId;

    @Column(nullable = false, updatable = false, length = 100)
    private String service;

    @Column(nullable = false, updatable = false, length = 50)
    private String environment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private CredentialAuditAction action;

    @Column(name = "performed_by", updatable = false, length = 100)
    private String performedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static CredentialAuditEntity fromDomain(CredentialAuditEntry entry) {
        CredentialAuditEntity entity = new CredentialAuditEntity();
        entity.credentialId = entry.credentialId();
        entity.previousCredentialId = entry.previousCredentialId();
        entity.service = entry.service();
        entity.environment = entry.environment();
        entity.action = entry.action();
        entity.performedBy = entry.performedBy();
        entity.createdAt = entry.createdAt();
        return entity;
    }


    public CredentialAuditEntry toDomain() {
        return new CredentialAuditEntry(id, credentialId, previousCredentialId, service, environment,
                action, performedBy, createdAt);
    }
}
