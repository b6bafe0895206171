package personal.salon.sync.resilience.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.sync.resilience.domain.model.CredentialRecord;
import personal.salon.sync.resilience.domain.model.EncryptedCredential;

import java.time.Instant;

/**
 * Service Credential JPA Entity
 *
 * active_slot: 활성이면 TRUE, 아니면 NULL
 * (service, environment, active_slot) Unique Index로 활성 자격 증명 최대 1개 보장
 */
@Entity
@Table(name = "service_credentials",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_credential_active", columnNames = {"service", "environment", "active_slot"})
        },
        indexes = {
                @Index(name = "idx_credential_service_env", columnList = "service, environment")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CredentialEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 100)
    private String service;

    @Column(nullable = false, updatable = false, length = 50)
    private String environment;

    @Column(name = "encrypted_key", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String encryptedKey;

    @Column(name = "encrypted_secret", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String encryptedSecret;

    @Column(nullable = false, updatable = false, length = 32)
    private String iv;

    @Column(name = "auth_tag", nullable = false, updatable = false, length = 32)
    private String authTag;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "active_slot")
    private Boolean activeSlot;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_rotated")
    private Instant lastRotated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static CredentialEntity fromDomain(CredentialRecord credential) {
        CredentialEntity entity = new CredentialEntity();
        entity.id = credential.id();
        entity.service = credential.service();
        entity.environment = credential.environment();
        entity.encryptedKey = credential.encrypted().encryptedKey();
        entity.encryptedSecret = credential.encrypted().encryptedSecret();
        entity.iv = credential.encrypted().iv();
        entity.authTag = credential.encrypted().authTag();
        entity.active = credential.active();
        entity.activeSlot = credential.active() ? Boolean.TRUE : null;
        entity.expiresAt = credential.expiresAt();
        entity.lastRotated = credential.lastRotated();
        entity.createdAt = credential.createdAt();
        return entity;
    }


    public CredentialRecord toDomain() {
        return new CredentialRecord(id, service, environment,
                new EncryptedCredential(encryptedKey, encryptedSecret, iv, authTag),
                active, expiresAt, lastRotated, createdAt);
    }
}
