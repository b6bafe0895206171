package personal.salon.sync.resilience.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Credential Record Domain Model
 * 저장 형태 (암호문), 삭제 없이 active 플래그만 전환
 */
public record CredentialRecord(
        Long id,
        String service,
        String environment,
        EncryptedCredential encrypted,
        boolean active,
        Instant expiresAt,
        Instant lastRotated,
        Instant createdAt) {

    public CredentialRecord {
        if (service == null || service.isBlank() || environment == null || environment.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service and environment are required");
        }
        if (encrypted == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Encrypted credential cannot be null");
        }
    }

    public static CredentialRecord create(String service, String environment, EncryptedCredential encrypted,
                                          Instant expiresAt, Instant now) {
        return new CredentialRecord(null, service, environment, encrypted, true, expiresAt, now, now);
    }

    public CredentialRecord deactivate() {
        return new CredentialRecord(id, service, environment, encrypted, false, expiresAt, lastRotated, createdAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
