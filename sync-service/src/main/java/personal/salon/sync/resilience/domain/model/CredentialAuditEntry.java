package personal.salon.sync.resilience.domain.model;

import java.time.Instant;

/**
 * Credential Audit Entry (insert only)
 *
 * @param previousCredentialId ROTATE일 때 교체된 자격 증명
 */
public record CredentialAuditEntry(
        Long id,
        Long credentialId,
        Long previousCredentialId,
        String service,
        String environment,
        CredentialAuditAction action,
        String performedBy,
        Instant createdAt) {

    public static CredentialAuditEntry of(CredentialRecord credential, Long previousCredentialId,
                                          CredentialAuditAction action, String performedBy, Instant now) {
        return new CredentialAuditEntry(null, credential.id(), previousCredentialId, credential.service(),
                credential.environment(), action, performedBy, now);
    }
}
