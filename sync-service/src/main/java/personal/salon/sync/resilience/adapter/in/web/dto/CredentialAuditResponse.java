package personal.salon.sync.resilience.adapter.in.web.dto;

import personal.salon.sync.resilience.domain.model.CredentialAuditEntry;

import java.time.Instant;

public record CredentialAuditResponse(
        Long id,
        Long credentialId,
        Long previousCredentialId,
        String action,
        String performedBy,
        Instant createdAt
) {
    public static CredentialAuditResponse from(CredentialAuditEntry entry) {
        return new CredentialAuditResponse(
                entry.id(),
                entry.credentialId(),
                entry.previousCredentialId(),
                entry.action().name(),
                entry.performedBy(),
                entry.createdAt());
    }
}
