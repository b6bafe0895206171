package personal.salon.sync.resilience.adapter.in.web.dto;

import personal.salon.sync.resilience.domain.model.CredentialRecord;

import java.time.Instant;

/**
 * 자격 증명 메타데이터 응답 (키/시크릿 미포함)
 */
public record CredentialResponse(
        Long id,
        String service,
        String environment,
        boolean active,
        Instant expiresAt,
        Instant lastRotated,
        Instant createdAt
) {
    public static CredentialResponse from(CredentialRecord record) {
        return new CredentialResponse(
                record.id(),
                record.service(),
                record.environment(),
                record.active(),
                record.expiresAt(),
                record.lastRotated(),
                record.createdAt());
    }
}
