package personal.salon.sync.resilience.application.port.out;

import personal.salon.sync.resilience.domain.model.CredentialAuditEntry;
import personal.salon.sync.resilience.domain.model.CredentialRecord;

import java.util.List;
import java.util.Optional;

/**
 * Credential Repository Port
 * 자격 증명과 감사 로그 모두 삭제 API 없음
 */
public interface CredentialRepository {

    Optional<CredentialRecord> findActive(String service, String environment);

    /**
     * 활성 자격 증명을 비관적 잠금으로 조회
     */
    Optional<CredentialRecord> findActiveForUpdate(String service, String environment);

    CredentialRecord save(CredentialRecord credential);

    CredentialAuditEntry appendAudit(CredentialAuditEntry entry);

    List<CredentialAuditEntry> findAudit(String service, String environment);
}
