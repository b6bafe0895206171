package personal.salon.sync.resilience.application.port.in;

import personal.salon.sync.resilience.domain.model.CredentialAuditEntry;
import personal.salon.sync.resilience.domain.model.CredentialRecord;

import java.util.List;

/**
 * Manage Credential Use Case
 * 모든 변경은 감사 로그를 남기며, 이전 자격 증명은 삭제하지 않고 비활성화
 */
public interface ManageCredentialUseCase {

    /**
     * 최초 등록 (CREATE), 이미 활성 자격 증명이 있으면 거부
     */
    CredentialRecord store(StoreCredentialCommand command);

    /**
     * 교체 (ROTATE): 신규 활성화 + 기존 비활성화
     */
    CredentialRecord rotate(StoreCredentialCommand command);

    /**
     * 비활성화 (DEACTIVATE)
     */
    CredentialRecord deactivate(String service, String environment, String performedBy);

    List<CredentialAuditEntry> auditTrail(String service, String environment);
}
