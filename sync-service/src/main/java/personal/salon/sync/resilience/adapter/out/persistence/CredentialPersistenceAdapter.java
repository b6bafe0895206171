package personal.salon.sync.resilience.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.sync.resilience.application.port.out.CredentialRepository;
import personal.salon.sync.resilience.domain.model.CredentialAuditEntry;
import personal.salon.sync.resilience.domain.model.CredentialRecord;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CredentialPersistenceAdapter implements CredentialRepository {

    private final JpaCredentialRepository jpaCredentialRepository;
    private final JpaCredentialAuditRepository jpaCredentialAuditRepository;

    @Override
    public Optional<CredentialRecord> findActive(String service, String environment) {
        return jpaCredentialRepository.findFirstByServiceAndEnvironmentAndActiveTrue(service, environment)
                .map(CredentialEntity::toDomain);
    }

    @Override
    public Optional<CredentialRecord> findActiveForUpdate(String service, String environment) {
        return jpaCredentialRepository.findActiveForUpdate(service, environment)
                .map(CredentialEntity::toDomain);
    }

    @Override
    public CredentialRecord save(CredentialRecord credential) {
        // 비활성화 → 신규 활성 순서를 그대로 반영해야 active_slot 제약을 통과
        return jpaCredentialRepository.saveAndFlush(CredentialEntity.fromDomain(credential)).toDomain();
    }

    @Override
    public CredentialAuditEntry appendAudit(CredentialAuditEntry entry) {
        return jpaCredentialAuditRepository.save(CredentialAuditEntity.fromDomain(entry)).toDomain();
    }

    @Override
    public List<CredentialAuditEntry> findAudit(String service, String environment) {
        return jpaCredentialAuditRepository.findByServiceAndEnvironmentOrderByIdAsc(service, environment)
                .stream()
                .map(CredentialAuditEntity::toDomain)
                .toList();
    }
}
