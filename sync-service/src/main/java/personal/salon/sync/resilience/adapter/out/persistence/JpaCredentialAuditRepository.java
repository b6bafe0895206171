package personal.salon.sync.resilience.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaCredentialAuditRepository extends JpaRepository<CredentialAuditEntity, Long> {

    List<CredentialAuditEntity> findByServiceAndEnvironmentOrderByIdAsc(String service, String environment);
}
