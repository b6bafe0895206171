package personal.salon.sync.resilience.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface JpaCredentialRepository extends JpaRepository<CredentialEntity, Long> {

    Optional<CredentialEntity> findFirstByServiceAndEnvironmentAndActiveTrue(String service, String environment);

    /**
     * 교체/비활성화 중 동시 교체 방지 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CredentialEntity c " +
            "WHERE c.service = :service AND c.environment = :environment AND c.active = true")
    Optional<CredentialEntity> findActiveForUpdate(@Param("service") String service,
                                                   @Param("environment") String environment);
}
