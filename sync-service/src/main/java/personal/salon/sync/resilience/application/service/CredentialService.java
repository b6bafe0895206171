package personal.salon.sync.resilience.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.resilience.application.port.in.GetActiveCredentialUseCase;
import personal.salon.sync.resilience.application.port.in.ManageCredentialUseCase;
import personal.salon.sync.resilience.application.port.in.StoreCredentialCommand;
import personal.salon.sync.resilience.application.port.out.CredentialRepository;
import personal.salon.sync.resilience.domain.exception.CredentialExpiredException;
import personal.salon.sync.resilience.domain.exception.CredentialNotFoundException;
import personal.salon.sync.resilience.domain.model.Credential;
import personal.salon.sync.resilience.domain.model.CredentialAuditAction;
import personal.salon.sync.resilience.domain.model.CredentialAuditEntry;
import personal.salon.sync.resilience.domain.model.CredentialRecord;
import personal.salon.sync.resilience.domain.model.EncryptedCredential;
import personal.salon.sync.resilience.domain.service.CredentialCipher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Credential Service
 * 서드파티 자격 증명 암호화 저장, 교체, 감사
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialService implements GetActiveCredentialUseCase, ManageCredentialUseCase {

    private final CredentialRepository credentialRepository;
    private final CredentialCipher credentialCipher;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Credential getActive(String service, String environment) {
        CredentialRecord record = credentialRepository.findActive(service, environment)
                .orElseThrow(() -> new CredentialNotFoundException(service, environment));

        if (record.isExpired(clock.instant())) {
            log.warn("Credential expired: service={}, environment={}, expiresAt={}",
                    service, environment, record.expiresAt());
            throw new CredentialExpiredException(service, environment, record.expiresAt());
        }

        String[] decrypted = credentialCipher.decrypt(record.encrypted());
        return new Credential(record.id(), service, environment, decrypted[0], decrypted[1], record.expiresAt());
    }

    @Override
    @Transactional
    public CredentialRecord store(StoreCredentialCommand command) {
        if (credentialRepository.findActive(command.service(), command.environment()).isPresent()) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    String.format("Active credential already exists, rotate instead: service=%s, environment=%s",
                            command.service(), command.environment()));
        }

        CredentialRecord saved;
        try {
            saved = credentialRepository.save(newRecord(command));
        } catch (DataIntegrityViolationException e) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    String.format("Concurrent credential registration: service=%s, environment=%s",
                            command.service(), command.environment()), e);
        }
        credentialRepository.appendAudit(
                CredentialAuditEntry.of(saved, null, CredentialAuditAction.CREATE, command.performedBy(),
                        clock.instant()));

        log.info("Credential stored: service={}, environment={}, credentialId={}",
                command.service(), command.environment(), saved.id());
        return saved;
    }

    @Override
    @Transactional
    public CredentialRecord rotate(StoreCredentialCommand command) {
        CredentialRecord previous = credentialRepository.findActiveForUpdate(command.service(), command.environment())
                .orElseThrow(() -> new CredentialNotFoundException(command.service(), command.environment()));

        credentialRepository.save(previous.deactivate());
        CredentialRecord rotated = credentialRepository.save(newRecord(command));
        credentialRepository.appendAudit(
                CredentialAuditEntry.of(rotated, previous.id(), CredentialAuditAction.ROTATE, command.performedBy(),
                        clock.instant()));

        log.info("Credential rotated: service={}, environment={}, previousId={}, newId={}",
                command.service(), command.environment(), previous.id(), rotated.id());
        return rotated;
    }

    @Override
    @Transactional
    public CredentialRecord deactivate(String service, String environment, String performedBy) {
        CredentialRecord active = credentialRepository.findActiveForUpdate(service, environment)
                .orElseThrow(() -> new CredentialNotFoundException(service, environment));

        CredentialRecord deactivated = credentialRepository.save(active.deactivate());
        credentialRepository.appendAudit(
                CredentialAuditEntry.of(deactivated, null, CredentialAuditAction.DEACTIVATE, performedBy,
                        clock.instant()));

        log.info("Credential deactivated: service={}, environment={}, credentialId={}",
                service, environment, deactivated.id());
        return deactivated;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CredentialAuditEntry> auditTrail(String service, String environment) {
        return credentialRepository.findAudit(service, environment);
    }

    private CredentialRecord newRecord(StoreCredentialCommand command) {
        Instant now = clock.instant();
        EncryptedCredential encrypted = credentialCipher.encrypt(command.apiKey(), command.apiSecret());
        return CredentialRecord.create(command.service(), command.environment(), encrypted, command.expiresAt(), now);
    }
}
