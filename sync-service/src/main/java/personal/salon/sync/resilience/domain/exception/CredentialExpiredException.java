package personal.salon.sync.resilience.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Credential Expired Exception
 * 만료된 자격 증명으로는 네트워크 호출을 시도하지 않음
 */
public class CredentialExpiredException extends BusinessException {
    public CredentialExpiredException(String service, String environment, Instant expiresAt) {
        super(ErrorCode.CREDENTIAL_EXPIRED,
                String.format("Credential expired: service=%s, environment=%s, expiresAt=%s",
                        service, environment, expiresAt));
    }
}
