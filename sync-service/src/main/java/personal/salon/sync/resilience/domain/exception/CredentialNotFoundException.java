package personal.salon.sync.resilience.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public class CredentialNotFoundException extends BusinessException {
    public CredentialNotFoundException(String service, String environment) {
        super(ErrorCode.CREDENTIAL_NOT_FOUND,
                String.format("Active credential not found: service=%s, environment=%s", service, environment));
    }
}
