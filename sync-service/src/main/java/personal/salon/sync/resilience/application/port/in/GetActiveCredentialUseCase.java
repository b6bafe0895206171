package personal.salon.sync.resilience.application.port.in;

import personal.salon.sync.resilience.domain.model.Credential;

public interface GetActiveCredentialUseCase {

    /**
     * @throws personal.salon.sync.resilience.domain.exception.CredentialNotFoundException 활성 자격 증명 없음
     * @throws personal.salon.sync.resilience.domain.exception.CredentialExpiredException  expires_at 경과
     */
    Credential getActive(String service, String environment);
}
