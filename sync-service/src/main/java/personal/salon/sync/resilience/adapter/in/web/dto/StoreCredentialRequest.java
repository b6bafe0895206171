package personal.salon.sync.resilience.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.salon.sync.resilience.application.port.in.StoreCredentialCommand;

import java.time.Instant;

/**
 * 자격 증명 등록 요청
 */
public record StoreCredentialRequest(
        @NotBlank(message = "service는 필수입니다.")
        @Size(max = 100)
        String service,

        @NotBlank(message = "environment는 필수입니다.")
        @Size(max = 50)
        String environment,

        @NotBlank(message = "apiKey는 필수입니다.")
        String apiKey,

        @NotBlank(message = "apiSecret은 필수입니다.")
        String apiSecret,

        Instant expiresAt
) {
    public StoreCredentialCommand toCommand(String performedBy) {
        return new StoreCredentialCommand(service, environment, apiKey, apiSecret, expiresAt, performedBy);
    }

    @Override
    public String toString() {
        return "StoreCredentialRequest[service=" + service + ", environment=" + environment + "]";
    }
}
