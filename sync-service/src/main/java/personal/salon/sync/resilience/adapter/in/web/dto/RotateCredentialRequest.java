package personal.salon.sync.resilience.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import personal.salon.sync.resilience.application.port.in.StoreCredentialCommand;

import java.time.Instant;

public record RotateCredentialRequest(
        @NotBlank(message = "apiKey는 필수입니다.")
        String apiKey,

        @NotBlank(message = "apiSecret은 필수입니다.")
        String apiSecret,

        Instant expiresAt
) {
    public StoreCredentialCommand toCommand(String service, String environment, String performedBy) {
        return new StoreCredentialCommand(service, environment, apiKey, apiSecret, expiresAt, performedBy);
    }

    @Override
    public String toString() {
        return "RotateCredentialRequest[expiresAt=" + expiresAt + "]";
    }
}
