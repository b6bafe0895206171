package personal.salon.sync.resilience.application.port.in;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.time.Instant;

/**
 * 자격 증명 등록/교체 Command
 */
public record StoreCredentialCommand(
        String service,
        String environment,
        String apiKey,
        String apiSecret,
        Instant expiresAt,
        String performedBy) {

    public StoreCredentialCommand {
        if (service == null || service.isBlank() || environment == null || environment.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service and environment are required");
        }
        if (apiKey == null || apiKey.isEmpty() || apiSecret == null || apiSecret.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "API key and secret are required");
        }
    }

    @Override
    public String toString() {
        return "StoreCredentialCommand[service=" + service + ", environment=" + environment
                + ", expiresAt=" + expiresAt + ", performedBy=" + performedBy + "]";
    }
}
