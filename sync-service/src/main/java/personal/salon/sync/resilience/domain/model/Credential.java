package personal.salon.sync.resilience.domain.model;

import java.time.Instant;

/**
 * 복호화된 자격 증명
 * toString은 키/시크릿을 노출하지 않음
 */
public record Credential(
        Long id,
        String service,
        String environment,
        String apiKey,
        String apiSecret,
        Instant expiresAt) {

    @Override
    public String toString() {
        return "Credential[id=" + id + ", service=" + service + ", environment=" + environment
                + ", expiresAt=" + expiresAt + "]";
    }
}
