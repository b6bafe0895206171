package personal.salon.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Sync 설정 Properties
 * application.yml의 sync.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "sync")
public record SyncProperties(
        OfflineQueue offlineQueue,
        Notification notification,
        Resilience resilience,
        Credentials credentials,
        Health health
) {
    public record OfflineQueue(
            int batchSize,
            int defaultMaxRetries,
            int defaultPriority,
            long claimTimeoutSeconds
    ) {}

    public record Notification(
            int batchSize,
            long defaultTtlHours
    ) {}

    public record Resilience(
            String environment,
            int failureThreshold,
            int successThreshold,
            long timeoutSeconds
    ) {}

    public record Credentials(
            String masterKey  // Base64 인코딩된 AES-256 키
    ) {}

    public record Health(
            long degradedThresholdMs,
            List<ProbeTarget> targets
    ) {
        public record ProbeTarget(
                String service,
                String url
        ) {}
    }
}
