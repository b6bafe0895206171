package personal.salon.sync.notification.application.port.in;

import personal.salon.sync.notification.domain.model.NotificationPriority;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 알림 등록 Command
 *
 * @param targetDevices 비어 있으면 활성 디바이스 전체 - excludeDevices
 * @param scheduledAt   null이면 즉시
 * @param expiresAt     null이면 scheduledAt + sync.notification.default-ttl-hours
 */
public record QueueNotificationCommand(
        UUID userId,
        String title,
        String message,
        String type,
        NotificationPriority priority,
        Map<String, Object> data,
        List<String> targetDevices,
        List<String> excludeDevices,
        Instant scheduledAt,
        Instant expiresAt) {
}
