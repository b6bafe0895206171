package personal.salon.sync.notification.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.salon.sync.notification.application.port.in.QueueNotificationCommand;
import personal.salon.sync.notification.domain.model.NotificationPriority;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 알림 등록 요청
 */
public record QueueNotificationRequest(
        @NotBlank(message = "title은 필수입니다.")
        @Size(max = 200)
        String title,

        @NotBlank(message = "message는 필수입니다.")
        @Size(max = 2000)
        String message,

        @NotBlank(message = "type은 필수입니다.")
        @Size(max = 50)
        String type,

        String priority,
        Map<String, Object> data,
        List<String> targetDevices,
        List<String> excludeDevices,
        Instant scheduledAt,
        Instant expiresAt
) {
    public QueueNotificationCommand toCommand(UUID userId) {
        return new QueueNotificationCommand(
                userId,
                title,
                message,
                type,
                NotificationPriority.from(priority),
                data,
                targetDevices,
                excludeDevices,
                scheduledAt,
                expiresAt);
    }
}
