package personal.salon.sync.notification.adapter.in.web.dto;

import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NotificationResponse(
        Long notificationId,
        String title,
        String message,
        String type,
        String priority,
        Map<String, Object> data,
        List<String> targetDevices,
        List<String> excludeDevices,
        Map<String, String> deliveryStatus,
        String status,
        Instant scheduledAt,
        Instant expiresAt,
        Instant sentAt
) {
    public static NotificationResponse from(Notification notification) {
        Map<String, String> deliveryStatus = new LinkedHashMap<>();
        notification.deliveryStatus().forEach((deviceId, outcome) -> deliveryStatus.put(deviceId, wire(outcome)));
        return new NotificationResponse(
                notification.id(),
                notification.title(),
                notification.message(),
                notification.type(),
                notification.priority().name(),
                notification.data(),
                notification.targetDevices(),
                notification.excludeDevices(),
                deliveryStatus,
                notification.status().name(),
                notification.scheduledAt(),
                notification.expiresAt(),
                notification.sentAt());
    }

    private static String wire(DeliveryOutcome outcome) {
        return outcome.name().toLowerCase();
    }
}
