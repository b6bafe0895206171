package personal.salon.sync.notification.domain.model;

import java.util.Map;

/**
 * 디바이스 1대로 보낼 푸시 메시지
 *
 * @param pushToken 등록된 토큰이 없거나 비활성 디바이스면 null
 */
public record PushMessage(
        Long notificationId,
        String deviceId,
        String pushToken,
        String title,
        String message,
        String type,
        NotificationPriority priority,
        Map<String, Object> data) {

    public static PushMessage of(Notification notification, String deviceId, String pushToken) {
        return new PushMessage(
                notification.id(),
                deviceId,
                pushToken,
                notification.title(),
                notification.message(),
                notification.type(),
                notification.priority(),
                notification.data());
    }
}
