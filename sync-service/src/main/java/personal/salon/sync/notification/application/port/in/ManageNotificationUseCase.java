package personal.salon.sync.notification.application.port.in;

import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;

import java.util.UUID;

public interface ManageNotificationUseCase {

    Notification getNotification(UUID userId, Long notificationId);

    /**
     * 디바이스 수신 확인/실패 반영
     */
    Notification recordDeliveryOutcome(UUID userId, Long notificationId, String deviceId, DeliveryOutcome outcome);
}
