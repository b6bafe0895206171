package personal.salon.sync.notification.application.port.in;

import personal.salon.sync.notification.domain.model.Notification;

import java.util.List;

/**
 * Queue Notification UseCase (Input Port)
 */
public interface QueueNotificationUseCase {

    Notification enqueue(QueueNotificationCommand command);

    /**
     * 전달 대상 디바이스 계산
     * - targetDevices가 있으면 그대로 (excludeDevices 무시)
     * - 없으면 사용자의 활성 디바이스 - excludeDevices
     */
    List<String> resolveTargets(Notification notification);
}
