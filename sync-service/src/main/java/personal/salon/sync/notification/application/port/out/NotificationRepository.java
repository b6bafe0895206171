package personal.salon.sync.notification.application.port.out;

import personal.salon.sync.notification.domain.model.Notification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Notification Repository (Output Port)
 */
public interface NotificationRepository {

    /**
     * @throws org.springframework.dao.OptimisticLockingFailureException 다른 인스턴스가 먼저 갱신한 경우
     */
    Notification save(Notification notification);

    Optional<Notification> findById(Long notificationId);

    /**
     * scheduledAt <= now 인 PENDING 알림 (우선순위 높은 순, 예약 시각 순)
     */
    List<Notification> findDue(Instant now, int limit);
}
