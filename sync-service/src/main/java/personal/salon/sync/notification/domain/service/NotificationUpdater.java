package personal.salon.sync.notification.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.notification.application.port.out.NotificationRepository;
import personal.salon.sync.notification.domain.exception.NotificationNotFoundException;
import personal.salon.sync.notification.domain.model.Notification;

import java.util.function.UnaryOperator;

/**
 * 알림 read-modify-write (단일 트랜잭션)
 * version 충돌 시 재시도는 호출자 책임
 */
@Component
@RequiredArgsConstructor
public class NotificationUpdater {

    private final NotificationRepository notificationRepository;

    @Transactional
    public Notification update(Long notificationId, UnaryOperator<Notification> change) {
        Notification current = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
        Notification next = change.apply(current);
        if (next.equals(current)) {
            return current;
        }
        return notificationRepository.save(next);
    }
}
