package personal.salon.sync.notification.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.salon.sync.notification.application.port.out.NotificationRepository;
import personal.salon.sync.notification.domain.model.Notification;
import personal.salon.sync.notification.domain.model.NotificationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class NotificationPersistenceAdapter implements NotificationRepository {

    private final JpaNotificationRepository jpaNotificationRepository;

    @Override
    public Notification save(Notification notification) {
        return jpaNotificationRepository.saveAndFlush(NotificationEntity.fromDomain(notification)).toDomain();
    }

    @Override
    public Optional<Notification> findById(Long notificationId) {
        return jpaNotificationRepository.findById(notificationId).map(NotificationEntity::toDomain);
    }

    @Override
    public List<Notification> findDue(Instant now, int limit) {
        return jpaNotificationRepository.findDue(NotificationStatus.PENDING, now, PageRequest.of(0, limit))
                .stream()
                .map(NotificationEntity::toDomain)
                .toList();
    }
}
