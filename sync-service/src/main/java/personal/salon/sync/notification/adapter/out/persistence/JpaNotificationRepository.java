package personal.salon.sync.notification.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.salon.sync.notification.domain.model.NotificationStatus;

import java.time.Instant;
import java.util.List;

public interface JpaNotificationRepository extends JpaRepository<NotificationEntity, Long> {

    @Query("""
            SELECT n FROM NotificationEntity n
            WHERE n.status = :status AND n.scheduledAt <= :now
            ORDER BY CASE n.priority
                        WHEN personal.salon.sync.notification.domain.model.NotificationPriority.URGENT THEN 0
                        WHEN personal.salon.sync.notification.domain.model.NotificationPriority.HIGH THEN 1
                        WHEN personal.salon.sync.notification.domain.model.NotificationPriority.NORMAL THEN 2
                        ELSE 3
                     END,
                     n.scheduledAt ASC
            """)
    List<NotificationEntity> findDue(@Param("status") NotificationStatus status,
                                     @Param("now") Instant now,
                                     Pageable pageable);
}
