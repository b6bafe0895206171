package personal.salon.sync.notification.application.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.notification.application.port.in.ManageNotificationUseCase;
import personal.salon.sync.notification.application.port.in.QueueNotificationCommand;
import personal.salon.sync.notification.application.port.in.QueueNotificationUseCase;
import personal.salon.sync.notification.application.port.out.NotificationRepository;
import personal.salon.sync.notification.domain.exception.NotificationNotFoundException;
import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;
import personal.salon.sync.notification.domain.service.NotificationUpdater;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Notification Fanout Service
 * 알림 등록, 대상 디바이스 계산, 디바이스별 전달 결과 기록
 */
@Slf4j
@Service
public class NotificationFanoutService implements QueueNotificationUseCase, ManageNotificationUseCase {

    static final String RETRY_NAME = "notificationUpdate";

    private final NotificationRepository notificationRepository;
    private final NotificationUpdater notificationUpdater;
    private final GetDevicesUseCase getDevicesUseCase;
    private final SyncProperties syncProperties;
    private final Retry retry;
    private final Clock clock;

    public NotificationFanoutService(NotificationRepository notificationRepository,
                                     NotificationUpdater notificationUpdater,
                                     GetDevicesUseCase getDevicesUseCase,
                                     SyncProperties syncProperties,
                                     RetryRegistry retryRegistry,
                                     Clock clock) {
        this.notificationRepository = notificationRepository;
        this.notificationUpdater = notificationUpdater;
        this.getDevicesUseCase = getDevicesUseCase;
        this.syncProperties = syncProperties;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.clock = clock;
    }

    @Override
    public Notification enqueue(QueueNotificationCommand command) {
        Notification notification = Notification.pending(
                command.userId(),
                command.title(),
                command.message(),
                command.type(),
                command.priority(),
                command.data(),
                command.targetDevices(),
                command.excludeDevices(),
                command.scheduledAt(),
                command.expiresAt(),
                Duration.ofHours(syncProperties.notification().defaultTtlHours()),
                clock.instant());

        Notification saved = notificationRepository.save(notification);
        log.info("Notification queued: notificationId={}, userId={}, type={}, priority={}, scheduledAt={}, targets={}, excludes={}",
                saved.id(), saved.userId(), saved.type(), saved.priority(), saved.scheduledAt(),
                saved.targetDevices().size(), saved.excludeDevices().size());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> resolveTargets(Notification notification) {
        if (notification.hasExplicitTargets()) {
            return notification.targetDevices();
        }
        Set<String> excluded = Set.copyOf(notification.excludeDevices());
        return getDevicesUseCase.getActiveDevices(notification.userId()).stream()
                .map(Device::deviceId)
                .filter(deviceId -> !excluded.contains(deviceId))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Notification getNotification(UUID userId, Long notificationId) {
        return notificationRepository.findById(notificationId)
                .filter(notification -> notification.userId().equals(userId))
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
    }

    @Override
    public Notification recordDeliveryOutcome(UUID userId, Long notificationId, String deviceId,
                                              DeliveryOutcome outcome) {
        Notification current = getNotification(userId, notificationId);
        current.requireAcceptsOutcomeFrom(deviceId);
        // 디바이스 귀속 확인 (DeviceNotFoundException 전파)
        getDevicesUseCase.getDevice(userId, deviceId);

        Notification updated = Retry.decorateSupplier(retry, () -> notificationUpdater.update(
                notificationId, notification -> notification.withDeliveryOutcome(deviceId, outcome))).get();

        log.debug("Delivery outcome recorded: notificationId={}, deviceId={}, outcome={}",
                notificationId, deviceId, outcome);
        return updated;
    }
}
