package personal.salon.sync.notification.application.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.notification.application.port.in.DeliverNotificationsUseCase;
import personal.salon.sync.notification.application.port.in.DeliveryResult;
import personal.salon.sync.notification.application.port.in.QueueNotificationUseCase;
import personal.salon.sync.notification.application.port.out.NotificationRepository;
import personal.salon.sync.notification.application.port.out.PushGateway;
import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;
import personal.salon.sync.notification.domain.model.NotificationStatus;
import personal.salon.sync.notification.domain.model.PushMessage;
import personal.salon.sync.notification.domain.service.NotificationUpdater;
import personal.salon.sync.resilience.application.port.in.ResilienceGuard;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Notification Delivery Service
 *
 * 1. 예약 시각이 된 PENDING 알림 조회
 * 2. 만료된 알림은 전송하지 않고 모든 대상을 EXPIRED로 표시
 * 3. 그 외에는 대상 디바이스별로 ResilienceGuard를 거쳐 PushGateway 호출, 결과를 모아 SENT로 전이
 *
 * 전송 후 저장 전에 중단되면 다음 회차에 다시 전송됨 (at-least-once)
 * 이미 SENT로 기록된 디바이스는 다시 보내지 않음
 */
@Slf4j
@Service
public class NotificationDeliveryService implements DeliverNotificationsUseCase {

    static final String PUSH_GATEWAY_SERVICE = "push-gateway";

    private final NotificationRepository notificationRepository;
    private final NotificationUpdater notificationUpdater;
    private final QueueNotificationUseCase queueNotificationUseCase;
    private final GetDevicesUseCase getDevicesUseCase;
    private final PushGateway pushGateway;
    private final ResilienceGuard resilienceGuard;
    private final SyncProperties syncProperties;
    private final Retry retry;
    private final Clock clock;

    public NotificationDeliveryService(NotificationRepository notificationRepository,
                                       NotificationUpdater notificationUpdater,
                                       QueueNotificationUseCase queueNotificationUseCase,
                                       GetDevicesUseCase getDevicesUseCase,
                                       PushGateway pushGateway,
                                       ResilienceGuard resilienceGuard,
                                       SyncProperties syncProperties,
                                       RetryRegistry retryRegistry,
                                       Clock clock) {
        this.notificationRepository = notificationRepository;
        this.notificationUpdater = notificationUpdater;
        this.queueNotificationUseCase = queueNotificationUseCase;
        this.getDevicesUseCase = getDevicesUseCase;
        this.pushGateway = pushGateway;
        this.resilienceGuard = resilienceGuard;
        this.syncProperties = syncProperties;
        this.retry = retryRegistry.retry(NotificationFanoutService.RETRY_NAME);
        this.clock = clock;
    }

    @Override
    public DeliveryResult deliverDue() {
        Instant now = clock.instant();
        List<Notification> due = notificationRepository.findDue(now, syncProperties.notification().batchSize());
        if (due.isEmpty()) {
            return DeliveryResult.empty();
        }

        int delivered = 0;
        int expired = 0;
        int devicesSent = 0;
        int devicesFailed = 0;

        for (Notification notification : due) {
            try {
                List<String> targets = queueNotificationUseCase.resolveTargets(notification);

                if (notification.isExpired(now)) {
                    if (update(notification.id(), current -> current.expire(targets))) {
                        expired++;
                    }
                    log.info("Notification expired before delivery: notificationId={}, expiresAt={}, targets={}",
                            notification.id(), notification.expiresAt(), targets.size());
                    continue;
                }

                Map<String, DeliveryOutcome> outcomes = send(notification, targets);
                if (update(notification.id(), current -> current.markSent(outcomes, now))) {
                    delivered++;
                    devicesSent += count(outcomes, DeliveryOutcome.SENT);
                    devicesFailed += count(outcomes, DeliveryOutcome.FAILED);
                }
            } catch (Exception e) {
                log.error("Notification delivery failed: notificationId={}", notification.id(), e);
            }
        }

        DeliveryResult result = new DeliveryResult(delivered, expired, devicesSent, devicesFailed);
        log.info("Notifications delivered: {}", result);
        return result;
    }

    private Map<String, DeliveryOutcome> send(Notification notification, List<String> targets) {
        Map<String, String> pushTokens = getDevicesUseCase.getActiveDevices(notification.userId()).stream()
                .filter(Device::hasPushToken)
                .collect(Collectors.toMap(Device::deviceId, Device::pushToken, (first, second) -> first));

        Map<String, DeliveryOutcome> outcomes = new LinkedHashMap<>();
        for (String deviceId : targets) {
            if (notification.isDeliveredTo(deviceId)) {
                continue;
            }
            PushMessage message = PushMessage.of(notification, deviceId, pushTokens.get(deviceId));
            try {
                resilienceGuard.run(PUSH_GATEWAY_SERVICE, () -> pushGateway.send(message));
                outcomes.put(deviceId, DeliveryOutcome.SENT);
            } catch (Exception e) {
                log.warn("Push delivery failed: notificationId={}, deviceId={}, error={}",
                        notification.id(), deviceId, e.getMessage());
                outcomes.put(deviceId, DeliveryOutcome.FAILED);
            }
        }
        return outcomes;
    }

    /**
     * 다른 요청(수신 확인 등)과의 version 충돌은 다시 읽어서 재적용
     * 그 사이 PENDING이 아니게 되었으면 반영하지 않음
     *
     * @return 갱신 후 더 이상 PENDING이 아니면 true
     */
    private boolean update(Long notificationId, Function<Notification, Notification> transition) {
        Notification updated = Retry.decorateSupplier(retry, () -> notificationUpdater.update(notificationId,
                current -> current.status() == NotificationStatus.PENDING ? transition.apply(current) : current)).get();
        return updated.status() != NotificationStatus.PENDING;
    }

    private static int count(Map<String, DeliveryOutcome> outcomes, DeliveryOutcome outcome) {
        return (int) outcomes.values().stream().filter(outcome::equals).count();
    }
}
