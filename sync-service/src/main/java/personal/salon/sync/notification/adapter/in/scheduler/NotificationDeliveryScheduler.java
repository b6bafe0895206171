package personal.salon.sync.notification.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.salon.sync.notification.application.port.in.DeliverNotificationsUseCase;
import personal.salon.sync.notification.application.port.in.DeliveryResult;

/**
 * Notification Delivery Scheduler
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDeliveryScheduler {

    private final DeliverNotificationsUseCase deliverNotificationsUseCase;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: sync.scheduler.notification-interval-ms (기본 30초)
     */
    @Scheduled(fixedDelayString = "${sync.scheduler.notification-interval-ms:30000}")
    public void deliverDueNotifications() {
        try {
            DeliveryResult result = deliverNotificationsUseCase.deliverDue();

            increment("notifications.sent", "Number of notifications delivered to their target devices",
                    result.delivered());
            increment("notifications.expired", "Number of notifications dropped after expiry",
                    result.expired());
            increment("notifications.devices.failed", "Number of per-device push failures",
                    result.devicesFailed());
        } catch (Exception e) {
            log.error("Notification delivery run failed", e);
        }
    }

    private void increment(String name, String description, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder(name)
                .description(description)
                .register(meterRegistry)
                .increment(amount);
    }
}
