package personal.salon.sync.notification.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.notification.adapter.in.web.dto.DeliveryOutcomeRequest;
import personal.salon.sync.notification.adapter.in.web.dto.NotificationResponse;
import personal.salon.sync.notification.adapter.in.web.dto.QueueNotificationRequest;
import personal.salon.sync.notification.application.port.in.ManageNotificationUseCase;
import personal.salon.sync.notification.application.port.in.QueueNotificationUseCase;
import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;

import java.util.UUID;

/**
 * Notification API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final QueueNotificationUseCase queueNotificationUseCase;
    private final ManageNotificationUseCase manageNotificationUseCase;

    /**
     * POST /api/v1/notifications
     */
    @PostMapping
    public ResponseEntity<NotificationResponse> queueNotification(
            @Valid @RequestBody QueueNotificationRequest request,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Queue notification request: userId={}, type={}", userId, request.type());
        Notification notification = queueNotificationUseCase.enqueue(request.toCommand(userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(NotificationResponse.from(notification));
    }

    /**
     * GET /api/v1/notifications/{notificationId}
     */
    @GetMapping("/{notificationId}")
    public ResponseEntity<NotificationResponse> getNotification(
            @PathVariable Long notificationId,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        return ResponseEntity.ok(NotificationResponse.from(
                manageNotificationUseCase.getNotification(userId, notificationId)));
    }

    /**
     * 디바이스 수신 확인 / 실패 보고
     * PUT /api/v1/notifications/{notificationId}/deliveries/{deviceId}
     */
    @PutMapping("/{notificationId}/deliveries/{deviceId}")
    public ResponseEntity<NotificationResponse> recordDeliveryOutcome(
            @PathVariable Long notificationId,
            @PathVariable String deviceId,
            @Valid @RequestBody DeliveryOutcomeRequest request,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        Notification notification = manageNotificationUseCase.recordDeliveryOutcome(
                userId, notificationId, deviceId, DeliveryOutcome.from(request.outcome()));
        return ResponseEntity.ok(NotificationResponse.from(notification));
    }
}
