package personal.salon.sync.notification.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.notification.domain.exception.InvalidNotificationStateException;
import personal.salon.sync.notification.domain.exception.NotNotificationTargetException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Notification Domain Model
 * 사용자 디바이스 집합에 보낼 알림 (불변, version으로 낙관적 잠금)
 *
 * targetDevices가 비어 있으면 전송 시점의 활성 디바이스 전체 - excludeDevices
 * deliveryStatus는 비어서 시작하고, 전달 시도가 끝날 때마다 디바이스별로 채워짐
 */
public record Notification(
        Long id,
        UUID userId,
        String title,
        String message,
        String type,
        NotificationPriority priority,
        Map<String, Object> data,
        List<String> targetDevices,
        List<String> excludeDevices,
        Map<String, DeliveryOutcome> deliveryStatus,
        NotificationStatus status,
        Instant scheduledAt,
        Instant expiresAt,
        Instant sentAt,
        Instant createdAt,
        Long version) {

    public Notification {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Title cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Message cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Type cannot be null or blank");
        }
        if (scheduledAt == null || expiresAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Schedule and expiry time are required");
        }
        if (!expiresAt.isAfter(scheduledAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Expiry must be after schedule time: scheduledAt=%s, expiresAt=%s",
                            scheduledAt, expiresAt));
        }
        priority = priority == null ? NotificationPriority.NORMAL : priority;
        data = data == null ? Map.of() : data;
        targetDevices = targetDevices == null ? List.of() : List.copyOf(targetDevices);
        excludeDevices = excludeDevices == null ? List.of() : List.copyOf(excludeDevices);
        deliveryStatus = deliveryStatus == null ? Map.of() : Map.copyOf(deliveryStatus);
    }

    /**
     * @param scheduledAt null이면 즉시
     * @param expiresAt   null이면 scheduledAt + defaultTtl
     */
    public static Notification pending(UUID userId, String title, String message, String type,
                                       NotificationPriority priority, Map<String, Object> data,
                                       List<String> targetDevices, List<String> excludeDevices,
                                       Instant scheduledAt, Instant expiresAt,
                                       Duration defaultTtl, Instant now) {
        Instant schedule = scheduledAt != null ? scheduledAt : now;
        Instant expiry = expiresAt != null ? expiresAt : schedule.plus(defaultTtl);
        return new Notification(null, userId, title, message, type, priority, data,
                targetDevices, excludeDevices, Map.of(), NotificationStatus.PENDING,
                schedule, expiry, null, now, null);
    }

    public boolean hasExplicitTargets() {
        return !targetDevices.isEmpty();
    }

    public boolean isDue(Instant now) {
        return status == NotificationStatus.PENDING && !scheduledAt.isAfter(now);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isDeliveredTo(String deviceId) {
        return deliveryStatus.get(deviceId) == DeliveryOutcome.SENT;
    }

    /**
     * 명시적 대상이면 그 목록, 아니면 제외 목록에 없는 디바이스
     * (사용자 소유 여부는 호출자가 확인)
     */
    public boolean targets(String deviceId) {
        if (hasExplicitTargets()) {
            return targetDevices.contains(deviceId);
        }
        return !excludeDevices.contains(deviceId);
    }

    /**
     * 전달 결과를 받을 수 있는 상태인지 확인
     * EXPIRED 알림은 전송되지 않으므로 결과를 덮어쓸 수 없음
     */
    public void requireAcceptsOutcomeFrom(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Device ID cannot be null or blank");
        }
        if (status == NotificationStatus.EXPIRED) {
            throw new InvalidNotificationStateException(id, status, "record delivery outcome for");
        }
        if (!targets(deviceId)) {
            throw new NotNotificationTargetException(id, deviceId);
        }
    }

    /**
     * 디바이스 1대의 전달 결과 반영 (클라이언트 수신 확인 또는 전송 실패)
     */
    public Notification withDeliveryOutcome(String deviceId, DeliveryOutcome outcome) {
        requireAcceptsOutcomeFrom(deviceId);
        if (outcome == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Delivery outcome cannot be null");
        }
        Map<String, DeliveryOutcome> updated = new LinkedHashMap<>(deliveryStatus);
        updated.put(deviceId, outcome);
        return withStatus(updated, status, sentAt);
    }

    /**
     * 전송 시도 완료: 디바이스별 결과를 합치고 SENT로 전이
     */
    public Notification markSent(Map<String, DeliveryOutcome> outcomes, Instant now) {
        Map<String, DeliveryOutcome> updated = new LinkedHashMap<>(deliveryStatus);
        updated.putAll(outcomes);
        return withStatus(updated, NotificationStatus.SENT, now);
    }

    /**
     * 만료: 모든 대상 디바이스를 EXPIRED로 표시하고 전송하지 않음
     */
    public Notification expire(Collection<String> targets) {
        Map<String, DeliveryOutcome> updated = new LinkedHashMap<>(deliveryStatus);
        targets.forEach(deviceId -> updated.putIfAbsent(deviceId, DeliveryOutcome.EXPIRED));
        return withStatus(updated, NotificationStatus.EXPIRED, null);
    }

    private Notification withStatus(Map<String, DeliveryOutcome> updatedStatus, NotificationStatus newStatus,
                                    Instant newSentAt) {
        return new Notification(id, userId, title, message, type, priority, data, targetDevices, excludeDevices,
                updatedStatus, newStatus, scheduledAt, expiresAt, newSentAt, createdAt, version);
    }
}
