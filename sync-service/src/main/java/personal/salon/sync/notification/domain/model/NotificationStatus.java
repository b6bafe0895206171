package personal.salon.sync.notification.domain.model;

/**
 * PENDING: 전송 대기 / SENT: 전송 시도 완료 (디바이스별 결과는 deliveryStatus) / EXPIRED: 만료로 폐기
 */
public enum NotificationStatus {
    PENDING,
    SENT,
    EXPIRED
}
