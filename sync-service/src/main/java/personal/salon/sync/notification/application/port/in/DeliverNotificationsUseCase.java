package personal.salon.sync.notification.application.port.in;

public interface DeliverNotificationsUseCase {

    /**
     * 예약 시각이 된 PENDING 알림을 최대 batch-size개 전달
     */
    DeliveryResult deliverDue();
}
