package personal.salon.sync.notification.application.port.out;

import personal.salon.sync.notification.domain.model.PushMessage;

/**
 * Push Gateway (Output Port)
 * 실제 전송 수단(FCM/APNs/WebSocket)은 이 포트 뒤에 위치
 */
public interface PushGateway {

    /**
     * @throws personal.salon.sync.notification.domain.exception.PushDeliveryException 전송 실패
     */
    void send(PushMessage message);
}
