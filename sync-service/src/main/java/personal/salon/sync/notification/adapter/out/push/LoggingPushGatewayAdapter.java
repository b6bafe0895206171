package personal.salon.sync.notification.adapter.out.push;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.sync.notification.application.port.out.PushGateway;
import personal.salon.sync.notification.domain.exception.PushDeliveryException;
import personal.salon.sync.notification.domain.model.PushMessage;

/**
 * Logging Push Gateway Adapter
 * 전송 수단 없이 로그로만 기록 (푸시 토큰이 없는 디바이스는 실패 처리)
 */
@Slf4j
@Component
public class LoggingPushGatewayAdapter implements PushGateway {

    @Override
    public void send(PushMessage message) {
        if (message.pushToken() == null || message.pushToken().isBlank()) {
            throw PushDeliveryException.missingToken(message.notificationId(), message.deviceId());
        }
        log.info("Push dispatched: notificationId={}, deviceId={}, type={}, priority={}, title={}",
                message.notificationId(), message.deviceId(), message.type(), message.priority(), message.title());
    }
}
