package personal.salon.sync.offline.application.port.out;

import personal.salon.sync.offline.domain.model.OperationContext;

import java.util.Map;

/**
 * 예약 쓰기 경로 Port (외부 협력 서비스)
 * 예약 유효성 규칙은 하위 서비스 책임
 */
public interface BookingCommandPort {

    void createBooking(OperationContext context, String bookingId, Map<String, Object> payload);

    void cancelBooking(OperationContext context, String bookingId, Map<String, Object> payload);
}
