package personal.salon.sync.notification.application.port.in;

/**
 * 전달 1회 결과
 *
 * @param delivered     전송 시도를 마친 알림 수
 * @param expired       만료로 폐기된 알림 수
 * @param devicesSent   전송 성공 디바이스 수
 * @param devicesFailed 전송 실패 디바이스 수
 */
public record DeliveryResult(
        int delivered,
        int expired,
        int devicesSent,
        int devicesFailed) {

    public static DeliveryResult empty() {
        return new DeliveryResult(0, 0, 0, 0);
    }
}
