package personal.salon.sync.offline.domain.model;

import java.util.UUID;

/**
 * 하위 서비스 호출 시 함께 전달되는 작업 식별 정보
 *
 * @param idempotencyKey 하위 서비스에 Idempotency-Key 헤더로 전달
 */
public record OperationContext(
        UUID userId,
        String deviceId,
        String idempotencyKey) {
}
