package personal.salon.sync.offline.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.salon.sync.offline.application.port.in.EnqueueOperationCommand;
import personal.salon.sync.offline.domain.model.OperationType;

import java.util.Map;
import java.util.UUID;

/**
 * 오프라인 작업 제출 요청
 */
public record EnqueueOperationRequest(
        @NotBlank(message = "deviceId는 필수입니다.")
        @Size(max = 128)
        String deviceId,

        @NotBlank(message = "operationType은 필수입니다.")
        String operationType,

        @NotBlank(message = "idempotencyKey는 필수입니다.")
        @Size(max = 128)
        String idempotencyKey,

        @NotNull(message = "payload는 필수입니다.")
        Map<String, Object> payload,

        @Min(0)
        @Max(10)
        Integer priority,

        @Min(1)
        @Max(10)
        Integer maxRetries
) {
    public EnqueueOperationCommand toCommand(UUID userId) {
        return new EnqueueOperationCommand(
                userId,
                deviceId,
                OperationType.from(operationType),
                idempotencyKey,
                payload,
                priority,
                maxRetries);
    }
}
