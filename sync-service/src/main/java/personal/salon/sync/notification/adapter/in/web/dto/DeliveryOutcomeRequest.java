package personal.salon.sync.notification.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record DeliveryOutcomeRequest(
        @NotBlank(message = "outcome은 필수입니다.")
        String outcome
) {
}
