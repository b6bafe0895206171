package personal.salon.sync.resilience.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

public record CallOutcomeRequest(
        @NotNull(message = "success는 필수입니다.")
        Boolean success
) {}
