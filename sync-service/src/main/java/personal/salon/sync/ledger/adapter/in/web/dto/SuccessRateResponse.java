package personal.salon.sync.ledger.adapter.in.web.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record SuccessRateResponse(
        UUID userId,
        int days,
        BigDecimal successRate
) {}
