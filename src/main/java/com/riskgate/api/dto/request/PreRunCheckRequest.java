package com.riskgate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/risk/pre-run-check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreRunCheckRequest {

    /** Run kind, e.g. "backtest", "hyperopt", "live". */
    @NotBlank(message = "kind is required")
    private String kind;

    private String strategy;
    private String timeframe;

    /** Optional live state: open_trades_count, market_exposure_pct. */
    private Map<String, Object> context;

    private String correlationId;
}
