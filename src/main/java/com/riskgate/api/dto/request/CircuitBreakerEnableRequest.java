package com.riskgate.api.dto.request;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

/**
 * Request DTO for POST /api/risk/circuit-breaker/enable.
 *
 * <p>All fields optional. {@code untilIso} wins over {@code minutes}; with neither the breaker
 * stays on until disabled.
 */
@Getter
@Setter
public class CircuitBreakerEnableRequest {

    private String reason;

    @Positive(message = "minutes must be positive")
    private Integer minutes;

    private String untilIso;
}
