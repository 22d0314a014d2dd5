package com.riskgate.risk;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Operator view of the circuit breaker file: what is written in it and what the gate makes of it.
 */
@Getter
@Builder
@ToString
public class CircuitBreakerAdminStatus {

    private final String file;
    private final boolean exists;

    /** Raw {@code active} flag as written; false when the file is missing or unreadable. */
    private final boolean active;

    private final String reason;
    private final String untilIso;

    /** Whether the gate currently blocks on the breaker (before any override). */
    private final boolean effectivelyActive;

    private final String effectiveReason;
}
