package com.riskgate.risk;

/**
 * Effective circuit breaker state as seen by the gate.
 *
 * @param active whether new runs should be blocked
 * @param reason operator-supplied reason, {@link #PARSE_ERROR_REASON} for an unreadable document,
 *     null when inactive
 */
public record CircuitBreakerStatus(boolean active, String reason) {

    public static final String PARSE_ERROR_REASON = "circuit_breaker_parse_error";

    private static final CircuitBreakerStatus INACTIVE = new CircuitBreakerStatus(false, null);

    public static CircuitBreakerStatus inactive() {
        return INACTIVE;
    }

    public static CircuitBreakerStatus active(String reason) {
        return new CircuitBreakerStatus(true, reason);
    }

    public static CircuitBreakerStatus parseError() {
        return new CircuitBreakerStatus(true, PARSE_ERROR_REASON);
    }
}
