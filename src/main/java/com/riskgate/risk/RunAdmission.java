package com.riskgate.risk;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of the pre-run gate: allowed, or blocked with the reason of the first failing check.
 *
 * <p>Reason strings are stable prefixes callers surface verbatim, e.g.
 * {@code circuit_breaker_active: manual halt} or {@code recent_drawdown_exceeded: 0.25}.
 */
@Getter
@ToString
public class RunAdmission {

    private static final RunAdmission ALLOWED = new RunAdmission(true, null);

    private final boolean allowed;
    private final String reason;

    private RunAdmission(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static RunAdmission allowed() {
        return ALLOWED;
    }

    public static RunAdmission blocked(String reason) {
        return new RunAdmission(false, reason);
    }

    public boolean isBlocked() {
        return !allowed;
    }
}
