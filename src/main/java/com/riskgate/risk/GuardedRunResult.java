package com.riskgate.risk;

import lombok.Getter;
import lombok.ToString;

/**
 * Result of {@link GuardedRunner#execute}: either the work's value, or the reason it never ran.
 */
@Getter
@ToString
public class GuardedRunResult<T> {

    private final boolean executed;
    private final T value;
    private final String blockedReason;
    private final String correlationId;

    private GuardedRunResult(boolean executed, T value, String blockedReason, String correlationId) {
        this.executed = executed;
        this.value = value;
        this.blockedReason = blockedReason;
        this.correlationId = correlationId;
    }

    public static <T> GuardedRunResult<T> completed(T value, String correlationId) {
        return new GuardedRunResult<>(true, value, null, correlationId);
    }

    public static <T> GuardedRunResult<T> blocked(String reason, String correlationId) {
        return new GuardedRunResult<>(false, null, reason, correlationId);
    }
}
