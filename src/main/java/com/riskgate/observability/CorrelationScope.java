package com.riskgate.observability;

import org.slf4j.MDC;

/**
 * Puts the caller's correlation id into the SLF4J MDC for the duration of a try-with-resources
 * block and restores whatever was there before, so nested gate calls from the same thread keep
 * the outer id once they return.
 *
 * <p>A null or blank id leaves the MDC untouched.
 */
public final class CorrelationScope implements AutoCloseable {

    public static final String MDC_KEY = "correlationId";

    private final boolean applied;
    private final String previous;

    private CorrelationScope(String correlationId) {
        this.previous = MDC.get(MDC_KEY);
        this.applied = correlationId != null && !correlationId.isBlank();
        if (applied) {
            MDC.put(MDC_KEY, correlationId);
        }
    }

    public static CorrelationScope open(String correlationId) {
        return new CorrelationScope(correlationId);
    }

    @Override
    public void close() {
        if (!applied) {
            return;
        }
        if (previous == null) {
            MDC.remove(MDC_KEY);
        } else {
            MDC.put(MDC_KEY, previous);
        }
    }
}
