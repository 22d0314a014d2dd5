package com.riskgate.risk;

/**
 * Naming helpers for identifiers derived from the current process and a correlation id.
 */
public final class RunIdentifiers {

    /** Correlation ids are truncated to this many characters when embedded in names. */
    public static final int CORRELATION_PREFIX_LENGTH = 12;

    private RunIdentifiers() {}

    public static long currentPid() {
        return ProcessHandle.current().pid();
    }

    /** {@code <prefix>_<epochSeconds>_<pid>[_<correlation id prefix>]} */
    public static String processScopedName(String prefix, long epochSeconds, String correlationId) {
        StringBuilder name = new StringBuilder(prefix)
                .append('_')
                .append(epochSeconds)
                .append('_')
                .append(currentPid());
        if (correlationId != null && !correlationId.isEmpty()) {
            name.append('_').append(correlationPrefix(correlationId));
        }
        return name.toString();
    }

    public static String correlationPrefix(String correlationId) {
        return correlationId.length() > CORRELATION_PREFIX_LENGTH
                ? correlationId.substring(0, CORRELATION_PREFIX_LENGTH)
                : correlationId;
    }
}
