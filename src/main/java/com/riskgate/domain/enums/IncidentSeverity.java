package com.riskgate.domain.enums;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Severity of a recorded incident. Stored and logged in lower case.
 */
@Getter
@RequiredArgsConstructor
public enum IncidentSeverity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String value;

    /**
     * Trims and lower-cases the input; anything that is not one of the four known values
     * (including null and blank) becomes {@link #WARNING}.
     */
    public static IncidentSeverity normalize(String raw) {
        if (raw == null) {
            return WARNING;
        }
        String candidate = raw.trim().toLowerCase(Locale.ROOT);
        for (IncidentSeverity severity : values()) {
            if (severity.value.equals(candidate)) {
                return severity;
            }
        }
        return WARNING;
    }
}
