package com.riskgate.risk;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Lenient ISO-8601 parsing for operator-written timestamps.
 *
 * <p>Accepts {@code Z} or numeric offsets, a space instead of {@code T}, naive date-times (read as
 * UTC) and bare dates (midnight UTC).
 */
public final class IsoTimestamps {

    private IsoTimestamps() {}

    /**
     * @throws DateTimeParseException if the text matches none of the accepted shapes
     */
    public static Instant parse(String text) {
        String s = text.trim();
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notDateTime) {
                return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
        }
    }

    /** Canonical form written back to state files, e.g. {@code 2025-08-17T10:15:00Z}. */
    public static String format(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
