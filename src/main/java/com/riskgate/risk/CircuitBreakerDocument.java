package com.riskgate.risk;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Parsed content of the shared circuit breaker file:
 * {@code {"active": bool, "reason": string, "until_iso": string?}}.
 *
 * <p>The file is written by operators and other tools, so fields are read with JSON truthiness
 * rather than strict types: {@code "active": 1} and {@code "active": "yes"} both count as active.
 */
@Getter
@ToString
public class CircuitBreakerDocument {

    public static final String FIELD_ACTIVE = "active";
    public static final String FIELD_REASON = "reason";
    public static final String FIELD_UNTIL = "until_iso";

    private final boolean active;
    private final String reason;
    private final JsonNode until;

    private CircuitBreakerDocument(boolean active, String reason, JsonNode until) {
        this.active = active;
        this.reason = reason;
        this.until = until;
    }

    /**
     * @throws IllegalStateException if the root is not a JSON object
     */
    public static CircuitBreakerDocument from(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("circuit breaker document must be a JSON object");
        }
        JsonNode reasonNode = root.get(FIELD_REASON);
        String reason = isTruthy(reasonNode) ? (reasonNode.isTextual() ? reasonNode.asText() : reasonNode.toString()) : "";
        return new CircuitBreakerDocument(isTruthy(root.get(FIELD_ACTIVE)), reason, root.get(FIELD_UNTIL));
    }

    /** Raw {@code until_iso} text, or null when absent or not a string. */
    public String getUntilIso() {
        return until != null && until.isTextual() ? until.asText() : null;
    }

    /**
     * Expiry of an active breaker. Empty means it never expires: either no {@code until_iso} was
     * given or it could not be parsed, and an unreadable expiry must not release the breaker.
     */
    public Optional<Instant> expiresAt() {
        if (!isTruthy(until) || !until.isTextual()) {
            return Optional.empty();
        }
        try {
            return Optional.of(IsoTimestamps.parse(until.asText()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** active AND (no expiry OR expiry not yet passed). */
    public boolean isEffectivelyActive(Instant now) {
        if (!active) {
            return false;
        }
        return expiresAt().map(expiry -> !now.isAfter(expiry)).orElse(true);
    }

    static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return node.size() > 0;
    }
}
