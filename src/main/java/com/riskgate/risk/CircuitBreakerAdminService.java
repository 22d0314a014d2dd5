package com.riskgate.risk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riskgate.exception.BusinessException;
import com.riskgate.exception.ErrorCode;
import com.riskgate.mapper.JsonHelper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator actions on the shared circuit breaker file: status, enable, disable.
 *
 * <p>Documents are written to a temporary sibling and moved into place, so a reader in another
 * process sees either the old or the new document, never a partial one (a partial one would read
 * as a parse error and block every run).
 */
@Service
public class CircuitBreakerAdminService {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerAdminService.class);

    static final String DEFAULT_REASON = "manual";

    private final RiskConfiguration riskConfiguration;
    private final CircuitBreakerReader circuitBreakerReader;

    public CircuitBreakerAdminService(RiskConfiguration riskConfiguration, CircuitBreakerReader circuitBreakerReader) {
        this.riskConfiguration = riskConfiguration;
        this.circuitBreakerReader = circuitBreakerReader;
    }

    public CircuitBreakerAdminStatus status() {
        Path file = breakerFile();
        CircuitBreakerStatus effective = circuitBreakerReader.read(null);
        CircuitBreakerAdminStatus.CircuitBreakerAdminStatusBuilder status = CircuitBreakerAdminStatus.builder()
                .file(file.toString())
                .exists(Files.exists(file))
                .effectivelyActive(effective.active())
                .effectiveReason(effective.reason());
        if (Files.exists(file)) {
            try {
                CircuitBreakerDocument document = CircuitBreakerReader.readDocument(file);
                status.active(document.isActive()).reason(document.getReason()).untilIso(document.getUntilIso());
            } catch (Exception e) {
                log.error("cb_status_error file={} error={}", file, e.getMessage());
            }
        }
        CircuitBreakerAdminStatus result = status.build();
        log.info("cb_status {}", result);
        return result;
    }

    /**
     * Turns the breaker on.
     *
     * @param reason shown to blocked callers; defaults to "manual"
     * @param minutes duration from now; ignored when {@code untilIso} is given or not positive
     * @param untilIso explicit expiry; naive values are taken as UTC
     * @throws BusinessException VALIDATION_ERROR if {@code untilIso} cannot be parsed,
     *     STATE_WRITE_FAILED if the file cannot be written
     */
    public CircuitBreakerAdminStatus enable(String reason, Integer minutes, String untilIso) {
        Path file = breakerFile();
        ObjectNode document = JsonHelper.mapper().createObjectNode();
        document.put(CircuitBreakerDocument.FIELD_ACTIVE, true);
        document.put(CircuitBreakerDocument.FIELD_REASON, reason == null || reason.isBlank() ? DEFAULT_REASON : reason);
        String normalizedUntil = resolveUntil(minutes, untilIso);
        if (normalizedUntil != null) {
            document.put(CircuitBreakerDocument.FIELD_UNTIL, normalizedUntil);
        }
        write(file, document);
        log.warn("cb_enabled file={} reason={} until_iso={}", file, document.get(CircuitBreakerDocument.FIELD_REASON).asText(), normalizedUntil);
        return status();
    }

    /**
     * Turns the breaker off, keeping the other fields for the record. No file means already off.
     */
    public CircuitBreakerAdminStatus disable() {
        Path file = breakerFile();
        if (!Files.exists(file)) {
            log.info("cb_disable_noop file={}", file);
            return status();
        }
        ObjectNode document;
        try {
            JsonNode existing = JsonHelper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            document = existing.isObject() ? (ObjectNode) existing : JsonHelper.mapper().createObjectNode();
        } catch (IOException | IllegalStateException e) {
            log.warn("cb_disable_unreadable file={} error={}", file, e.getMessage());
            document = JsonHelper.mapper().createObjectNode();
        }
        document.put(CircuitBreakerDocument.FIELD_ACTIVE, false);
        write(file, document);
        log.info("cb_disabled file={}", file);
        return status();
    }

    // ========================
    // INTERNALS
    // ========================

    private Path breakerFile() {
        Path configured = riskConfiguration.getCircuitBreakerFile();
        if (configured != null) {
            return configured;
        }
        Path stateDir = riskConfiguration.getStateDirectory() != null
                ? riskConfiguration.getStateDirectory()
                : Path.of("user_data", "state");
        return stateDir.resolve("circuit_breaker.json");
    }

    static String resolveUntil(Integer minutes, String untilIso) {
        if (untilIso != null && !untilIso.isBlank()) {
            try {
                return IsoTimestamps.format(IsoTimestamps.parse(untilIso));
            } catch (DateTimeParseException e) {
                throw new BusinessException(
                        ErrorCode.VALIDATION_ERROR, "Invalid untilIso timestamp", Map.of("untilIso", untilIso));
            }
        }
        if (minutes != null && minutes > 0) {
            return IsoTimestamps.format(Instant.now().plus(Duration.ofMinutes(minutes)));
        }
        return null;
    }

    private void write(Path file, JsonNode document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, JsonHelper.toPrettyJson(document), StandardCharsets.UTF_8);
                try {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.error("cb_write_error file={} error={}", file, e.getMessage(), e);
            throw new BusinessException(ErrorCode.STATE_WRITE_FAILED, "Failed to write circuit breaker file", e);
        }
    }
}
