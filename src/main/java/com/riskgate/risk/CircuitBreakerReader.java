package com.riskgate.risk;

import com.riskgate.mapper.JsonHelper;
import com.riskgate.observability.CorrelationScope;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the global kill switch shared by every process on the host.
 *
 * <p>The file is re-read on every call (operators flip it while runs are queued), and any failure
 * to read or parse it is reported as an active breaker: an unreadable kill switch is assumed to
 * be on.
 */
@Component
public class CircuitBreakerReader {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerReader.class);

    private final RiskConfiguration riskConfiguration;

    public CircuitBreakerReader(RiskConfiguration riskConfiguration) {
        this.riskConfiguration = riskConfiguration;
    }

    /**
     * Evaluates the breaker file.
     *
     * <ol>
     *   <li>No file configured, or file absent: inactive</li>
     *   <li>Unreadable or not a JSON object: active, reason {@code circuit_breaker_parse_error}</li>
     *   <li>{@code active} falsy: inactive</li>
     *   <li>{@code until_iso} in the past: inactive (expired)</li>
     *   <li>Otherwise active with the stored reason</li>
     * </ol>
     */
    public CircuitBreakerStatus read(String correlationId) {
        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            Path file = riskConfiguration.getCircuitBreakerFile();
            log.debug("cb_check cb_file={}", file);
            if (file == null) {
                return CircuitBreakerStatus.inactive();
            }
            if (!Files.exists(file)) {
                log.debug("cb_file_not_found cb_file={}", file);
                return CircuitBreakerStatus.inactive();
            }

            CircuitBreakerDocument document;
            try {
                document = readDocument(file);
            } catch (NoSuchFileException e) {
                // removed between the existence check and the read
                log.debug("cb_file_not_found cb_file={}", file);
                return CircuitBreakerStatus.inactive();
            } catch (Exception e) {
                log.error("circuit_breaker_parse_error path={} error={}", file, e.getMessage());
                return CircuitBreakerStatus.parseError();
            }

            if (!document.isEffectivelyActive(Instant.now())) {
                log.debug("cb_inactive active={} until_iso={}", document.isActive(), document.getUntilIso());
                return CircuitBreakerStatus.inactive();
            }
            return CircuitBreakerStatus.active(document.getReason());
        }
    }

    static CircuitBreakerDocument readDocument(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return CircuitBreakerDocument.from(JsonHelper.readTree(content));
    }
}
