package com.riskgate.observability;

import com.riskgate.domain.enums.IncidentSeverity;
import com.riskgate.domain.model.Incident;
import com.riskgate.exception.BestEffort;
import com.riskgate.repository.jdbc.IncidentJdbcRepository;
import com.riskgate.risk.IsoTimestamps;
import com.riskgate.risk.RiskConfiguration;
import com.riskgate.risk.RunIdentifiers;
import java.nio.file.Path;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;

/**
 * Best-effort durable record of risk-relevant events.
 *
 * <p>Every incident is logged first, at the level of its severity ({@code critical} goes out at
 * ERROR with the {@value #CRITICAL} marker, since SLF4J has no higher level). It is then stored
 * in the metrics database if one is configured. Storage failures are logged and swallowed:
 * recording an incident can never fail the caller.
 */
@Service
public class IncidentLogger {

    private static final Logger log = LoggerFactory.getLogger(IncidentLogger.class);

    static final String CRITICAL = "CRITICAL";
    private static final Marker CRITICAL_MARKER = MarkerFactory.getMarker(CRITICAL);

    private final RiskConfiguration riskConfiguration;
    private final IncidentJdbcRepository incidentJdbcRepository;

    public IncidentLogger(RiskConfiguration riskConfiguration, IncidentJdbcRepository incidentJdbcRepository) {
        this.riskConfiguration = riskConfiguration;
        this.incidentJdbcRepository = incidentJdbcRepository;
    }

    public Incident logIncident(
            String runId, String severity, String description, String logExcerptPath, String correlationId) {
        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            Instant now = Instant.now();
            Incident incident = Incident.builder()
                    .id(RunIdentifiers.processScopedName("incident", now.getEpochSecond(), correlationId))
                    .runId(runId)
                    .severity(IncidentSeverity.normalize(severity))
                    .description(description)
                    .logExcerptPath(logExcerptPath)
                    .createdUtc(IsoTimestamps.format(now))
                    .build();

            emit(incident);

            Path databasePath = riskConfiguration.getMetricsDatabasePath();
            if (databasePath == null) {
                log.info("incident_db_skipped incident_id={} reason=no_db_configured", incident.getId());
                return incident;
            }

            boolean stored = BestEffort.run(
                    log,
                    Level.ERROR,
                    "incident_store_error incident_id=" + incident.getId(),
                    () -> incidentJdbcRepository.save(databasePath, incident));
            if (stored) {
                log.info("incident_stored incident_id={}", incident.getId());
            }
            return incident;
        }
    }

    private void emit(Incident incident) {
        String format = "incident_logged incident_id={} run_id={} severity={} description={} log_excerpt_path={}";
        Object[] args = {
            incident.getId(),
            nullToEmpty(incident.getRunId()),
            incident.getSeverity().getValue(),
            incident.getDescription(),
            nullToEmpty(incident.getLogExcerptPath())
        };
        switch (incident.getSeverity()) {
            case INFO -> log.info(format, args);
            case WARNING -> log.warn(format, args);
            case ERROR -> log.error(format, args);
            case CRITICAL -> log.error(CRITICAL_MARKER, format, args);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
