package com.riskgate.repository.jdbc;

import com.riskgate.domain.model.Incident;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Append-only sink for incidents in the metrics store.
 */
@Repository
public class IncidentJdbcRepository {

    private static final String INSERT_INCIDENT = """
            INSERT INTO incidents (
                id, run_id, severity, description, log_excerpt_path, created_utc
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

    /**
     * Creates the store's parent directory and the incidents table if needed, then inserts one row
     * in an auto-committed statement.
     *
     * @throws IOException if the parent directory cannot be created
     * @throws org.springframework.dao.DataAccessException on any database failure
     */
    public void save(Path databasePath, Incident incident) throws IOException {
        Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JdbcTemplate jdbcTemplate = SqliteJdbcTemplates.forPath(databasePath);
        jdbcTemplate.execute(MetricsSchema.CREATE_INCIDENTS);
        jdbcTemplate.update(
                INSERT_INCIDENT,
                incident.getId(),
                incident.getRunId(),
                incident.getSeverity().getValue(),
                incident.getDescription(),
                incident.getLogExcerptPath(),
                incident.getCreatedUtc());
    }
}
