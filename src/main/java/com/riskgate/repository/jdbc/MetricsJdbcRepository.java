package com.riskgate.repository.jdbc;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * Read-only queries against the run metrics store.
 */
@Repository
public class MetricsJdbcRepository {

    public static final String DRAWDOWN_METRIC_KEY = "max_drawdown_account";

    // Empty or missing start times sort last under DESC.
    private static final String LATEST_BACKTEST_DRAWDOWN = """
            SELECT m.value
            FROM metrics m
            JOIN runs r ON r.id = m.run_id
            WHERE r.kind = 'backtest' AND m.key = ?
            ORDER BY COALESCE(r.started_utc, '') DESC
            LIMIT 1
            """;

    /**
     * Raw stored value of the most recent backtest's {@code max_drawdown_account} metric. Empty if
     * there is no such row or the stored value is NULL.
     *
     * @throws org.springframework.dao.DataAccessException if the store cannot be queried (e.g.,
     *     tables missing)
     */
    public Optional<Object> findLatestBacktestDrawdown(Path databasePath) {
        List<Object> values = SqliteJdbcTemplates.forPath(databasePath)
                .query(LATEST_BACKTEST_DRAWDOWN, (rs, rowNum) -> rs.getObject(1), DRAWDOWN_METRIC_KEY);
        return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }
}
