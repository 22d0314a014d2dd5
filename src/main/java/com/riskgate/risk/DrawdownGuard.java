package com.riskgate.risk;

import com.riskgate.exception.BestEffort;
import com.riskgate.observability.CorrelationScope;
import com.riskgate.repository.jdbc.MetricsJdbcRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

/**
 * Looks up the most recent realized backtest drawdown in the metrics store.
 *
 * <p>Missing store, missing tables, no qualifying row, a NULL or non-numeric value are all the
 * same outcome: no signal. Nothing here throws.
 */
@Component
public class DrawdownGuard {

    private static final Logger log = LoggerFactory.getLogger(DrawdownGuard.class);

    private final RiskConfiguration riskConfiguration;
    private final MetricsJdbcRepository metricsJdbcRepository;

    public DrawdownGuard(RiskConfiguration riskConfiguration, MetricsJdbcRepository metricsJdbcRepository) {
        this.riskConfiguration = riskConfiguration;
        this.metricsJdbcRepository = metricsJdbcRepository;
    }

    /**
     * Most recent backtest {@code max_drawdown_account}, normalised to a fraction with its sign
     * kept (25 becomes 0.25, -30 becomes -0.30, 0.1 stays 0.1).
     */
    public Optional<Double> recentBacktestDrawdown(String correlationId) {
        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            Path databasePath = riskConfiguration.getMetricsDatabasePath();
            if (databasePath == null || !Files.exists(databasePath)) {
                log.debug("dd_check_skipped_no_db db_path={}", databasePath);
                return Optional.empty();
            }

            Optional<Object> stored = BestEffort.getOrDefault(
                    log,
                    Level.ERROR,
                    "dd_check_db_error db_path=" + databasePath,
                    () -> metricsJdbcRepository.findLatestBacktestDrawdown(databasePath),
                    Optional.empty());
            if (stored.isEmpty()) {
                log.debug("dd_check_no_metric_found");
                return Optional.empty();
            }

            Double value = RiskMath.toDouble(stored.get());
            if (value == null) {
                log.debug("dd_check_unparsable value={}", stored.get());
                return Optional.empty();
            }
            return Optional.of(RiskMath.normalizeSignedFraction(value));
        }
    }
}
