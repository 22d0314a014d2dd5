package com.riskgate.risk;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable guardrail configuration for one {@link RiskManager}.
 *
 * <p>Null values mean the check is disabled. For example, if maxBacktestDrawdownFraction is null
 * the drawdown guard is skipped; if maxConcurrentBacktests is null (or not positive) backtest
 * slots are unbounded.
 *
 * <p>Loaded once at startup by {@link com.riskgate.config.RiskConfigurationLoader} from
 * application.properties / environment (risk.*).
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RiskConfiguration {

    public static final int DEFAULT_CONCURRENCY_TTL_SECONDS = 900;

    // ==================== Concurrency ====================

    /** Concurrency cap for the "backtest" lease kind only. Null or <= 0 = unbounded. */
    private final Integer maxConcurrentBacktests;

    /** Age after which a lease file is considered stale and reclaimed. */
    @Builder.Default
    private final int concurrencyTtlSeconds = DEFAULT_CONCURRENCY_TTL_SECONDS;

    /** Root of the lease directory and default home of the circuit breaker file. */
    private final Path stateDirectory;

    // ==================== Circuit Breaker ====================

    /** Shared kill-switch document. Null = no breaker configured. */
    private final Path circuitBreakerFile;

    /** When true an active breaker is logged but does not block. */
    private final boolean allowRunWhenCircuitBreakerActive;

    // ==================== Backtest Drawdown ====================

    /** Blocks new backtests when |recent drawdown| >= this fraction (e.g., 0.2 = 20%). */
    private final Double maxBacktestDrawdownFraction;

    /** SQLite metrics store, also the incident sink. Null = no store. */
    private final Path metricsDatabasePath;

    // ==================== Live Guardrails ====================

    /** Cap on caller-reported open trades for live runs. */
    private final Integer liveMaxConcurrentTrades;

    /** Cap on per-market exposure for live runs; values > 1 are read as percent. */
    private final Double liveMaxPerMarketExposureFraction;

    /**
     * Directory holding one lock file per in-flight run.
     */
    public Path runningDirectory() {
        Path base = stateDirectory != null ? stateDirectory : Path.of("user_data", "state");
        return base.resolve("running");
    }
}
