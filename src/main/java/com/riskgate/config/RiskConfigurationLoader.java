package com.riskgate.config;

import com.riskgate.risk.RiskConfiguration;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.PropertyResolver;

/**
 * Builds a {@link RiskConfiguration} from raw string properties.
 *
 * <p>Keys are read through a Spring {@link PropertyResolver}, so {@code risk.max-concurrent-backtests}
 * is also satisfied by the environment variable {@code RISK_MAX_CONCURRENT_BACKTESTS} via relaxed
 * binding. Every field falls back to its default on absence or parse failure; loading never throws.
 *
 * <p>Boolean values are trimmed and compared case-insensitively; only {@code 1} and {@code true}
 * are true.
 */
public class RiskConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(RiskConfigurationLoader.class);

    public static final String PROJECT_ROOT = "risk.project-root";
    public static final String MAX_CONCURRENT_BACKTESTS = "risk.max-concurrent-backtests";
    public static final String CONCURRENCY_TTL_SEC = "risk.concurrency-ttl-sec";
    public static final String STATE_DIR = "risk.state-dir";
    public static final String CIRCUIT_BREAKER_FILE = "risk.circuit-breaker-file";
    public static final String ALLOW_WHEN_CB = "risk.allow-when-cb";
    public static final String MAX_BACKTEST_DRAWDOWN_PCT = "risk.max-backtest-drawdown-pct";
    public static final String DB_PATH = "risk.db-path";
    public static final String LIVE_MAX_CONCURRENT_TRADES = "risk.live-max-concurrent-trades";
    public static final String LIVE_MAX_PER_MARKET_EXPOSURE_PCT = "risk.live-max-per-market-exposure-pct";

    private final PropertyResolver propertyResolver;

    public RiskConfigurationLoader(PropertyResolver propertyResolver) {
        this.propertyResolver = propertyResolver;
    }

    public RiskConfiguration load() {
        Path root = readPath(PROJECT_ROOT, Path.of(System.getProperty("user.dir")));
        Path userData = root.resolve("user_data");

        Integer maxConcurrentBacktests = readInteger(MAX_CONCURRENT_BACKTESTS, null);
        int ttlSeconds = readInteger(CONCURRENCY_TTL_SEC, RiskConfiguration.DEFAULT_CONCURRENCY_TTL_SECONDS);
        Path stateDir = readPath(STATE_DIR, userData.resolve("state"));
        Path circuitBreakerFile = readPath(CIRCUIT_BREAKER_FILE, stateDir.resolve("circuit_breaker.json"));
        boolean allowWhenCircuitBreaker = readBoolean(ALLOW_WHEN_CB);
        Double maxDrawdown = readDouble(MAX_BACKTEST_DRAWDOWN_PCT);
        Path dbPath = readPath(DB_PATH, userData.resolve("registry").resolve("strategies_registry.sqlite"));
        Integer liveMaxTrades = readInteger(LIVE_MAX_CONCURRENT_TRADES, null);
        Double liveMaxExposure = readDouble(LIVE_MAX_PER_MARKET_EXPOSURE_PCT);

        RiskConfiguration configuration = RiskConfiguration.builder()
                .maxConcurrentBacktests(maxConcurrentBacktests)
                .concurrencyTtlSeconds(ttlSeconds)
                .stateDirectory(stateDir)
                .circuitBreakerFile(circuitBreakerFile)
                .allowRunWhenCircuitBreakerActive(allowWhenCircuitBreaker)
                .maxBacktestDrawdownFraction(maxDrawdown)
                .metricsDatabasePath(dbPath)
                .liveMaxConcurrentTrades(liveMaxTrades)
                .liveMaxPerMarketExposureFraction(liveMaxExposure)
                .build();
        log.info("risk_configuration_loaded {}", configuration);
        return configuration;
    }

    // ========================
    // PARSERS
    // ========================

    Integer readInteger(String key, Integer defaultValue) {
        String raw = raw(key);
        Integer value = defaultValue;
        if (raw != null) {
            try {
                value = Integer.valueOf(raw.trim());
            } catch (NumberFormatException e) {
                log.warn("config_value_invalid key={} value={} fallback={}", key, raw, defaultValue);
            }
        }
        log.debug("config_loaded key={} value={}", key, value);
        return value;
    }

    Double readDouble(String key) {
        String raw = raw(key);
        Double value = null;
        if (raw != null) {
            try {
                value = Double.valueOf(raw.trim());
            } catch (NumberFormatException e) {
                log.warn("config_value_invalid key={} value={} fallback=null", key, raw);
            }
        }
        log.debug("config_loaded key={} value={}", key, value);
        return value;
    }

    boolean readBoolean(String key) {
        String raw = raw(key);
        boolean value = false;
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            value = normalized.equals("1") || normalized.equals("true");
        }
        log.debug("config_loaded key={} value={}", key, value);
        return value;
    }

    Path readPath(String key, Path defaultValue) {
        String raw = raw(key);
        Path value = defaultValue;
        if (raw != null && !raw.isBlank()) {
            try {
                value = Path.of(raw.trim());
            } catch (InvalidPathException e) {
                log.warn("config_value_invalid key={} value={} fallback={}", key, raw, defaultValue);
            }
        }
        log.debug("config_loaded key={} value={}", key, value);
        return value;
    }

    private String raw(String key) {
        try {
            return propertyResolver.getProperty(key);
        } catch (RuntimeException e) {
            // placeholder resolution failures and the like
            log.warn("config_value_unreadable key={} error={}", key, e.getMessage());
            return null;
        }
    }
}
