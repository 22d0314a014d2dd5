package com.riskgate.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskgate.config.RiskConfigurationLoader;
import com.riskgate.risk.RiskConfiguration;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

/**
 * Unit tests for RiskConfigurationLoader: defaults, explicit values and lenient parsing.
 */
class RiskConfigurationLoaderTest {

    private static final Path ROOT = Path.of("/opt/riskgate");

    private RiskConfiguration load(MockEnvironment environment) {
        return new RiskConfigurationLoader(environment).load();
    }

    private MockEnvironment rooted() {
        return new MockEnvironment().withProperty(RiskConfigurationLoader.PROJECT_ROOT, ROOT.toString());
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Nothing configured leaves every guardrail disabled")
        void nothingConfigured_guardrailsDisabled() {
            RiskConfiguration configuration = load(rooted());

            assertThat(configuration.getMaxConcurrentBacktests()).isNull();
            assertThat(configuration.getMaxBacktestDrawdownFraction()).isNull();
            assertThat(configuration.getLiveMaxConcurrentTrades()).isNull();
            assertThat(configuration.getLiveMaxPerMarketExposureFraction()).isNull();
            assertThat(configuration.isAllowRunWhenCircuitBreakerActive()).isFalse();
            assertThat(configuration.getConcurrencyTtlSeconds()).isEqualTo(900);
        }

        @Test
        @DisplayName("Paths derive from the project root")
        void paths_deriveFromProjectRoot() {
            RiskConfiguration configuration = load(rooted());

            Path state = ROOT.resolve("user_data").resolve("state");
            assertThat(configuration.getStateDirectory()).isEqualTo(state);
            assertThat(configuration.getCircuitBreakerFile()).isEqualTo(state.resolve("circuit_breaker.json"));
            assertThat(configuration.getMetricsDatabasePath())
                    .isEqualTo(ROOT.resolve("user_data/registry/strategies_registry.sqlite"));
            assertThat(configuration.runningDirectory()).isEqualTo(state.resolve("running"));
        }

        @Test
        @DisplayName("Circuit breaker file follows an overridden state directory")
        void circuitBreakerFile_followsStateDir() {
            RiskConfiguration configuration =
                    load(rooted().withProperty(RiskConfigurationLoader.STATE_DIR, "/var/lib/gate"));

            assertThat(configuration.getCircuitBreakerFile()).isEqualTo(Path.of("/var/lib/gate/circuit_breaker.json"));
        }
    }

    @Nested
    @DisplayName("Explicit values")
    class ExplicitValues {

        @Test
        @DisplayName("All keys are read")
        void allKeys_read() {
            MockEnvironment environment = rooted()
                    .withProperty(RiskConfigurationLoader.MAX_CONCURRENT_BACKTESTS, "2")
                    .withProperty(RiskConfigurationLoader.CONCURRENCY_TTL_SEC, " 60 ")
                    .withProperty(RiskConfigurationLoader.CIRCUIT_BREAKER_FILE, "/tmp/cb.json")
                    .withProperty(RiskConfigurationLoader.ALLOW_WHEN_CB, "TRUE")
                    .withProperty(RiskConfigurationLoader.MAX_BACKTEST_DRAWDOWN_PCT, "0.2")
                    .withProperty(RiskConfigurationLoader.DB_PATH, "/tmp/metrics.sqlite")
                    .withProperty(RiskConfigurationLoader.LIVE_MAX_CONCURRENT_TRADES, "3")
                    .withProperty(RiskConfigurationLoader.LIVE_MAX_PER_MARKET_EXPOSURE_PCT, "25");

            RiskConfiguration configuration = load(environment);

            assertThat(configuration.getMaxConcurrentBacktests()).isEqualTo(2);
            assertThat(configuration.getConcurrencyTtlSeconds()).isEqualTo(60);
            assertThat(configuration.getCircuitBreakerFile()).isEqualTo(Path.of("/tmp/cb.json"));
            assertThat(configuration.isAllowRunWhenCircuitBreakerActive()).isTrue();
            assertThat(configuration.getMaxBacktestDrawdownFraction()).isEqualTo(0.2);
            assertThat(configuration.getMetricsDatabasePath()).isEqualTo(Path.of("/tmp/metrics.sqlite"));
            assertThat(configuration.getLiveMaxConcurrentTrades()).isEqualTo(3);
            assertThat(configuration.getLiveMaxPerMarketExposureFraction()).isEqualTo(25.0);
        }

        @Test
        @DisplayName("Only 1 and true enable the circuit breaker override")
        void allowWhenCb_acceptedValues() {
            assertThat(load(rooted().withProperty(RiskConfigurationLoader.ALLOW_WHEN_CB, "1"))
                            .isAllowRunWhenCircuitBreakerActive())
                    .isTrue();
            assertThat(load(rooted().withProperty(RiskConfigurationLoader.ALLOW_WHEN_CB, "yes"))
                            .isAllowRunWhenCircuitBreakerActive())
                    .isFalse();
            assertThat(load(rooted().withProperty(RiskConfigurationLoader.ALLOW_WHEN_CB, "0"))
                            .isAllowRunWhenCircuitBreakerActive())
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class InvalidValues {

        @Test
        @DisplayName("Unparsable numbers fall back instead of failing the load")
        void unparsableNumbers_fallBack() {
            MockEnvironment environment = rooted()
                    .withProperty(RiskConfigurationLoader.MAX_CONCURRENT_BACKTESTS, "two")
                    .withProperty(RiskConfigurationLoader.CONCURRENCY_TTL_SEC, "15m")
                    .withProperty(RiskConfigurationLoader.MAX_BACKTEST_DRAWDOWN_PCT, "twenty")
                    .withProperty(RiskConfigurationLoader.LIVE_MAX_CONCURRENT_TRADES, "");

            RiskConfiguration configuration = load(environment);

            assertThat(configuration.getMaxConcurrentBacktests()).isNull();
            assertThat(configuration.getConcurrencyTtlSeconds()).isEqualTo(900);
            assertThat(configuration.getMaxBacktestDrawdownFraction()).isNull();
            assertThat(configuration.getLiveMaxConcurrentTrades()).isNull();
        }

        @Test
        @DisplayName("Blank paths keep the default")
        void blankPath_keepsDefault() {
            RiskConfiguration configuration = load(rooted().withProperty(RiskConfigurationLoader.DB_PATH, "  "));

            assertThat(configuration.getMetricsDatabasePath())
                    .isEqualTo(ROOT.resolve("user_data/registry/strategies_registry.sqlite"));
        }
    }
}
