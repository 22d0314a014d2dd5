package com.riskgate.risk;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stateless pre-run checks for live runs over the context the caller reports.
 *
 * <p>Context keys:
 * <ul>
 *   <li>{@value #OPEN_TRADES_COUNT}: number of currently open trades (any {@link Number})</li>
 *   <li>{@value #MARKET_EXPOSURE_PCT}: map of market to exposure, as fraction or percent</li>
 * </ul>
 *
 * <p>Absent or non-numeric values never block.
 */
@Component
public class LiveTradingGuardrails {

    private static final Logger log = LoggerFactory.getLogger(LiveTradingGuardrails.class);

    public static final String OPEN_TRADES_COUNT = "open_trades_count";
    public static final String MARKET_EXPOSURE_PCT = "market_exposure_pct";

    private final RiskConfiguration riskConfiguration;

    public LiveTradingGuardrails(RiskConfiguration riskConfiguration) {
        this.riskConfiguration = riskConfiguration;
    }

    /**
     * Runs the concurrent-trades cap, then the per-market exposure cap.
     *
     * @return the block reason of the first failing check, empty if both pass
     */
    public Optional<String> check(Map<String, Object> context) {
        Optional<String> tradesBlock = checkConcurrentTrades(context);
        if (tradesBlock.isPresent()) {
            return tradesBlock;
        }
        return checkPerMarketExposure(context);
    }

    Optional<String> checkConcurrentTrades(Map<String, Object> context) {
        Integer maxTrades = riskConfiguration.getLiveMaxConcurrentTrades();
        if (maxTrades == null || context == null) {
            return Optional.empty();
        }
        if (!(context.get(OPEN_TRADES_COUNT) instanceof Number reported)) {
            return Optional.empty();
        }

        BigInteger openTrades = RiskMath.toWholeNumber(reported);
        if (openTrades == null) {
            return Optional.empty();
        }
        if (openTrades.compareTo(BigInteger.valueOf(Math.max(0, maxTrades))) >= 0) {
            log.warn("live_concurrent_trades_block open_trades={} max={}", openTrades, maxTrades);
            return Optional.of("live_concurrent_trades_exceeded: " + openTrades + "/" + maxTrades);
        }
        return Optional.empty();
    }

    Optional<String> checkPerMarketExposure(Map<String, Object> context) {
        Double configured = riskConfiguration.getLiveMaxPerMarketExposureFraction();
        if (configured == null || context == null) {
            return Optional.empty();
        }
        if (!(context.get(MARKET_EXPOSURE_PCT) instanceof Map<?, ?> exposures) || exposures.isEmpty()) {
            return Optional.empty();
        }

        double threshold = RiskMath.normalizeFraction(configured);
        for (Map.Entry<?, ?> entry : exposures.entrySet()) {
            Double exposure = RiskMath.toDouble(entry.getValue());
            if (exposure == null) {
                continue;
            }
            if (RiskMath.normalizeFraction(exposure) > threshold) {
                log.warn(
                        "live_per_market_exposure_block market={} exposure={} threshold={}",
                        entry.getKey(),
                        exposure,
                        threshold);
                return Optional.of("per_market_exposure_exceeded:" + entry.getKey() + ":"
                        + RiskMath.formatDecimal(exposure) + ">" + RiskMath.formatDecimal(threshold));
            }
        }
        return Optional.empty();
    }
}
