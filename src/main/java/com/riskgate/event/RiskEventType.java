package com.riskgate.event;

/**
 * Classifies the condition behind a {@link RiskEvent}. One type per blocking check of the
 * pre-run gate, plus concurrency denial and incident recording.
 */
public enum RiskEventType {

    /** The global circuit breaker blocked a run. */
    CIRCUIT_BREAKER_BLOCK,

    /** The most recent backtest drawdown met or exceeded the configured threshold. */
    DRAWDOWN_LIMIT_BREACH,

    /** A live run reported as many open trades as the cap allows. */
    LIVE_TRADES_LIMIT_BREACH,

    /** A live run reported a market exposure above the per-market cap. */
    MARKET_EXPOSURE_LIMIT_BREACH,

    /** No concurrency slot was free for the requested run kind. */
    CONCURRENCY_LIMIT_REACHED,

    /** An incident was recorded through the incident log. */
    INCIDENT_RECORDED
}
