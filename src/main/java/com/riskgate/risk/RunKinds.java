package com.riskgate.risk;

/**
 * Run kinds the gate treats specially. Callers may use any other kind string; those are tracked
 * as leases but never capped.
 */
public final class RunKinds {

    public static final String BACKTEST = "backtest";
    public static final String LIVE = "live";

    private RunKinds() {}
}
