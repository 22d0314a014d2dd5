package com.riskgate.risk;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Description of a prospective run, as handed to the gate by orchestration code.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RunIntent {

    private final String kind;
    private final String strategy;
    private final String timeframe;

    /** Optional caller-reported state; see {@link LiveTradingGuardrails} for the keys read. */
    private final Map<String, Object> context;

    private final String correlationId;
}
