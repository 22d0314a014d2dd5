package com.riskgate.observability;

import com.riskgate.event.RiskEvent;
import com.riskgate.event.RiskEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for gate decisions, fed from {@link RiskEvent}s.
 *
 * <ul>
 *   <li><b>risk.gate.blocked</b> (counter, tag {@code type}): one per blocked admission or denied slot</li>
 *   <li><b>risk.incidents.recorded</b> (counter, tag {@code severity}): one per recorded incident</li>
 * </ul>
 */
@Service
public class RiskGateMetrics {

    static final String BLOCKED_METRIC = "risk.gate.blocked";
    static final String INCIDENTS_METRIC = "risk.incidents.recorded";

    private final MeterRegistry meterRegistry;

    public RiskGateMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.INCIDENT_RECORDED) {
            incidentsCounter(event.getLevel().name().toLowerCase(Locale.ROOT)).increment();
        } else {
            blockedCounter(event.getEventType().name().toLowerCase(Locale.ROOT)).increment();
        }
    }

    Counter blockedCounter(String type) {
        return Counter.builder(BLOCKED_METRIC)
                .description("Runs refused by the risk gate")
                .tag("type", type)
                .register(meterRegistry);
    }

    Counter incidentsCounter(String severity) {
        return Counter.builder(INCIDENTS_METRIC)
                .description("Incidents recorded through the risk gate")
                .tag("severity", severity)
                .register(meterRegistry);
    }
}
