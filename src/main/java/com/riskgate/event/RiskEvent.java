package com.riskgate.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the RiskManager when a run is blocked and when an incident is recorded.
 *
 * <p>Carries the type of condition, its severity, the reason string handed back to the caller,
 * the caller's correlation id (may be null), and a details map with condition-specific values
 * (e.g., active lease count and cap, offending market and exposure).
 *
 * <p>Listeners must not be relied on for the gate decision itself: publication happens after the
 * decision is made and failures while publishing are swallowed.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final String correlationId;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message, String correlationId) {
        this(source, eventType, level, message, correlationId, null);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            String correlationId,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.correlationId = correlationId;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>CONCURRENCY_LIMIT_REACHED: {"kind": "backtest", "active": 2, "max": 2}</li>
     *   <li>MARKET_EXPOSURE_LIMIT_BREACH: {"market": "BTC/USDT", "exposure": 30.0, "threshold": 0.25}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
