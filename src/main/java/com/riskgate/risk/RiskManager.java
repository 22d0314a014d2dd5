package com.riskgate.risk;

import com.riskgate.domain.enums.IncidentSeverity;
import com.riskgate.domain.model.Incident;
import com.riskgate.event.RiskEvent;
import com.riskgate.event.RiskEventType;
import com.riskgate.event.RiskLevel;
import com.riskgate.exception.BestEffort;
import com.riskgate.observability.CorrelationScope;
import com.riskgate.observability.IncidentLogger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Gate consulted by run orchestration before any backtest, hyperopt or live run starts.
 *
 * <p>Two responsibilities:
 * <ul>
 *   <li><b>Admission:</b> {@link #preRunCheck} evaluates the circuit breaker, the backtest drawdown
 *       guard and the live guardrails in a fixed order; the first failing check wins.</li>
 *   <li><b>Concurrency:</b> {@link #acquireRunSlot} / {@link #releaseRunSlot} manage one lease
 *       file per in-flight run in a directory shared by every process on the host.</li>
 * </ul>
 *
 * <p>The manager never starts work. Callers drive it synchronously:
 * <pre>{@code
 * RunAdmission admission = riskManager.preRunCheck("backtest", strategy, "5m", null, cid);
 * SlotAcquisition slot = riskManager.acquireRunSlot("backtest", cid);
 * try {
 *     run();
 * } finally {
 *     riskManager.releaseRunSlot(slot.getLease(), cid);
 * }
 * }</pre>
 *
 * <p>No public operation throws. Blocks are returned as values; degraded lookups resolve to "no
 * signal", except the circuit breaker which fails closed.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final RiskConfiguration riskConfiguration;
    private final CircuitBreakerReader circuitBreakerReader;
    private final DrawdownGuard drawdownGuard;
    private final LiveTradingGuardrails liveTradingGuardrails;
    private final RunLeaseStore runLeaseStore;
    private final IncidentLogger incidentLogger;
    private final ApplicationEventPublisher applicationEventPublisher;

    public RiskManager(
            RiskConfiguration riskConfiguration,
            CircuitBreakerReader circuitBreakerReader,
            DrawdownGuard drawdownGuard,
            LiveTradingGuardrails liveTradingGuardrails,
            RunLeaseStore runLeaseStore,
            IncidentLogger incidentLogger,
            ApplicationEventPublisher applicationEventPublisher) {
        this.riskConfiguration = riskConfiguration;
        this.circuitBreakerReader = circuitBreakerReader;
        this.drawdownGuard = drawdownGuard;
        this.liveTradingGuardrails = liveTradingGuardrails;
        this.runLeaseStore = runLeaseStore;
        this.incidentLogger = incidentLogger;
        this.applicationEventPublisher = applicationEventPublisher;
        log.debug("risk_manager_initialized config={}", riskConfiguration);
    }

    // ========================
    // PRE-RUN ADMISSION
    // ========================

    /**
     * Decides whether a run may start.
     *
     * <p>Checks (in order, first failure wins):
     * <ol>
     *   <li>Circuit breaker, unless the override is configured</li>
     *   <li>Recent backtest drawdown (kind "backtest" with a threshold configured)</li>
     *   <li>Live open trades cap (kind "live")</li>
     *   <li>Live per-market exposure cap (kind "live")</li>
     * </ol>
     *
     * @param kind run kind, e.g. "backtest", "hyperopt", "live"
     * @param strategy strategy name, logged only
     * @param timeframe timeframe, logged only; may be null
     * @param context caller-reported state for live checks; may be null
     * @param correlationId tracing id attached to every log line; may be null
     */
    public RunAdmission preRunCheck(
            String kind, String strategy, String timeframe, Map<String, Object> context, String correlationId) {
        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            log.info(
                    "pre_run_check kind={} strategy={} timeframe={} max_concurrent_backtests={} "
                            + "max_backtest_drawdown_pct={} live_max_concurrent_trades={} "
                            + "live_max_per_market_exposure_pct={} allow_when_cb={}",
                    kind,
                    strategy,
                    timeframe != null ? timeframe : "",
                    riskConfiguration.getMaxConcurrentBacktests(),
                    riskConfiguration.getMaxBacktestDrawdownFraction(),
                    riskConfiguration.getLiveMaxConcurrentTrades(),
                    riskConfiguration.getLiveMaxPerMarketExposureFraction(),
                    riskConfiguration.isAllowRunWhenCircuitBreakerActive());

            RunAdmission admission = evaluate(kind, context, correlationId);
            if (admission.isAllowed()) {
                log.info("pre_run_allowed kind={} strategy={}", kind, strategy);
            } else {
                log.warn("pre_run_blocked kind={} strategy={} reason={}", kind, strategy, admission.getReason());
            }
            return admission;
        }
    }

    private RunAdmission evaluate(String kind, Map<String, Object> context, String correlationId) {
        // 1. Circuit breaker
        CircuitBreakerStatus breaker = circuitBreakerReader.read(correlationId);
        if (breaker.active()) {
            if (!riskConfiguration.isAllowRunWhenCircuitBreakerActive()) {
                String reason = "circuit_breaker_active: " + (breaker.reason() != null ? breaker.reason() : "");
                log.warn("circuit_breaker_block reason={}", breaker.reason());
                publish(RiskEventType.CIRCUIT_BREAKER_BLOCK, RiskLevel.WARNING, reason, correlationId,
                        detailsOf("kind", kind));
                return RunAdmission.blocked(reason);
            }
            log.warn("circuit_breaker_overridden reason={}", breaker.reason());
        }

        // 2. Recent backtest drawdown
        Double maxDrawdown = riskConfiguration.getMaxBacktestDrawdownFraction();
        if (RunKinds.BACKTEST.equals(kind) && maxDrawdown != null) {
            log.debug("checking_recent_drawdown");
            Optional<Double> drawdown = BestEffort.getOrDefault(
                    log,
                    Level.WARN,
                    "dd_lookup_error",
                    () -> drawdownGuard.recentBacktestDrawdown(correlationId),
                    Optional.empty());
            if (drawdown.isPresent() && Math.abs(drawdown.get()) >= Math.max(0.0, maxDrawdown)) {
                String reason = "recent_drawdown_exceeded: " + RiskMath.formatDecimal(drawdown.get());
                log.warn("max_dd_block recent_dd={} threshold={}", drawdown.get(), maxDrawdown);
                publish(RiskEventType.DRAWDOWN_LIMIT_BREACH, RiskLevel.WARNING, reason, correlationId,
                        detailsOf("recentDrawdown", drawdown.get(), "threshold", maxDrawdown));
                return RunAdmission.blocked(reason);
            }
        }

        // 3 + 4. Live guardrails
        if (RunKinds.LIVE.equals(kind)) {
            log.debug("checking_live_guardrails");
            Optional<String> liveBlock = liveTradingGuardrails.check(context);
            if (liveBlock.isPresent()) {
                String reason = liveBlock.get();
                RiskEventType type = reason.startsWith("live_concurrent_trades_exceeded")
                        ? RiskEventType.LIVE_TRADES_LIMIT_BREACH
                        : RiskEventType.MARKET_EXPOSURE_LIMIT_BREACH;
                publish(type, RiskLevel.WARNING, reason, correlationId, detailsOf("kind", kind));
                return RunAdmission.blocked(reason);
            }
        }

        return RunAdmission.allowed();
    }

    /**
     * Minimal gate for trading executors that have no run intent to describe: only the circuit
     * breaker (and its override) is consulted.
     */
    public boolean checkRiskLimits() {
        CircuitBreakerStatus breaker = circuitBreakerReader.read(null);
        if (breaker.active() && !riskConfiguration.isAllowRunWhenCircuitBreakerActive()) {
            log.warn("risk_limits_exceeded reason=circuit_breaker: {}", breaker.reason());
            return false;
        }
        log.debug("risk_limits_ok");
        return true;
    }

    // ========================
    // CONCURRENCY SLOTS
    // ========================

    /**
     * Acquires a concurrency slot by creating a lease file.
     *
     * <p>Only "backtest" is capped (by maxConcurrentBacktests); other kinds, and backtests with no
     * positive cap, always get a lease so they remain visible in the lease directory.
     */
    public SlotAcquisition acquireRunSlot(String kind, String correlationId) {
        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            Integer maxSlots = RunKinds.BACKTEST.equals(kind) ? riskConfiguration.getMaxConcurrentBacktests() : null;
            if (maxSlots == null || maxSlots <= 0) {
                RunLease lease = runLeaseStore.create(kind, correlationId);
                log.info("slot_acquired kind={} unbounded=true lock={}", kind, lease.getPath());
                return SlotAcquisition.granted(lease);
            }

            int active = runLeaseStore.countActive(kind);
            if (active >= maxSlots) {
                String reason = "too_many_active_" + kind + "s: " + active + "/" + maxSlots;
                log.warn("slot_denied kind={} active={} max={}", kind, active, maxSlots);
                publish(RiskEventType.CONCURRENCY_LIMIT_REACHED, RiskLevel.WARNING, reason, correlationId,
                        detailsOf("kind", kind, "active", active, "max", maxSlots));
                return SlotAcquisition.denied(reason);
            }

            RunLease lease = runLeaseStore.create(kind, correlationId);
            log.info("slot_acquired kind={} active_before={} lock={}", kind, active, lease.getPath());
            return SlotAcquisition.granted(lease);
        }
    }

    /**
     * Releases a slot. Null is a no-op; releasing twice is harmless. Call from a finally block.
     */
    public void releaseRunSlot(RunLease lease, String correlationId) {
        if (lease == null) {
            return;
        }
        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            if (runLeaseStore.release(lease)) {
                log.info("slot_released lock={}", lease.getPath());
            }
        }
    }

    /** Live (non-stale) leases of {@code kind}; stale ones are reclaimed as a side effect. */
    public int countActiveLeases(String kind) {
        return runLeaseStore.countActive(kind);
    }

    /** Names of the live leases of {@code kind}, older first. */
    public List<String> listActiveLeases(String kind) {
        return runLeaseStore.listActive(kind);
    }

    // ========================
    // DELEGATES
    // ========================

    public CircuitBreakerStatus isCircuitBreakerActive(String correlationId) {
        return circuitBreakerReader.read(correlationId);
    }

    public Optional<Double> recentBacktestDrawdown(String correlationId) {
        return drawdownGuard.recentBacktestDrawdown(correlationId);
    }

    /**
     * Records an incident (see {@link IncidentLogger}) and publishes it as a {@link RiskEvent}.
     */
    public Incident logIncident(
            String runId, String severity, String description, String logExcerptPath, String correlationId) {
        Incident incident = incidentLogger.logIncident(runId, severity, description, logExcerptPath, correlationId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("incidentId", incident.getId());
        details.put("severity", incident.getSeverity().getValue());
        if (runId != null) {
            details.put("runId", runId);
        }
        publish(RiskEventType.INCIDENT_RECORDED, toRiskLevel(incident.getSeverity()), description, correlationId,
                details);
        return incident;
    }

    public RiskConfiguration getConfiguration() {
        return riskConfiguration;
    }

    // ========================
    // INTERNALS
    // ========================

    private void publish(
            RiskEventType type, RiskLevel level, String message, String correlationId, Map<String, Object> details) {
        BestEffort.run(
                log,
                Level.WARN,
                "risk_event_publish_error type=" + type,
                () -> applicationEventPublisher.publishEvent(
                        new RiskEvent(this, type, level, message, correlationId, details)));
    }

    private static Map<String, Object> detailsOf(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }

    private static RiskLevel toRiskLevel(IncidentSeverity severity) {
        return switch (severity) {
            case INFO -> RiskLevel.INFO;
            case WARNING -> RiskLevel.WARNING;
            case ERROR -> RiskLevel.ERROR;
            case CRITICAL -> RiskLevel.CRITICAL;
        };
    }
}
