package com.riskgate.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.riskgate.domain.enums.IncidentSeverity;
import com.riskgate.domain.model.Incident;
import com.riskgate.event.RiskEvent;
import com.riskgate.event.RiskEventType;
import com.riskgate.event.RiskLevel;
import com.riskgate.observability.IncidentLogger;
import com.riskgate.risk.CircuitBreakerReader;
import com.riskgate.risk.CircuitBreakerStatus;
import com.riskgate.risk.DrawdownGuard;
import com.riskgate.risk.LiveTradingGuardrails;
import com.riskgate.risk.RiskConfiguration;
import com.riskgate.risk.RiskManager;
import com.riskgate.risk.RunAdmission;
import com.riskgate.risk.RunLease;
import com.riskgate.risk.RunLeaseStore;
import com.riskgate.risk.SlotAcquisition;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for RiskManager covering admission ordering, the circuit breaker override,
 * slot acquisition and release, and event publication.
 */
@ExtendWith(MockitoExtension.class)
class RiskManagerTest {

    @Mock
    private CircuitBreakerReader circuitBreakerReader;

    @Mock
    private DrawdownGuard drawdownGuard;

    @Mock
    private LiveTradingGuardrails liveTradingGuardrails;

    @Mock
    private RunLeaseStore runLeaseStore;

    @Mock
    private IncidentLogger incidentLogger;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private RiskManager manager(RiskConfiguration configuration) {
        return new RiskManager(
                configuration,
                circuitBreakerReader,
                drawdownGuard,
                liveTradingGuardrails,
                runLeaseStore,
                incidentLogger,
                applicationEventPublisher);
    }

    private RiskManager manager() {
        return manager(RiskConfiguration.builder().build());
    }

    private static RunLease lease(String kind) {
        return new RunLease(kind, Path.of("/tmp/running/" + kind + "_1_1.lock"), Instant.now(), "cid");
    }

    private RiskEvent capturePublishedEvent() {
        ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    // ==============================
    // CIRCUIT BREAKER
    // ==============================

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreaker {

        @Test
        @DisplayName("Active breaker blocks before any other check")
        void activeBreaker_blocksFirst() {
            when(circuitBreakerReader.read("cid")).thenReturn(CircuitBreakerStatus.active("manual halt"));
            RiskManager riskManager = manager(RiskConfiguration.builder()
                    .maxBacktestDrawdownFraction(0.2)
                    .build());

            RunAdmission admission = riskManager.preRunCheck("backtest", "SampleStrategy", "5m", null, "cid");

            assertThat(admission.isAllowed()).isFalse();
            assertThat(admission.getReason()).isEqualTo("circuit_breaker_active: manual halt");
            verifyNoInteractions(drawdownGuard, liveTradingGuardrails);
        }

        @Test
        @DisplayName("Block is published as a CIRCUIT_BREAKER_BLOCK event")
        void activeBreaker_publishesEvent() {
            when(circuitBreakerReader.read("cid")).thenReturn(CircuitBreakerStatus.parseError());

            manager().preRunCheck("hyperopt", "S", null, null, "cid");

            RiskEvent event = capturePublishedEvent();
            assertThat(event.getEventType()).isEqualTo(RiskEventType.CIRCUIT_BREAKER_BLOCK);
            assertThat(event.getLevel()).isEqualTo(RiskLevel.WARNING);
            assertThat(event.getMessage()).isEqualTo("circuit_breaker_active: circuit_breaker_parse_error");
            assertThat(event.getCorrelationId()).isEqualTo("cid");
            assertThat(event.getDetails()).containsEntry("kind", "hyperopt");
        }

        @Test
        @DisplayName("Override lets the run through and continues with the next checks")
        void override_allowsAndContinues() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.active("halt"));
            when(drawdownGuard.recentBacktestDrawdown(any())).thenReturn(Optional.of(0.05));
            RiskManager riskManager = manager(RiskConfiguration.builder()
                    .allowRunWhenCircuitBreakerActive(true)
                    .maxBacktestDrawdownFraction(0.2)
                    .build());

            RunAdmission admission = riskManager.preRunCheck("backtest", "S", "5m", null, null);

            assertThat(admission.isAllowed()).isTrue();
            assertThat(admission.getReason()).isNull();
            verify(drawdownGuard).recentBacktestDrawdown(any());
            verifyNoInteractions(applicationEventPublisher);
        }

        @Test
        @DisplayName("checkRiskLimits consults only the breaker")
        void checkRiskLimits_breakerOnly() {
            when(circuitBreakerReader.read(any()))
                    .thenReturn(CircuitBreakerStatus.active("halt"))
                    .thenReturn(CircuitBreakerStatus.inactive());
            RiskManager riskManager = manager();

            assertThat(riskManager.checkRiskLimits()).isFalse();
            assertThat(riskManager.checkRiskLimits()).isTrue();
            verifyNoInteractions(drawdownGuard, liveTradingGuardrails, runLeaseStore);
        }
    }

    // ==============================
    // DRAWDOWN
    // ==============================

    @Nested
    @DisplayName("Drawdown guard")
    class Drawdown {

        @Test
        @DisplayName("Drawdown at or above the threshold blocks a backtest")
        void drawdownAtThreshold_blocks() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(drawdownGuard.recentBacktestDrawdown(any())).thenReturn(Optional.of(-0.25));
            RiskManager riskManager = manager(RiskConfiguration.builder().maxBacktestDrawdownFraction(0.2).build());

            RunAdmission admission = riskManager.preRunCheck("backtest", "S", "5m", null, "cid");

            assertThat(admission.isBlocked()).isTrue();
            assertThat(admission.getReason()).isEqualTo("recent_drawdown_exceeded: -0.25");
            RiskEvent event = capturePublishedEvent();
            assertThat(event.getEventType()).isEqualTo(RiskEventType.DRAWDOWN_LIMIT_BREACH);
            assertThat(event.getDetails()).containsEntry("threshold", 0.2);
        }

        @Test
        @DisplayName("Tiny drawdowns are reported in scientific notation")
        void tinyDrawdown_reasonInScientificNotation() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(drawdownGuard.recentBacktestDrawdown(any())).thenReturn(Optional.of(-0.00005));
            RiskManager riskManager = manager(RiskConfiguration.builder().maxBacktestDrawdownFraction(0.0).build());

            assertThat(riskManager.preRunCheck("backtest", "S", "5m", null, "cid").getReason())
                    .isEqualTo("recent_drawdown_exceeded: -5e-05");
        }

        @Test
        @DisplayName("Drawdown below the threshold is allowed")
        void drawdownBelowThreshold_allowed() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(drawdownGuard.recentBacktestDrawdown(any())).thenReturn(Optional.of(0.1));
            RiskManager riskManager = manager(RiskConfiguration.builder().maxBacktestDrawdownFraction(0.2).build());

            assertThat(riskManager.preRunCheck("backtest", "S", "5m", null, null).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("A failing lookup is treated as no signal")
        void lookupFailure_allowed() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(drawdownGuard.recentBacktestDrawdown(any())).thenThrow(new IllegalStateException("db gone"));
            RiskManager riskManager = manager(RiskConfiguration.builder().maxBacktestDrawdownFraction(0.2).build());

            assertThat(riskManager.preRunCheck("backtest", "S", "5m", null, null).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Only backtests are subject to the drawdown guard")
        void nonBacktest_skipsDrawdown() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            RiskManager riskManager = manager(RiskConfiguration.builder().maxBacktestDrawdownFraction(0.0).build());

            assertThat(riskManager.preRunCheck("hyperopt", "S", "5m", null, null).isAllowed()).isTrue();
            verifyNoInteractions(drawdownGuard);
        }

        @Test
        @DisplayName("No threshold configured skips the lookup")
        void noThreshold_skipsDrawdown() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());

            assertThat(manager().preRunCheck("backtest", "S", "5m", null, null).isAllowed()).isTrue();
            verifyNoInteractions(drawdownGuard);
        }
    }

    // ==============================
    // LIVE GUARDRAILS
    // ==============================

    @Nested
    @DisplayName("Live guardrails")
    class Live {

        @Test
        @DisplayName("Guardrail reason is returned verbatim for live runs")
        void liveBlock_returnedVerbatim() {
            Map<String, Object> context = Map.of(LiveTradingGuardrails.OPEN_TRADES_COUNT, 3);
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(liveTradingGuardrails.check(context)).thenReturn(Optional.of("live_concurrent_trades_exceeded: 3/3"));

            RunAdmission admission = manager().preRunCheck("live", "S", "1h", context, "cid");

            assertThat(admission.getReason()).isEqualTo("live_concurrent_trades_exceeded: 3/3");
            assertThat(capturePublishedEvent().getEventType()).isEqualTo(RiskEventType.LIVE_TRADES_LIMIT_BREACH);
        }

        @Test
        @DisplayName("Exposure blocks are published as MARKET_EXPOSURE_LIMIT_BREACH")
        void exposureBlock_eventType() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(liveTradingGuardrails.check(any()))
                    .thenReturn(Optional.of("per_market_exposure_exceeded:BTC/USDT:30.0>0.25"));

            manager().preRunCheck("live", "S", "1h", Map.of(), "cid");

            assertThat(capturePublishedEvent().getEventType()).isEqualTo(RiskEventType.MARKET_EXPOSURE_LIMIT_BREACH);
        }

        @Test
        @DisplayName("Guardrails are not consulted for non-live runs")
        void nonLive_skipsGuardrails() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());

            manager().preRunCheck("backtest", "S", "5m", Map.of(LiveTradingGuardrails.OPEN_TRADES_COUNT, 99), null);

            verifyNoInteractions(liveTradingGuardrails);
        }

        @Test
        @DisplayName("A failing publisher does not change the decision")
        void publisherFailure_ignored() {
            when(circuitBreakerReader.read(any())).thenReturn(CircuitBreakerStatus.inactive());
            when(liveTradingGuardrails.check(any())).thenReturn(Optional.of("live_concurrent_trades_exceeded: 1/1"));
            doThrow(new IllegalStateException("listener failed"))
                    .when(applicationEventPublisher)
                    .publishEvent(any(RiskEvent.class));

            RunAdmission admission = manager().preRunCheck("live", "S", "1h", Map.of(), "cid");

            assertThat(admission.isBlocked()).isTrue();
        }
    }

    // ==============================
    // SLOTS
    // ==============================

    @Nested
    @DisplayName("Run slots")
    class Slots {

        @Test
        @DisplayName("Backtest at cap is denied without creating a lease")
        void backtestAtCap_denied() {
            when(runLeaseStore.countActive("backtest")).thenReturn(2);
            RiskManager riskManager = manager(RiskConfiguration.builder().maxConcurrentBacktests(2).build());

            SlotAcquisition slot = riskManager.acquireRunSlot("backtest", "cid");

            assertThat(slot.isAllowed()).isFalse();
            assertThat(slot.getReason()).isEqualTo("too_many_active_backtests: 2/2");
            assertThat(slot.getLease()).isNull();
            verify(runLeaseStore, never()).create(anyString(), any());
            RiskEvent event = capturePublishedEvent();
            assertThat(event.getEventType()).isEqualTo(RiskEventType.CONCURRENCY_LIMIT_REACHED);
            assertThat(event.getDetails()).containsEntry("active", 2).containsEntry("max", 2);
        }

        @Test
        @DisplayName("Backtest below cap gets a lease")
        void backtestBelowCap_granted() {
            RunLease lease = lease("backtest");
            when(runLeaseStore.countActive("backtest")).thenReturn(1);
            when(runLeaseStore.create("backtest", "cid")).thenReturn(lease);
            RiskManager riskManager = manager(RiskConfiguration.builder().maxConcurrentBacktests(2).build());

            SlotAcquisition slot = riskManager.acquireRunSlot("backtest", "cid");

            assertThat(slot.isAllowed()).isTrue();
            assertThat(slot.getLease()).isSameAs(lease);
        }

        @Test
        @DisplayName("Uncapped kinds get a lease without counting")
        void uncappedKind_noCount() {
            when(runLeaseStore.create("hyperopt", null)).thenReturn(lease("hyperopt"));
            RiskManager riskManager = manager(RiskConfiguration.builder().maxConcurrentBacktests(1).build());

            assertThat(riskManager.acquireRunSlot("hyperopt", null).isAllowed()).isTrue();
            verify(runLeaseStore, never()).countActive(anyString());
        }

        @Test
        @DisplayName("Non-positive cap means unbounded")
        void nonPositiveCap_unbounded() {
            when(runLeaseStore.create("backtest", null)).thenReturn(lease("backtest"));
            RiskManager riskManager = manager(RiskConfiguration.builder().maxConcurrentBacktests(0).build());

            assertThat(riskManager.acquireRunSlot("backtest", null).isAllowed()).isTrue();
            verify(runLeaseStore, never()).countActive(anyString());
        }

        @Test
        @DisplayName("Releasing null is a no-op")
        void releaseNull_noop() {
            manager().releaseRunSlot(null, "cid");

            verifyNoInteractions(runLeaseStore);
        }

        @Test
        @DisplayName("Release delegates to the store")
        void release_delegates() {
            RunLease lease = lease("backtest");
            when(runLeaseStore.release(lease)).thenReturn(true).thenReturn(false);
            RiskManager riskManager = manager();

            riskManager.releaseRunSlot(lease, "cid");
            riskManager.releaseRunSlot(lease, "cid");

            verify(runLeaseStore, times(2)).release(lease);
        }
    }

    // ==============================
    // INCIDENTS
    // ==============================

    @Test
    @DisplayName("Recorded incidents are published with their severity")
    void logIncident_publishes() {
        Incident incident = Incident.builder()
                .id("incident_1_1_cid")
                .runId("run-1")
                .severity(IncidentSeverity.CRITICAL)
                .description("exchange down")
                .createdUtc("2025-01-01T00:00:00Z")
                .build();
        when(incidentLogger.logIncident("run-1", "CRITICAL", "exchange down", null, "cid")).thenReturn(incident);

        Incident recorded = manager().logIncident("run-1", "CRITICAL", "exchange down", null, "cid");

        assertThat(recorded).isSameAs(incident);
        RiskEvent event = capturePublishedEvent();
        assertThat(event.getEventType()).isEqualTo(RiskEventType.INCIDENT_RECORDED);
        assertThat(event.getLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(event.getDetails())
                .containsEntry("incidentId", "incident_1_1_cid")
                .containsEntry("severity", "critical")
                .containsEntry("runId", "run-1");
    }
}
