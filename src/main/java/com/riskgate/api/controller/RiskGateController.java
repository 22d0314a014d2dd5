package com.riskgate.api.controller;

import com.riskgate.api.dto.request.CircuitBreakerEnableRequest;
import com.riskgate.api.dto.request.IncidentRequest;
import com.riskgate.api.dto.request.PreRunCheckRequest;
import com.riskgate.api.dto.response.IncidentResponse;
import com.riskgate.api.dto.response.LeaseSummaryResponse;
import com.riskgate.api.dto.response.PreRunCheckResponse;
import com.riskgate.domain.model.Incident;
import com.riskgate.risk.CircuitBreakerAdminService;
import com.riskgate.risk.CircuitBreakerAdminStatus;
import com.riskgate.risk.RiskManager;
import com.riskgate.risk.RunAdmission;
import com.riskgate.risk.RunKinds;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the risk gate.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/circuit-breaker -- file contents and effective state</li>
 *   <li>POST /api/risk/circuit-breaker/enable -- turn the kill switch on</li>
 *   <li>POST /api/risk/circuit-breaker/disable -- turn it off</li>
 *   <li>POST /api/risk/pre-run-check -- dry-run admission for a prospective run</li>
 *   <li>GET /api/risk/leases/{kind} -- live concurrency leases of a kind</li>
 *   <li>POST /api/risk/incidents -- record an incident</li>
 * </ul>
 *
 * <p>The pre-run check is read-only: it never acquires a slot.
 */
@RestController
@RequestMapping("/api/risk")
public class RiskGateController {

    private static final Logger log = LoggerFactory.getLogger(RiskGateController.class);

    private final RiskManager riskManager;
    private final CircuitBreakerAdminService circuitBreakerAdminService;

    public RiskGateController(RiskManager riskManager, CircuitBreakerAdminService circuitBreakerAdminService) {
        this.riskManager = riskManager;
        this.circuitBreakerAdminService = circuitBreakerAdminService;
    }

    @GetMapping("/circuit-breaker")
    public ResponseEntity<CircuitBreakerAdminStatus> getCircuitBreaker() {
        return ResponseEntity.ok(circuitBreakerAdminService.status());
    }

    @PostMapping("/circuit-breaker/enable")
    public ResponseEntity<CircuitBreakerAdminStatus> enableCircuitBreaker(
            @Valid @RequestBody(required = false) CircuitBreakerEnableRequest request) {
        CircuitBreakerEnableRequest body = request != null ? request : new CircuitBreakerEnableRequest();
        log.warn("cb_enable_requested reason={} minutes={} until_iso={}",
                body.getReason(), body.getMinutes(), body.getUntilIso());
        return ResponseEntity.ok(
                circuitBreakerAdminService.enable(body.getReason(), body.getMinutes(), body.getUntilIso()));
    }

    @PostMapping("/circuit-breaker/disable")
    public ResponseEntity<CircuitBreakerAdminStatus> disableCircuitBreaker() {
        log.info("cb_disable_requested");
        return ResponseEntity.ok(circuitBreakerAdminService.disable());
    }

    @PostMapping("/pre-run-check")
    public ResponseEntity<PreRunCheckResponse> preRunCheck(@Valid @RequestBody PreRunCheckRequest request) {
        RunAdmission admission = riskManager.preRunCheck(
                request.getKind(),
                request.getStrategy(),
                request.getTimeframe(),
                request.getContext(),
                request.getCorrelationId());
        return ResponseEntity.ok(PreRunCheckResponse.builder()
                .allowed(admission.isAllowed())
                .reason(admission.getReason())
                .correlationId(request.getCorrelationId())
                .build());
    }

    @GetMapping("/leases/{kind}")
    public ResponseEntity<LeaseSummaryResponse> getLeases(@PathVariable String kind) {
        Integer max = RunKinds.BACKTEST.equals(kind)
                ? riskManager.getConfiguration().getMaxConcurrentBacktests()
                : null;
        List<String> leases = riskManager.listActiveLeases(kind);
        return ResponseEntity.ok(LeaseSummaryResponse.builder()
                .kind(kind)
                .active(leases.size())
                .max(max != null && max > 0 ? max : null)
                .leases(leases)
                .build());
    }

    @PostMapping("/incidents")
    public ResponseEntity<IncidentResponse> recordIncident(@Valid @RequestBody IncidentRequest request) {
        Incident incident = riskManager.logIncident(
                request.getRunId(),
                request.getSeverity(),
                request.getDescription(),
                request.getLogExcerptPath(),
                request.getCorrelationId());
        return ResponseEntity.ok(IncidentResponse.builder()
                .incidentId(incident.getId())
                .severity(incident.getSeverity().getValue())
                .createdUtc(incident.getCreatedUtc())
                .build());
    }
}
