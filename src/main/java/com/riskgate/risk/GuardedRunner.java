package com.riskgate.risk;

import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Wraps a unit of work in the full gate sequence: admission check, slot acquisition, work, and a
 * release that runs even when the work throws.
 *
 * <p>Exceptions from the work itself are the caller's and propagate unchanged after the lease is
 * released.
 */
@Service
public class GuardedRunner {

    private static final Logger log = LoggerFactory.getLogger(GuardedRunner.class);

    private final RiskManager riskManager;

    public GuardedRunner(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    public <T> GuardedRunResult<T> execute(RunIntent intent, Supplier<T> work) {
        String correlationId = intent.getCorrelationId() != null
                ? intent.getCorrelationId()
                : UUID.randomUUID().toString().replace("-", "");

        RunAdmission admission = riskManager.preRunCheck(
                intent.getKind(), intent.getStrategy(), intent.getTimeframe(), intent.getContext(), correlationId);
        if (admission.isBlocked()) {
            log.warn("risk_block kind={} reason={}", intent.getKind(), admission.getReason());
            return GuardedRunResult.blocked("Risk blocked: " + admission.getReason(), correlationId);
        }

        SlotAcquisition slot = riskManager.acquireRunSlot(intent.getKind(), correlationId);
        if (!slot.isAllowed()) {
            log.warn("risk_concurrency_block kind={} reason={}", intent.getKind(), slot.getReason());
            return GuardedRunResult.blocked("Risk concurrency blocked: " + slot.getReason(), correlationId);
        }

        try {
            return GuardedRunResult.completed(work.get(), correlationId);
        } finally {
            riskManager.releaseRunSlot(slot.getLease(), correlationId);
        }
    }
}
