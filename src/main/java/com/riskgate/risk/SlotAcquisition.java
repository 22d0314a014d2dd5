package com.riskgate.risk;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link RiskManager#acquireRunSlot}. A granted slot carries the lease to release; a
 * denied one carries the reason and no lease (nothing was created).
 */
@Getter
@ToString
public class SlotAcquisition {

    private final boolean allowed;
    private final String reason;
    private final RunLease lease;

    private SlotAcquisition(boolean allowed, String reason, RunLease lease) {
        this.allowed = allowed;
        this.reason = reason;
        this.lease = lease;
    }

    public static SlotAcquisition granted(RunLease lease) {
        return new SlotAcquisition(true, null, lease);
    }

    public static SlotAcquisition denied(String reason) {
        return new SlotAcquisition(false, reason, null);
    }
}
