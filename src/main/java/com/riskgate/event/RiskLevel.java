package com.riskgate.event;

/**
 * Severity level for a {@link RiskEvent}.
 */
public enum RiskLevel {

    /** Informational. */
    INFO,

    /** A run was blocked or something needs attention. */
    WARNING,

    /** An operation failed. */
    ERROR,

    /** Operator action required. */
    CRITICAL
}
