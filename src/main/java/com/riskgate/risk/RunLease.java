package com.riskgate.risk;

import java.nio.file.Path;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

/**
 * Handle for one in-flight run, backed by a lock file in the lease directory.
 *
 * <p>Returned by {@link RiskManager#acquireRunSlot} and handed back, exactly once, to
 * {@link RiskManager#releaseRunSlot}. The file's existence and modification time are what other
 * processes count; its JSON payload is informational only.
 */
@Getter
@ToString
public class RunLease {

    private final String kind;
    private final Path path;
    private final Instant createdAt;
    private final String correlationId;

    public RunLease(String kind, Path path, Instant createdAt, String correlationId) {
        this.kind = kind;
        this.path = path;
        this.createdAt = createdAt;
        this.correlationId = correlationId;
    }
}
