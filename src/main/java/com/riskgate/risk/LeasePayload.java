package com.riskgate.risk;

/**
 * JSON body written into each lease file: {@code {"kind", "pid", "ts", "cid"}}.
 *
 * @param ts UTC ISO-8601 creation time
 * @param cid correlation id, empty string when none
 */
public record LeasePayload(String kind, long pid, String ts, String cid) {}
