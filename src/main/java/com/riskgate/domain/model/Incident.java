package com.riskgate.domain.model;

import com.riskgate.domain.enums.IncidentSeverity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A risk-relevant event recorded by the incident log.
 *
 * <p>The id has the form {@code incident_<unix seconds>_<pid>[_<correlation id prefix>]} and is
 * generated before anything is logged so log lines and the stored row share it.
 */
@Getter
@Builder
@ToString
public class Incident {

    private final String id;

    /** Run the incident belongs to, if any. */
    private final String runId;

    private final IncidentSeverity severity;

    private final String description;

    /** Path to a log excerpt kept alongside the run artifacts. */
    private final String logExcerptPath;

    /** UTC ISO-8601 creation time. */
    private final String createdUtc;
}
