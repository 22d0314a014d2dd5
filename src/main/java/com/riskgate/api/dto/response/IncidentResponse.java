package com.riskgate.api.dto.response;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class IncidentResponse {

    private final String incidentId;
    private final String severity;
    private final String createdUtc;
}
