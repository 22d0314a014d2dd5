package com.riskgate.api.dto.response;

import lombok.Builder;
import lombok.Getter;

/**
 * Admission verdict for a prospective run. {@code reason} is null when allowed.
 */
@Getter
@Builder
public class PreRunCheckResponse {

    private final boolean allowed;
    private final String reason;
    private final String correlationId;
}
