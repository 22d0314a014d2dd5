package com.riskgate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/risk/incidents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentRequest {

    private String runId;

    /** info, warning, error or critical; anything else is recorded as warning. */
    private String severity;

    @NotBlank(message = "description is required")
    private String description;

    private String logExcerptPath;
    private String correlationId;
}
