package com.riskgate.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class LeaseSummaryResponse {

    private final String kind;
    private final int active;

    /** Configured cap for the kind; null when uncapped. */
    private final Integer max;

    /** File names of the live leases, sorted by name. */
    private final List<String> leases;
}
