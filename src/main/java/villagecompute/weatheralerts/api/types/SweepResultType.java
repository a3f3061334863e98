/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one retention sweep, returned by the operational cleanup endpoint.
 */
public record SweepResultType(@JsonProperty("swept_at") long sweptAt,
        @JsonProperty("buckets_scanned") int bucketsScanned, @JsonProperty("alerts_deleted") int alertsDeleted,
        @JsonProperty("buckets_removed") int bucketsRemoved, @JsonProperty("failures") int failures) {
}
