/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregation bucket with its live members.
 */
public record BucketDetailType(@JsonProperty("phenomenon") String phenomenon,
        @JsonProperty("bucket_id") String bucketId, @JsonProperty("bounds") BoundsType bounds,
        @JsonProperty("alert_count") long alertCount, @JsonProperty("alerts") List<AlertMemberType> alerts) {
}
