/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregation bucket as shown on the live hazard map: where, what, and how many.
 *
 * @param phenomenon
 *            hazard category
 * @param bucketId
 *            derived place identifier
 * @param bounds
 *            bounding box fixed at bucket creation
 * @param alertCount
 *            live member counter
 */
public record BucketSummaryType(@JsonProperty("phenomenon") String phenomenon,
        @JsonProperty("bucket_id") String bucketId, @JsonProperty("bounds") BoundsType bounds,
        @JsonProperty("alert_count") long alertCount) {
}
