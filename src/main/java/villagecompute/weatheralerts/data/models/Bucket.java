/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.models;

import java.util.Map;

import villagecompute.weatheralerts.api.types.BoundsType;

/**
 * Snapshot of one aggregation bucket keyed by {@code (phenomenon, bucketId)}.
 *
 * @param phenomenon
 *            phenomenon path segment
 * @param bucketId
 *            derived place identifier
 * @param bounds
 *            bounding box set at creation (null only if the bucket was written without one)
 * @param members
 *            live records keyed by record id
 * @param counter
 *            stored live-member counter, equal to {@code members.size()} when no operation is in flight
 */
public record Bucket(String phenomenon, String bucketId, BoundsType bounds, Map<String, AlertRecord> members,
        long counter) {

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
