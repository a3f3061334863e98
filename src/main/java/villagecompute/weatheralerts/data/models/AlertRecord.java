/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.models;

import com.fasterxml.jackson.databind.JsonNode;

import villagecompute.weatheralerts.api.types.LocationType;

/**
 * One citizen submission as held inside an aggregation bucket.
 *
 * <p>
 * All fields are fixed once the record is ingested. {@code timestamp} drives retention; {@code criticalLevel},
 * {@code message} and {@code imageUrl} are opaque payload passed through unchanged.
 *
 * @param id
 *            caller-assigned record identifier (the alert form id), unique within a bucket
 * @param phenomenon
 *            hazard category the record was aggregated under
 * @param location
 *            reported position
 * @param timestamp
 *            submission time in epoch millis; null only for legacy members written without one
 * @param time
 *            display time ("HH:mm") of {@code timestamp} in the configured display zone
 * @param criticalLevel
 *            opaque severity value
 * @param message
 *            free-text description
 * @param imageUrl
 *            uploaded photo URL
 */
public record AlertRecord(String id, String phenomenon, LocationType location, Long timestamp, String time,
        JsonNode criticalLevel, String message, String imageUrl) {

    /**
     * Returns whether this record is at least {@code windowMillis} old at {@code nowMillis}.
     *
     * <p>
     * Records without a timestamp never expire.
     */
    public boolean isExpired(long nowMillis, long windowMillis) {
        return timestamp != null && nowMillis - timestamp >= windowMillis;
    }
}
