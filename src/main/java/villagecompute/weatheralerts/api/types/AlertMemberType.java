/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Single live alert inside a bucket detail response.
 */
public record AlertMemberType(@JsonProperty("alert_id") String alertId, @JsonProperty("location") LocationType location,
        @JsonProperty("timestamp") Long timestamp, @JsonProperty("time") String time,
        @JsonProperty("critical_level") JsonNode criticalLevel, @JsonProperty("message") String message,
        @JsonProperty("image_url") String imageUrl) {
}
