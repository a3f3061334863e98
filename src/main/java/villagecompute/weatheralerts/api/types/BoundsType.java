/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rectangular geographic extent of a geocoded place.
 *
 * <p>
 * Stored verbatim under {@code aggregation/<phenomenon>/<bucketId>/bounds} when a bucket is created and never modified
 * afterwards.
 *
 * @param northeast
 *            north-east corner
 * @param southwest
 *            south-west corner
 */
public record BoundsType(@JsonProperty("northeast") LatLngType northeast,
        @JsonProperty("southwest") LatLngType southwest) {
}
