/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.integration.geocoding;

import villagecompute.weatheralerts.api.types.BoundsType;

/**
 * Reverse-geocoding answer: an approximate place name and the bounding box the geocoder associates with it.
 *
 * @param placeName
 *            neighbourhood or locality name
 * @param bounds
 *            place bounds, or the result viewport when the geocoder returns no bounds
 */
public record GeocodeResult(String placeName, BoundsType bounds) {
}
