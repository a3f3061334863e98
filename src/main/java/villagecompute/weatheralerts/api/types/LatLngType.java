/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

/**
 * A corner of a geocoder bounding box, in the geocoder's own {@code lat}/{@code lng} field naming.
 *
 * @param lat
 *            latitude in decimal degrees
 * @param lng
 *            longitude in decimal degrees
 */
public record LatLngType(double lat, double lng) {
}
