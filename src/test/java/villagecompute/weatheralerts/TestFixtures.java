/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts;

import static villagecompute.weatheralerts.TestConstants.*;

import com.fasterxml.jackson.databind.node.IntNode;

import villagecompute.weatheralerts.api.types.AlertFormType;
import villagecompute.weatheralerts.api.types.BoundsType;
import villagecompute.weatheralerts.api.types.LatLngType;
import villagecompute.weatheralerts.api.types.LocationType;
import villagecompute.weatheralerts.data.models.AlertRecord;
import villagecompute.weatheralerts.integration.geocoding.GeocodeResult;

/**
 * Factory methods for test forms, records and geocoding results.
 *
 * <p>
 * All values default to {@link TestConstants}; parameterized variants override the fields a test cares about.
 */
public final class TestFixtures {

    /** Prevent instantiation. */
    private TestFixtures() {
    }

    // ========== BOUNDS & GEOCODING ==========

    public static BoundsType kolonakiBounds() {
        return new BoundsType(new LatLngType(KOLONAKI_NE_LAT, KOLONAKI_NE_LNG),
                new LatLngType(KOLONAKI_SW_LAT, KOLONAKI_SW_LNG));
    }

    public static BoundsType pagratiBounds() {
        return new BoundsType(new LatLngType(37.9702, 23.7561), new LatLngType(37.9614, 23.7397));
    }

    public static GeocodeResult kolonaki() {
        return new GeocodeResult(KOLONAKI, kolonakiBounds());
    }

    public static GeocodeResult pagrati() {
        return new GeocodeResult(PAGRATI, pagratiBounds());
    }

    // ========== FORMS ==========

    /**
     * Creates a FLOOD form in Kolonaki with the given timestamp.
     */
    public static AlertFormType floodForm(Long timestamp) {
        return form("FLOOD", new LocationType(KOLONAKI_LAT, KOLONAKI_LNG), timestamp);
    }

    public static AlertFormType form(String phenomenon, LocationType location, Long timestamp) {
        return new AlertFormType(location, phenomenon, timestamp, IntNode.valueOf(3), TEST_MESSAGE, TEST_IMAGE_URL);
    }

    // ========== RECORDS ==========

    /**
     * Creates a FLOOD record in Kolonaki.
     */
    public static AlertRecord floodRecord(String id, long timestamp) {
        return record(id, "FLOOD", timestamp);
    }

    public static AlertRecord record(String id, String phenomenon, long timestamp) {
        return new AlertRecord(id, phenomenon, new LocationType(KOLONAKI_LAT, KOLONAKI_LNG), timestamp, "12:00",
                IntNode.valueOf(3), TEST_MESSAGE, TEST_IMAGE_URL);
    }
}
