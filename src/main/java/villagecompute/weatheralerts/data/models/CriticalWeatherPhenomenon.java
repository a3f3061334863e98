/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Hazard categories citizens can report. The enum name is the phenomenon segment of every aggregation path.
 */
public enum CriticalWeatherPhenomenon {

    FLOOD("Flood"),

    FIRE("Wildfire"),

    STORM("Storm"),

    HAIL("Hail"),

    SNOWFALL("Heavy snowfall"),

    HEATWAVE("Heatwave"),

    TORNADO("Tornado"),

    FOG("Dense fog"),

    FROST("Frost");

    private final String displayName;

    CriticalWeatherPhenomenon(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a submitted phenomenon value, ignoring case and surrounding whitespace.
     *
     * @param value
     *            raw value from an alert form or purge request
     * @return the matching phenomenon, or empty for null, blank or unknown values
     */
    public static Optional<CriticalWeatherPhenomenon> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CriticalWeatherPhenomenon phenomenon : values()) {
            if (phenomenon.name().equals(normalized)) {
                return Optional.of(phenomenon);
            }
        }
        return Optional.empty();
    }
}
