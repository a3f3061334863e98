/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Point where a citizen reported a weather hazard.
 *
 * <p>
 * Both coordinates are boxed so that a missing one stays null instead of reading as 0.0.
 *
 * @param latitude
 *            latitude coordinate
 * @param longitude
 *            longitude coordinate
 */
public record LocationType(@NotNull @Min(-90) @Max(90) Double latitude,
        @NotNull @Min(-180) @Max(180) Double longitude) {
}
