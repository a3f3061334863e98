/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a manual purge call. {@code message} is only present when {@code success} is false.
 *
 * @param success
 *            whether the bucket or alert was removed
 * @param message
 *            human-readable reason on failure (e.g. "Place not found")
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PurgeResultType(@JsonProperty("success") boolean success, @JsonProperty("message") String message) {
}
