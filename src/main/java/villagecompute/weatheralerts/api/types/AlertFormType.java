/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

/**
 * Citizen-submitted alert form as written by the mobile app under {@code alertForms/<uid>/<formId>}.
 *
 * <p>
 * Field names follow the stored document layout. {@code location} and {@code criticalWeatherPhenomenon} are
 * deliberately not bean-validated: a form missing either is still accepted and stored, then dropped by the aggregation
 * job with a logged reason.
 *
 * @param location
 *            reported position (nullable)
 * @param criticalWeatherPhenomenon
 *            hazard category name, e.g. {@code "FLOOD"} (nullable)
 * @param timestamp
 *            submission time in epoch millis (nullable, defaults to ingestion time)
 * @param criticalLevel
 *            opaque severity value, passed through unchanged
 * @param message
 *            free-text description
 * @param imageUrl
 *            URL of an uploaded photo
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertFormType(@JsonProperty("location") @Valid LocationType location,
        @JsonProperty("criticalWeatherPhenomenon") String criticalWeatherPhenomenon,
        @JsonProperty("timestamp") Long timestamp, @JsonProperty("criticalLevel") JsonNode criticalLevel,
        @JsonProperty("message") @Size(
                max = 2000,
                message = "Message must not exceed 2000 characters") String message,
        @JsonProperty("imageURL") String imageUrl) {
}
