/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response returned once an alert form has been stored and its aggregation job dispatched.
 *
 * @param formId
 *            caller-assigned form identifier (also the aggregation record id)
 * @param jobId
 *            identifier of the dispatched aggregation job
 */
public record AlertFormAcceptedType(@JsonProperty("form_id") String formId, @JsonProperty("job_id") long jobId) {
}
