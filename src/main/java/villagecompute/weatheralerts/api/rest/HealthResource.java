/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.store.HierarchicalStore;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.observability.ObservabilityMetrics;

/**
 * Liveness check that also probes the hierarchical store.
 */
@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @Inject
    HierarchicalStore store;

    @Inject
    AggregationConfig config;

    @Inject
    ObservabilityMetrics metrics;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Reports whether the aggregation store is reachable and when the last sweep ran")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Service is healthy",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Store unreachable")})
    public Response health() {
        long lastSweep = metrics.getLastSweepEpochSeconds();
        try {
            store.exists(config.membersRoot());
        } catch (StoreUnavailableException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new HealthResponse("DOWN", e.getMessage(), lastSweep)).build();
        }
        return Response.ok(new HealthResponse("UP", "Weather alerts aggregation is running", lastSweep)).build();
    }

    public record HealthResponse(String status, String message,
            @JsonProperty("last_sweep_epoch_seconds") long lastSweepEpochSeconds) {
    }
}
