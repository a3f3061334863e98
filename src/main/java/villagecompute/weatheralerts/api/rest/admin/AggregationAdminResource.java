/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest.admin;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.types.PurgeResultType;
import villagecompute.weatheralerts.services.ManualPurgeService;
import villagecompute.weatheralerts.services.ManualPurgeService.PurgeResult;

/**
 * Admin REST endpoints for manual removal of aggregated alerts.
 *
 * <ul>
 * <li>{@code DELETE /admin/api/aggregation/{phenomenon}/{bucketId}} - delete a bucket and its counter</li>
 * <li>{@code DELETE /admin/api/aggregation/{phenomenon}/{bucketId}/alerts/{alertId}} - delete one alert</li>
 * </ul>
 *
 * <p>
 * Responses carry {@code {"success": ..., "message": ...}}: 200 on success, 404 with the missing level ("Phenomenon
 * not found", "Place not found", "Alert not found"), 400 for malformed keys, 503 when the store is unreachable.
 *
 * <p>
 * <b>Security:</b> assumes deployment behind an authenticated admin gateway.
 */
@Path("/admin/api/aggregation")
@Tag(
        name = "Aggregation Admin",
        description = "Manual purge of buckets and alerts")
@Produces(MediaType.APPLICATION_JSON)
public class AggregationAdminResource {

    @Inject
    ManualPurgeService purgeService;

    @DELETE
    @Path("/{phenomenon}/{bucketId}")
    @Operation(
            summary = "Purge bucket")
    public Response purgeBucket(@PathParam("phenomenon") String phenomenon, @PathParam("bucketId") String bucketId) {
        return toResponse(purgeService.purgeBucket(phenomenon, bucketId));
    }

    @DELETE
    @Path("/{phenomenon}/{bucketId}/alerts/{alertId}")
    @Operation(
            summary = "Purge alert")
    public Response purgeAlert(@PathParam("phenomenon") String phenomenon, @PathParam("bucketId") String bucketId,
            @PathParam("alertId") String alertId) {
        return toResponse(purgeService.purgeMember(phenomenon, bucketId, alertId));
    }

    private static Response toResponse(PurgeResult result) {
        Response.Status status = switch (result.status()) {
            case PURGED -> Response.Status.OK;
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case INVALID -> Response.Status.BAD_REQUEST;
            case UNAVAILABLE -> Response.Status.SERVICE_UNAVAILABLE;
        };
        return Response.status(status).entity(new PurgeResultType(result.success(), result.message())).build();
    }
}
