/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.types.AlertMemberType;
import villagecompute.weatheralerts.api.types.BucketDetailType;
import villagecompute.weatheralerts.api.types.BucketSummaryType;
import villagecompute.weatheralerts.api.types.SweepResultType;
import villagecompute.weatheralerts.data.models.AlertRecord;
import villagecompute.weatheralerts.data.models.Bucket;
import villagecompute.weatheralerts.data.models.CriticalWeatherPhenomenon;
import villagecompute.weatheralerts.data.store.StorePaths;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.services.AggregationStore;
import villagecompute.weatheralerts.services.RetentionSweepService;

/**
 * Read and maintenance endpoints for aggregation buckets.
 *
 * <ul>
 * <li>{@code GET /api/aggregation} - list buckets, optionally filtered by {@code ?phenomenon=}</li>
 * <li>{@code GET /api/aggregation/{phenomenon}/{bucketId}} - one bucket with its live members</li>
 * <li>{@code POST /api/aggregation/cleanup} - run a retention sweep now; any other method is rejected with 405</li>
 * </ul>
 */
@Path("/api/aggregation")
@Tag(
        name = "Aggregation",
        description = "Hazard buckets and retention")
@Produces(MediaType.APPLICATION_JSON)
public class AggregationResource {

    private static final Logger LOG = Logger.getLogger(AggregationResource.class);

    @Inject
    AggregationStore aggregationStore;

    @Inject
    RetentionSweepService sweepService;

    @GET
    @Operation(
            summary = "List buckets")
    public Response list(@QueryParam("phenomenon") String phenomenon) {
        Optional<String> filter = Optional.empty();
        if (phenomenon != null && !phenomenon.isBlank()) {
            Optional<CriticalWeatherPhenomenon> resolved = CriticalWeatherPhenomenon.fromValue(phenomenon);
            if (resolved.isEmpty()) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ErrorResponse("Unknown phenomenon: " + phenomenon)).build();
            }
            filter = resolved.map(Enum::name);
        }

        try {
            Optional<String> wanted = filter;
            List<BucketSummaryType> buckets = aggregationStore.listBuckets().stream()
                    .filter(b -> wanted.isEmpty() || wanted.get().equals(b.phenomenon()))
                    .sorted(Comparator.comparing(Bucket::phenomenon).thenComparing(Bucket::bucketId))
                    .map(b -> new BucketSummaryType(b.phenomenon(), b.bucketId(), b.bounds(), b.counter())).toList();
            return Response.ok(buckets).build();
        } catch (StoreUnavailableException e) {
            return unavailable(e);
        }
    }

    @GET
    @Path("/{phenomenon}/{bucketId}")
    @Operation(
            summary = "Get bucket",
            description = "Returns one bucket including its live members")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Bucket found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = BucketDetailType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "No such bucket")})
    public Response get(@PathParam("phenomenon") String phenomenon, @PathParam("bucketId") String bucketId) {
        Optional<CriticalWeatherPhenomenon> resolved = CriticalWeatherPhenomenon.fromValue(phenomenon);
        if (resolved.isEmpty() || !StorePaths.isValidSegment(bucketId)) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse("Bucket not found")).build();
        }

        try {
            Optional<Bucket> bucket = aggregationStore.getBucket(resolved.get().name(), bucketId);
            if (bucket.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse("Bucket not found"))
                        .build();
            }
            return Response.ok(toDetail(bucket.get())).build();
        } catch (StoreUnavailableException e) {
            return unavailable(e);
        }
    }

    @POST
    @Path("/cleanup")
    @Operation(
            summary = "Run retention sweep",
            description = "Evicts alerts older than the retention window and removes emptied buckets")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Sweep completed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SweepResultType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Store unavailable")})
    public Response cleanup() {
        try {
            return Response.ok(sweepService.sweep()).build();
        } catch (StoreUnavailableException e) {
            return unavailable(e);
        }
    }

    private BucketDetailType toDetail(Bucket bucket) {
        List<AlertMemberType> alerts = bucket.members().values().stream()
                .sorted(Comparator.comparing(AlertRecord::timestamp, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(r -> new AlertMemberType(r.id(), r.location(), r.timestamp(), r.time(), r.criticalLevel(),
                        r.message(), r.imageUrl()))
                .toList();
        return new BucketDetailType(bucket.phenomenon(), bucket.bucketId(), bucket.bounds(), bucket.counter(), alerts);
    }

    private Response unavailable(StoreUnavailableException e) {
        LOG.errorf(e, "Aggregation store unavailable");
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ErrorResponse("Store unavailable, retry later")).build();
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
