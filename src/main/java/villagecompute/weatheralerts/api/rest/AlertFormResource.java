/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.types.AlertFormAcceptedType;
import villagecompute.weatheralerts.api.types.AlertFormType;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.exceptions.ValidationException;
import villagecompute.weatheralerts.jobs.AlertAggregationJobHandler;
import villagecompute.weatheralerts.jobs.JobType;
import villagecompute.weatheralerts.services.AlertFormService;
import villagecompute.weatheralerts.services.DelayedJobService;

/**
 * Alert form submission endpoints.
 *
 * <ul>
 * <li>{@code PUT /api/alert-forms/{uid}/{formId}} - store a form and enqueue its aggregation</li>
 * <li>{@code GET /api/alert-forms/{uid}/{formId}} - read a stored form back</li>
 * </ul>
 *
 * <p>
 * A stored form is accepted (202) even if aggregation drops it; the drop reason is logged by the aggregation job.
 * Re-submitting the same form id is idempotent for aggregation.
 *
 * <p>
 * <b>Processing is synchronous:</b> {@link DelayedJobService} runs the aggregation job on the request thread, so the
 * 202 is returned only after geocoding and the bucket update (including any retries and their backoff) have finished.
 * The status code reflects that the outcome is not reported in the response, not that work is still pending; the
 * result is visible through {@code GET /api/aggregation} as soon as the call returns.
 */
@Path("/api/alert-forms")
@Tag(
        name = "Alert Forms",
        description = "Citizen alert submission")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AlertFormResource {

    private static final Logger LOG = Logger.getLogger(AlertFormResource.class);

    @Inject
    AlertFormService alertFormService;

    @Inject
    DelayedJobService jobService;

    @PUT
    @Path("/{uid}/{formId}")
    @Operation(
            summary = "Submit alert form",
            description = "Stores the form and runs its aggregation job before responding")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Form stored, aggregation enqueued",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = AlertFormAcceptedType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Malformed form or key"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Store unavailable")})
    public Response submit(@PathParam("uid") String uid, @PathParam("formId") String formId,
            @Valid AlertFormType form) {
        if (form == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }

        try {
            alertFormService.store(uid, formId, form);
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (StoreUnavailableException e) {
            LOG.errorf(e, "Failed to store alert form %s/%s", uid, formId);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Store unavailable, retry later")).build();
        }

        long jobId = jobService.enqueue(JobType.ALERT_AGGREGATION,
                Map.of(AlertAggregationJobHandler.PAYLOAD_UID, uid, AlertAggregationJobHandler.PAYLOAD_FORM_ID,
                        formId));
        LOG.infof("Accepted alert form %s/%s (job %d)", uid, formId, jobId);
        return Response.status(Response.Status.ACCEPTED).entity(new AlertFormAcceptedType(formId, jobId)).build();
    }

    @GET
    @Path("/{uid}/{formId}")
    @Operation(
            summary = "Get alert form")
    public Response get(@PathParam("uid") String uid, @PathParam("formId") String formId) {
        try {
            Optional<AlertFormType> form = alertFormService.find(uid, formId);
            if (form.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse("Alert form not found"))
                        .build();
            }
            return Response.ok(form.get()).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (StoreUnavailableException e) {
            LOG.errorf(e, "Failed to read alert form %s/%s", uid, formId);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Store unavailable, retry later")).build();
        }
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
