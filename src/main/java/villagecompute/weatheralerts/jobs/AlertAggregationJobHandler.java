/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertFormType;
import villagecompute.weatheralerts.exceptions.ValidationException;
import villagecompute.weatheralerts.services.AlertFormService;
import villagecompute.weatheralerts.services.AlertIngestionService;
import villagecompute.weatheralerts.services.AlertIngestionService.IngestionResult;

/**
 * Job handler that aggregates one stored alert form.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "uid": "user-17",      // submitting user
 *   "form_id": "-Nx81..."  // form id, also the alert record id
 * }
 * </pre>
 *
 * <p>
 * A form that no longer exists, or a malformed payload, is logged and dropped. Store outages propagate so the job is
 * retried; redelivery is safe because ingestion is idempotent per form id.
 */
@ApplicationScoped
public class AlertAggregationJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(AlertAggregationJobHandler.class);

    public static final String PAYLOAD_UID = "uid";
    public static final String PAYLOAD_FORM_ID = "form_id";

    @Inject
    AlertFormService alertFormService;

    @Inject
    AlertIngestionService ingestionService;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.ALERT_AGGREGATION;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        Object uid = payload.get(PAYLOAD_UID);
        Object formId = payload.get(PAYLOAD_FORM_ID);
        if (uid == null || formId == null) {
            LOG.warnf("Alert aggregation job %d has incomplete payload %s, dropping", jobId, payload);
            return;
        }

        Span span = tracer.spanBuilder("job.alert_aggregation").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.ALERT_AGGREGATION.name())
                .setAttribute("alert.id", formId.toString()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            Optional<AlertFormType> form;
            try {
                form = alertFormService.find(uid.toString(), formId.toString());
            } catch (ValidationException e) {
                LOG.warnf("Alert aggregation job %d: %s, dropping", jobId, e.getMessage());
                return;
            }
            if (form.isEmpty()) {
                LOG.warnf("Alert form %s/%s no longer exists, nothing to aggregate", uid, formId);
                span.setAttribute("outcome", "MISSING_FORM");
                return;
            }

            IngestionResult result = ingestionService.ingest(formId.toString(), form.get());
            span.setAttribute("outcome", result.outcome().name());
            if (result.bucketId() != null) {
                span.setAttribute("bucket.id", result.bucketId());
            }
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
