/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import java.util.Map;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.SweepResultType;
import villagecompute.weatheralerts.services.RetentionSweepService;

/**
 * Job handler for the periodic retention sweep.
 *
 * <p>
 * Payload is ignored. Exports OpenTelemetry span attributes {@code buckets_scanned}, {@code alerts_deleted},
 * {@code buckets_removed} and {@code failures}.
 */
@ApplicationScoped
public class RetentionSweepJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(RetentionSweepJobHandler.class);

    @Inject
    RetentionSweepService sweepService;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.RETENTION_SWEEP;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        Span span = tracer.spanBuilder("job.retention_sweep").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.RETENTION_SWEEP.name()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LOG.infof("Starting retention sweep job %d", jobId);
            SweepResultType result = sweepService.sweep();
            span.setAttribute("buckets_scanned", result.bucketsScanned());
            span.setAttribute("alerts_deleted", result.alertsDeleted());
            span.setAttribute("buckets_removed", result.bucketsRemoved());
            span.setAttribute("failures", result.failures());
        } catch (RuntimeException e) {
            span.recordException(e);
            LOG.errorf(e, "Retention sweep job %d failed", jobId);
            throw e;
        } finally {
            span.end();
        }
    }
}
