/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.jobs.JobHandler;
import villagecompute.weatheralerts.jobs.JobQueue;
import villagecompute.weatheralerts.jobs.JobType;
import villagecompute.weatheralerts.observability.LoggingConfig;

/**
 * Central orchestrator for async job processing.
 *
 * <p>
 * Jobs are dispatched to the {@link JobHandler} registered for their {@link JobType} on the enqueuing thread. A failed
 * attempt is retried until {@code alerts.jobs.max-attempts} is reached; the last failure is logged with job context and
 * the job is abandoned. Handlers are expected to be idempotent, so a retry after a partial failure is safe.
 *
 * <p>
 * <b>Retry Strategy:</b> attempts are separated by exponential backoff with jitter:
 * {@code delay = (2^(attempt-1)) * base_delay_millis * (1.0 ± 0.25)}, capped at {@code max_delay_millis}. The job runs
 * on the caller's thread, so the delays are kept short.
 *
 * <p>
 * <b>Configuration:</b>
 * <ul>
 * <li>{@code alerts.jobs.max-attempts} - attempts per job before giving up (default 3)</li>
 * <li>{@code alerts.jobs.base-delay-millis} - first retry delay (default 200)</li>
 * <li>{@code alerts.jobs.max-delay-millis} - upper bound for any retry delay (default 2000)</li>
 * </ul>
 *
 * @see JobHandler for handler contract
 * @see JobQueue for queue family descriptions
 * @see JobType for job-to-queue mappings
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    /**
     * Registry mapping JobType to JobHandler, built at startup from CDI beans.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    private final AtomicLong nextJobId = new AtomicLong(1);

    private final Tracer tracer;

    private final int maxAttempts;

    private final long baseDelayMillis;

    private final long maxDelayMillis;

    @Inject
    public DelayedJobService(Instance<JobHandler> handlers, Tracer tracer, @ConfigProperty(
            name = "alerts.jobs.max-attempts",
            defaultValue = "3") int maxAttempts, @ConfigProperty(
                    name = "alerts.jobs.base-delay-millis",
                    defaultValue = "200") long baseDelayMillis, @ConfigProperty(
                            name = "alerts.jobs.max-delay-millis",
                            defaultValue = "2000") long maxDelayMillis) {
        this((Iterable<JobHandler>) handlers, tracer, maxAttempts, baseDelayMillis, maxDelayMillis);
    }

    DelayedJobService(Iterable<JobHandler> handlers, Tracer tracer, int maxAttempts, long baseDelayMillis,
            long maxDelayMillis) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        this.tracer = tracer;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMillis = Math.max(0, baseDelayMillis);
        this.maxDelayMillis = Math.max(this.baseDelayMillis, maxDelayMillis);
        LOG.infof("Initialized DelayedJobService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds a type to handler map.
     *
     * @throws IllegalStateException
     *             if duplicate handlers register for the same JobType
     */
    private static Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s (queue: %s)", handler.getClass().getSimpleName(), type,
                    type.getQueue());
        }
        return registry;
    }

    /**
     * Enqueues a job and runs it, retrying failed attempts.
     *
     * @param jobType
     *            the type of job to enqueue
     * @param payload
     *            job parameters
     * @return the assigned job id
     * @throws IllegalStateException
     *             if no handler is registered for {@code jobType}
     */
    public long enqueue(JobType jobType, Map<String, Object> payload) {
        if (!handlerRegistry.containsKey(jobType)) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }
        long jobId = nextJobId.getAndIncrement();
        LOG.debugf("Enqueued JobType.%s as job %d on queue %s", jobType, jobId, jobType.getQueue());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (executeJob(jobType, jobId, payload, attempt)) {
                return jobId;
            }
            if (attempt == maxAttempts || !awaitRetry(jobId, attempt)) {
                break;
            }
        }
        LOG.errorf("Job %d (type: %s) abandoned after %d attempts", jobId, jobType, maxAttempts);
        return jobId;
    }

    /**
     * Executes a single attempt of a job by dispatching to its registered handler, inside an OpenTelemetry span and
     * with MDC job context.
     *
     * @param jobType
     *            the type of job to execute
     * @param jobId
     *            job identifier
     * @param payload
     *            job parameters
     * @param attempt
     *            current attempt number (1-indexed)
     * @return true if the handler completed without throwing
     * @throws IllegalStateException
     *             if no handler registered for jobType
     */
    public boolean executeJob(JobType jobType, Long jobId, Map<String, Object> payload, int attempt) {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name()).setAttribute("job.queue", jobType.getQueue().name())
                .setAttribute("job.attempt", attempt).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);
            LoggingConfig.setRequestOrigin("JobType." + jobType.name());

            handler.execute(jobId, payload);
            span.addEvent("job.completed");
            LOG.debugf("Job %d (type: %s) completed successfully on attempt %d", (Object) jobId, jobType, attempt);
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            LOG.warnf(e, "Job %d (type: %s) interrupted during execution", jobId, jobType);
            return false;

        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            LOG.errorf(e, "Job %d (type: %s) failed on attempt %d of %d", jobId, jobType, attempt, maxAttempts);
            return false;

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Calculates the delay before the retry that follows {@code attempt}, using exponential backoff with jitter.
     *
     * <p>
     * <b>Formula:</b> {@code delay = min((2^(attempt-1)) * base_delay_millis * (1.0 ± 0.25), max_delay_millis)}
     *
     * @param attempt
     *            attempt that just failed (1-indexed)
     * @return delay in milliseconds
     */
    public long calculateBackoffDelay(int attempt) {
        double baseDelay = Math.pow(2, attempt - 1) * baseDelayMillis;
        double jitter = 0.75 + (Math.random() * 0.5); // Random multiplier in [0.75, 1.25]
        return Math.min((long) (baseDelay * jitter), maxDelayMillis);
    }

    /**
     * Sleeps for the backoff delay of {@code attempt}.
     *
     * @return false if the thread was interrupted and no further attempt should be made
     */
    private boolean awaitRetry(long jobId, int attempt) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        long delay = calculateBackoffDelay(attempt);
        if (delay <= 0) {
            return true;
        }
        LOG.debugf("Retrying job %d in %d ms", jobId, delay);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Job %d retry wait interrupted, giving up", jobId);
            return false;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
