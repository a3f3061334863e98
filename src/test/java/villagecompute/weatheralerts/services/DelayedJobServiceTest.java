/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.jobs.JobHandler;
import villagecompute.weatheralerts.jobs.JobType;

/**
 * Unit tests for {@link DelayedJobService}.
 */
class DelayedJobServiceTest {

    private final Tracer tracer = TracerProvider.noop().get("test");

    @Test
    void testEnqueue_dispatchesToHandler() {
        CountingHandler handler = new CountingHandler(JobType.RETENTION_SWEEP, 0);
        DelayedJobService service = new DelayedJobService(List.of(handler), tracer, 3, 0, 0);

        long first = service.enqueue(JobType.RETENTION_SWEEP, Map.of("k", "v"));
        long second = service.enqueue(JobType.RETENTION_SWEEP, Map.of());

        assertEquals(2, handler.calls.get());
        assertTrue(second > first);
        assertEquals("v", handler.lastPayload.get("k"));
    }

    @Test
    void testEnqueue_retriesUntilSuccess() {
        CountingHandler handler = new CountingHandler(JobType.ALERT_AGGREGATION, 2);
        DelayedJobService service = new DelayedJobService(List.of(handler), tracer, 3, 0, 0);

        service.enqueue(JobType.ALERT_AGGREGATION, Map.of());

        assertEquals(3, handler.calls.get());
    }

    @Test
    void testEnqueue_givesUpAfterMaxAttempts() {
        CountingHandler handler = new CountingHandler(JobType.ALERT_AGGREGATION, 10);
        DelayedJobService service = new DelayedJobService(List.of(handler), tracer, 3, 0, 0);

        service.enqueue(JobType.ALERT_AGGREGATION, Map.of());

        assertEquals(3, handler.calls.get());
    }

    @Test
    void testExecuteJob_reportsFailure() {
        DelayedJobService service = new DelayedJobService(
                List.of(new CountingHandler(JobType.RETENTION_SWEEP, 1)), tracer, 1, 0, 0);

        assertFalse(service.executeJob(JobType.RETENTION_SWEEP, 1L, Map.of(), 1));
        assertTrue(service.executeJob(JobType.RETENTION_SWEEP, 1L, Map.of(), 2));
    }

    @Test
    void testEnqueue_waitsBetweenAttempts() {
        CountingHandler handler = new CountingHandler(JobType.ALERT_AGGREGATION, 2);
        DelayedJobService service = new DelayedJobService(List.of(handler), tracer, 3, 40, 40);

        long started = System.nanoTime();
        service.enqueue(JobType.ALERT_AGGREGATION, Map.of());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(3, handler.calls.get());
        assertTrue(elapsedMillis >= 60, "expected two backoff waits, took " + elapsedMillis + " ms");
    }

    @Test
    void testCalculateBackoffDelay_growsAndIsCapped() {
        DelayedJobService service = new DelayedJobService(List.of(), tracer, 5, 100, 1000);

        for (int i = 0; i < 20; i++) {
            long first = service.calculateBackoffDelay(1);
            long third = service.calculateBackoffDelay(3);
            assertTrue(first >= 75 && first <= 125, "attempt 1 delay " + first);
            assertTrue(third >= 300 && third <= 500, "attempt 3 delay " + third);
            assertEquals(1000, service.calculateBackoffDelay(10));
        }
    }

    @Test
    void testEnqueue_unknownTypeRejected() {
        DelayedJobService service = new DelayedJobService(List.of(), tracer, 3, 0, 0);

        assertThrows(IllegalStateException.class, () -> service.enqueue(JobType.RETENTION_SWEEP, Map.of()));
    }

    @Test
    void testDuplicateHandlersRejected() {
        assertThrows(IllegalStateException.class,
                () -> new DelayedJobService(List.of(new CountingHandler(JobType.RETENTION_SWEEP, 0),
                        new CountingHandler(JobType.RETENTION_SWEEP, 0)), tracer, 3, 0, 0));
    }

    private static final class CountingHandler implements JobHandler {

        private final JobType type;
        private final int failuresBeforeSuccess;
        final AtomicInteger calls = new AtomicInteger();
        Map<String, Object> lastPayload;

        CountingHandler(JobType type, int failuresBeforeSuccess) {
            this.type = type;
            this.failuresBeforeSuccess = failuresBeforeSuccess;
        }

        @Override
        public JobType handlesType() {
            return type;
        }

        @Override
        public void execute(Long jobId, Map<String, Object> payload) {
            lastPayload = payload;
            if (calls.incrementAndGet() <= failuresBeforeSuccess) {
                throw new StoreUnavailableException("Timed out");
            }
        }
    }
}
