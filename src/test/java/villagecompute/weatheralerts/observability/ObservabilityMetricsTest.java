/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Unit tests for {@link ObservabilityMetrics}.
 */
class ObservabilityMetricsTest {

    private SimpleMeterRegistry registry;
    private ObservabilityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ObservabilityMetrics(registry);
    }

    @Test
    void testRecordIngestion_tagsByOutcome() {
        metrics.recordIngestion("AGGREGATED");
        metrics.recordIngestion("AGGREGATED");
        metrics.recordIngestion("DUPLICATE");

        assertEquals(2.0,
                registry.get("weatheralerts_ingestion_total").tag("outcome", "aggregated").counter().count());
        assertEquals(1.0,
                registry.get("weatheralerts_ingestion_total").tag("outcome", "duplicate").counter().count());
    }

    @Test
    void testRecordSweep_updatesGaugesAndTotals() {
        metrics.recordSweep(1741946400L, 5, 1, TimeUnit.MILLISECONDS.toNanos(40));
        metrics.recordSweep(1741950000L, 2, 0, TimeUnit.MILLISECONDS.toNanos(10));

        assertEquals(1741950000.0, registry.get("weatheralerts_sweep_last_run_epoch_seconds").gauge().value());
        assertEquals(2.0, registry.get("weatheralerts_sweep_last_evicted").gauge().value());
        assertEquals(7.0, registry.get("weatheralerts_sweep_evicted_total").counter().count());
        assertEquals(1.0, registry.get("weatheralerts_sweep_failures_total").counter().count());
        assertEquals(2, registry.get("weatheralerts_sweep_duration").timer().count());
        assertEquals(1741950000L, metrics.getLastSweepEpochSeconds());
    }

    @Test
    void testRecordPurge_tagsByTargetAndStatus() {
        metrics.recordPurge("member", "NOT_FOUND");

        assertEquals(1.0, registry.get("weatheralerts_purge_total").tag("target", "member")
                .tag("status", "not_found").counter().count());
    }
}
