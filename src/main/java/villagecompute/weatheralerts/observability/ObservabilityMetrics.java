/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.observability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Registers and records the custom metrics of the aggregation engine.
 *
 * <p>
 * All metrics follow the naming convention {@code weatheralerts_<category>_<metric>}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code weatheralerts_ingestion_total{outcome}} - Ingestion outcomes (aggregated, duplicate,
 * dropped_invalid, dropped_geocode_failed)</li>
 * <li><b>Counters:</b> {@code weatheralerts_sweep_evicted_total} - Members evicted by retention sweeps</li>
 * <li><b>Counters:</b> {@code weatheralerts_sweep_failures_total} - Per-member sweep failures</li>
 * <li><b>Gauges:</b> {@code weatheralerts_sweep_last_run_epoch_seconds} - Wall-clock time of the last completed
 * sweep</li>
 * <li><b>Gauges:</b> {@code weatheralerts_sweep_last_evicted} - Members evicted by the last completed sweep</li>
 * <li><b>Timers:</b> {@code weatheralerts_sweep_duration} - Sweep execution time</li>
 * <li><b>Counters:</b> {@code weatheralerts_purge_total{target,status}} - Manual purge outcomes</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    private final MeterRegistry registry;

    private final AtomicLong lastSweepEpochSeconds = new AtomicLong(0);
    private final AtomicLong lastSweepEvicted = new AtomicLong(0);

    /**
     * Outcome counters indexed by tag value.
     */
    private final Map<String, Counter> ingestionCounters = new ConcurrentHashMap<>();

    private final Map<String, Counter> purgeCounters = new ConcurrentHashMap<>();

    private final Counter sweepEvicted;
    private final Counter sweepFailures;
    private final Timer sweepDuration;

    @Inject
    public ObservabilityMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("weatheralerts_sweep_last_run_epoch_seconds", lastSweepEpochSeconds, AtomicLong::get)
                .description("Wall-clock time of the last completed retention sweep").register(registry);
        Gauge.builder("weatheralerts_sweep_last_evicted", lastSweepEvicted, AtomicLong::get)
                .description("Members evicted by the last completed retention sweep").register(registry);

        this.sweepEvicted = Counter.builder("weatheralerts_sweep_evicted_total")
                .description("Members evicted by retention sweeps").register(registry);
        this.sweepFailures = Counter.builder("weatheralerts_sweep_failures_total")
                .description("Members the retention sweep failed to evict").register(registry);
        this.sweepDuration = Timer.builder("weatheralerts_sweep_duration").description("Retention sweep duration")
                .register(registry);

        LOG.debug("Registered aggregation engine metrics");
    }

    /**
     * Counts one ingestion outcome.
     *
     * @param outcome
     *            outcome name, lower-cased into the tag value
     */
    public void recordIngestion(String outcome) {
        String tag = outcome.toLowerCase();
        ingestionCounters.computeIfAbsent(tag,
                t -> Counter.builder("weatheralerts_ingestion_total").description("Alert ingestion outcomes")
                        .tags(List.of(Tag.of("outcome", t))).register(registry))
                .increment();
    }

    /**
     * Records a completed sweep.
     *
     * @param sweptAtEpochSeconds
     *            sweep wall-clock time
     * @param evicted
     *            members removed
     * @param failures
     *            members that could not be removed
     * @param durationNanos
     *            elapsed time
     */
    public void recordSweep(long sweptAtEpochSeconds, long evicted, long failures, long durationNanos) {
        lastSweepEpochSeconds.set(sweptAtEpochSeconds);
        lastSweepEvicted.set(evicted);
        sweepEvicted.increment(evicted);
        sweepFailures.increment(failures);
        sweepDuration.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts one manual purge.
     *
     * @param target
     *            "bucket" or "member"
     * @param status
     *            purge status name
     */
    public void recordPurge(String target, String status) {
        String key = target + ":" + status.toLowerCase();
        purgeCounters.computeIfAbsent(key,
                k -> Counter.builder("weatheralerts_purge_total").description("Manual purge outcomes")
                        .tags(List.of(Tag.of("target", target), Tag.of("status", status.toLowerCase())))
                        .register(registry))
                .increment();
    }

    public long getLastSweepEpochSeconds() {
        return lastSweepEpochSeconds.get();
    }

    public long getLastSweepEvicted() {
        return lastSweepEvicted.get();
    }
}
