/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import java.util.Map;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.services.DelayedJobService;

/**
 * Scheduler for retention sweep jobs.
 *
 * <p>
 * Enqueues a {@link JobType#RETENTION_SWEEP} job every {@code alerts.sweep.every} (default 1h). Overlapping ticks are
 * skipped while a sweep is still running.
 *
 * @see RetentionSweepJobHandler
 */
@ApplicationScoped
public class RetentionSweepScheduler {

    private static final Logger LOG = Logger.getLogger(RetentionSweepScheduler.class);

    @Inject
    DelayedJobService jobService;

    @Scheduled(
            identity = "retention-sweep",
            every = "${alerts.sweep.every:1h}",
            delayed = "${alerts.sweep.initial-delay:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleRetentionSweep() {
        LOG.info("Enqueuing retention sweep job");
        jobService.enqueue(JobType.RETENTION_SWEEP, Map.of());
    }
}
