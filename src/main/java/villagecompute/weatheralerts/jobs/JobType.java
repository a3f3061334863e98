/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

/**
 * Async job types with their queue assignments.
 *
 * <p>
 * Each job type maps to exactly one {@link JobQueue} family. Handler implementations register themselves with the
 * corresponding job type for CDI discovery.
 *
 * @see JobQueue for queue family descriptions
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Assigns a newly submitted alert form to its aggregation bucket.
     * <p>
     * <b>Trigger:</b> every alert form write
     * <p>
     * <b>Handler:</b> AlertAggregationJobHandler
     */
    ALERT_AGGREGATION(JobQueue.HIGH, "Alert aggregation (per submission)"),

    /**
     * Evicts bucket members older than the retention window.
     * <p>
     * <b>Cadence:</b> Every 1 hour, or on demand via {@code POST /api/aggregation/cleanup}
     * <p>
     * <b>Handler:</b> RetentionSweepJobHandler
     */
    RETENTION_SWEEP(JobQueue.DEFAULT, "Retention sweep (hourly)");

    private final JobQueue queue;
    private final String description;

    JobType(JobQueue queue, String description) {
        this.queue = queue;
        this.description = description;
    }

    public JobQueue getQueue() {
        return queue;
    }

    public String getDescription() {
        return description;
    }
}
