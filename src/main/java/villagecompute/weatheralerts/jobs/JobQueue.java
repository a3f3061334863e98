/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

/**
 * Queue families for async job processing.
 *
 * @see JobType for job-to-queue assignments
 * @see villagecompute.weatheralerts.services.DelayedJobService for dispatcher implementation
 */
public enum JobQueue {

    /**
     * DEFAULT queue - periodic maintenance.
     * <p>
     * Handles: retention sweeps.
     */
    DEFAULT(5, "Standard priority for periodic maintenance tasks"),

    /**
     * HIGH queue - time-sensitive work triggered by user submissions.
     * <p>
     * Handles: alert aggregation.
     */
    HIGH(0, "High priority for time-sensitive operations");

    private final int priority;
    private final String description;

    JobQueue(int priority, String description) {
        this.priority = priority;
        this.description = description;
    }

    /**
     * Returns the execution priority (lower values = higher priority).
     */
    public int getPriority() {
        return priority;
    }

    /**
     * Returns a human-readable description of the queue's purpose.
     */
    public String getDescription() {
        return description;
    }
}
