/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import java.util.Map;

/**
 * Contract for async job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped}. The
 * {@link villagecompute.weatheralerts.services.DelayedJobService} discovers handlers at startup and routes jobs based
 * on their {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Failed jobs are retried up to {@code alerts.jobs.max-attempts} times</li>
 * <li>OpenTelemetry spans wrap handler execution</li>
 * <li>Handlers may run concurrently with each other; all shared state lives in the hierarchical store</li>
 * </ul>
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * <p>
     * <b>Error Handling:</b> Thrown exceptions trigger a retry until the attempt budget is exhausted. Handlers that
     * deliberately drop bad input must return normally.
     *
     * @param jobId
     *            job identifier assigned at enqueue time
     * @param payload
     *            job parameters
     * @throws Exception
     *             any error during execution; triggers retry logic
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
