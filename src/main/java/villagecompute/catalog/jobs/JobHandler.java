/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

import java.util.Map;

/**
 * Work unit executed by {@link villagecompute.catalog.services.DelayedJobService} for one {@link JobType}.
 *
 * <p>
 * Implementations are {@code @ApplicationScoped} beans; exactly one bean may claim a given type. They run on the
 * {@link DelayedJobWorker} scheduler threads inside a {@code job.execute} span, and a payload can be delivered more
 * than once (worker crash, stale lock release, retry), so the same payload must be safe to run again.
 *
 * <p>
 * Throwing from {@link #execute(Long, Map)} reschedules the job with backoff until its attempts run out. Outcomes the
 * handler has already recorded elsewhere (an upload marked failed, for instance) should return normally instead.
 */
public interface JobHandler {

    /**
     * Job type routed to this handler.
     */
    JobType handlesType();

    /**
     * Runs one delivery of a job.
     *
     * @param jobId
     *            {@code delayed_jobs.id}, for logging
     * @param payload
     *            JSON payload as stored on the job row
     * @throws Exception
     *             to request a retry
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
