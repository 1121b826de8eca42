/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.catalog.services.DelayedJobService;

import java.util.Map;

/**
 * Scheduler for the periodic pending upload sweep.
 *
 * <p>
 * <b>Schedule:</b> every {@code catalog.jobs.sweep-interval} (default 10 minutes)
 *
 * <p>
 * <b>Queue:</b> DEFAULT
 *
 * <p>
 * <b>Job Payload:</b> Empty map (no parameters required)
 *
 * @see PendingUploadSweepJobHandler
 * @see JobType#PENDING_UPLOAD_SWEEP
 */
@ApplicationScoped
public class PendingUploadSweepScheduler {

    private static final Logger LOG = Logger.getLogger(PendingUploadSweepScheduler.class);

    @Inject
    DelayedJobService jobService;

    @Scheduled(
            every = "${catalog.jobs.sweep-interval:10m}",
            delayed = "1m")
    void schedulePendingUploadSweep() {
        jobService.enqueue(JobType.PENDING_UPLOAD_SWEEP, Map.of());
        LOG.info("Scheduled pending upload sweep job");
    }
}
