/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.catalog.services.DelayedJobService;

/**
 * Polls the job queues and executes ready jobs off the request threads.
 *
 * <p>
 * <b>Schedule:</b> every {@code catalog.jobs.poll-interval} (default 5s), skipping a tick while the previous poll of
 * the same queue is still running.
 *
 * <p>
 * <b>Batch size:</b> {@code catalog.jobs.poll-batch-size} jobs per queue per tick.
 */
@ApplicationScoped
public class DelayedJobWorker {

    private static final Logger LOG = Logger.getLogger(DelayedJobWorker.class);

    @Inject
    DelayedJobService jobService;

    @ConfigProperty(
            name = "catalog.jobs.poll-batch-size",
            defaultValue = "10")
    int pollBatchSize;

    @Scheduled(
            every = "${catalog.jobs.poll-interval:5s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollBulkQueue() {
        poll(JobQueue.BULK);
    }

    @Scheduled(
            every = "${catalog.jobs.poll-interval:5s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollDefaultQueue() {
        poll(JobQueue.DEFAULT);
    }

    private void poll(JobQueue queue) {
        int processed = jobService.processQueue(queue, pollBatchSize);
        if (processed > 0) {
            LOG.debugf("Worker %s ran %d jobs from queue %s", jobService.getWorkerId(), processed, queue);
        }
    }
}
