/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

/**
 * Job types known to the queue, each pinned to one {@link JobQueue} and served by one {@link JobHandler}.
 */
public enum JobType {

    /**
     * Re-dispatches uploads stuck in {@code PROCESSING} past {@code catalog.uploads.stale-after}. Enqueued every
     * {@code catalog.jobs.sweep-interval} by {@link PendingUploadSweepScheduler}; empty payload.
     */
    PENDING_UPLOAD_SWEEP(JobQueue.DEFAULT),

    /**
     * Assembles, verifies and renders one upload. Enqueued when the last chunk arrives; payload {@code uploadId}.
     */
    UPLOAD_VARIANT_PROCESSING(JobQueue.BULK);

    private final JobQueue queue;

    JobType(JobQueue queue) {
        this.queue = queue;
    }

    public JobQueue getQueue() {
        return queue;
    }
}
