/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.catalog.data.models.DelayedJob;
import villagecompute.catalog.data.models.Upload;
import villagecompute.catalog.services.DelayedJobService;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-dispatches uploads that have been in {@code PROCESSING} longer than {@code catalog.uploads.stale-after} without a
 * pending or running processing job.
 *
 * <p>
 * Recovers from lost dispatches (e.g. a processing job that exhausted its retries on lock timeouts). Re-dispatch is
 * safe because processing is idempotent per upload.
 */
@ApplicationScoped
public class PendingUploadSweepJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(PendingUploadSweepJobHandler.class);

    static final int SWEEP_BATCH_SIZE = 100;

    @Inject
    DelayedJobService jobService;

    @ConfigProperty(
            name = "catalog.uploads.stale-after",
            defaultValue = "PT10M")
    Duration staleAfter;

    @Override
    public JobType handlesType() {
        return JobType.PENDING_UPLOAD_SWEEP;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        int redispatched = QuarkusTransaction.requiringNew().call(this::redispatchStaleUploads);
        LOG.infof("Pending upload sweep (job %d) re-dispatched %d uploads", jobId, redispatched);
    }

    int redispatchStaleUploads() {
        Instant threshold = Instant.now().minus(staleAfter);
        List<Upload> stale = Upload.findProcessing(threshold, SWEEP_BATCH_SIZE);
        if (stale.isEmpty()) {
            return 0;
        }

        Set<Long> alreadyQueued = new HashSet<>();
        for (DelayedJob job : DelayedJob.findActiveByType(JobType.UPLOAD_VARIANT_PROCESSING)) {
            if (job.payload.get("uploadId") instanceof Number number) {
                alreadyQueued.add(number.longValue());
            }
        }

        int redispatched = 0;
        for (Upload upload : stale) {
            if (alreadyQueued.contains(upload.id)) {
                continue;
            }
            jobService.enqueue(JobType.UPLOAD_VARIANT_PROCESSING, Map.of("uploadId", upload.id));
            LOG.warnf("Upload %d stuck in processing since %s, re-dispatched", upload.id, upload.updatedAt);
            redispatched++;
        }
        return redispatched;
    }
}
