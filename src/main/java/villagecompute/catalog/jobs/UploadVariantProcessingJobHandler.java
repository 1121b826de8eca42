/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.services.UploadProcessor;

import java.util.Map;
import java.util.Optional;

/**
 * Job handler for assembling an upload and generating its image variants.
 *
 * <p>
 * Payload: {@code uploadId} (number). Delegates to {@link UploadProcessor#process(Long)}, which is idempotent, so a
 * duplicate or retried job for the same upload is harmless.
 *
 * <p>
 * Integrity failures (missing chunk, checksum mismatch, undecodable image) end as a {@code failed} upload and a
 * successful job; they are not retried. Only infrastructure errors such as lock timeouts propagate and trigger the
 * job's backoff.
 */
@ApplicationScoped
public class UploadVariantProcessingJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(UploadVariantProcessingJobHandler.class);

    @Inject
    UploadProcessor uploadProcessor;

    @Override
    public JobType handlesType() {
        return JobType.UPLOAD_VARIANT_PROCESSING;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        Object rawId = payload.get("uploadId");
        if (!(rawId instanceof Number number)) {
            throw new IllegalArgumentException("Job " + jobId + " payload has no numeric uploadId: " + payload);
        }
        Long uploadId = number.longValue();

        Optional<UploadStatus> status = uploadProcessor.process(uploadId);
        LOG.infof("Processing job %d finished for upload %d with status %s", jobId, uploadId,
                status.map(UploadStatus::wireValue).orElse("missing"));
    }
}
