/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.catalog.api.types.ProcessingResultType;
import villagecompute.catalog.data.models.ImageVariant;
import villagecompute.catalog.data.models.Upload;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.exceptions.StorageException;
import villagecompute.catalog.observability.LoggingConfig;
import villagecompute.catalog.services.ChunkAssembler.AssembledFile;
import villagecompute.catalog.services.ImageVariantGenerator.RenderedVariant;
import villagecompute.catalog.util.PersistenceErrors;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a fully received upload into its image variants. Safe to invoke any number of times, concurrently or
 * sequentially, for the same upload.
 *
 * <p>
 * Workflow, all under a pessimistic write lock on the upload row:
 * <ol>
 * <li>Missing row: no-op.</li>
 * <li>{@code COMPLETED} or {@code FAILED}: no-op. {@code UPLOADING}: no-op, processing has not been dispatched.</li>
 * <li>Every chunk index {@code 0..total-1} must be present in storage, otherwise the upload fails.</li>
 * <li>Concatenate chunks in index order and compare the SHA-256 with the declared checksum. A mismatch fails the
 * upload and discards the assembled file.</li>
 * <li>For each width in {@link ImageVariantGenerator#TARGET_WIDTHS} with no existing variant row: render, store at the
 * deterministic key and insert the row. Existing rows are left untouched.</li>
 * <li>Mark {@code COMPLETED} and discard the assembled file.</li>
 * </ol>
 *
 * <p>
 * Any other failure during steps 3-5 marks the upload {@code FAILED}; variants already written stay, and a later
 * reprocess only fills the gaps. Failing to acquire the row lock is rethrown so the dispatching job retries.
 */
@ApplicationScoped
public class UploadProcessor {

    private static final Logger LOG = Logger.getLogger(UploadProcessor.class);

    @Inject
    ChunkStore chunkStore;

    @Inject
    ChunkAssembler chunkAssembler;

    @Inject
    ImageVariantGenerator variantGenerator;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Runs assembly and variant generation for one upload.
     *
     * @param uploadId
     *            upload primary key
     * @return status after this run, empty if the upload does not exist
     */
    public Optional<UploadStatus> process(Long uploadId) {
        Span span = tracer.spanBuilder("upload.process").setAttribute("upload.id", uploadId).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        LoggingConfig.setUploadId(uploadId);

        try (Scope scope = span.makeCurrent()) {
            Optional<UploadStatus> result;
            try {
                result = Optional.ofNullable(QuarkusTransaction.requiringNew().call(() -> processLocked(uploadId)));
            } catch (RuntimeException e) {
                if (PersistenceErrors.isLockFailure(e)) {
                    span.recordException(e);
                    LOG.warnf(e, "Could not lock upload %d, leaving it for a retry", uploadId);
                    throw e;
                }
                LOG.errorf(e, "Processing transaction for upload %d rolled back", uploadId);
                span.recordException(e);
                result = Optional.ofNullable(markFailedIfNotTerminal(uploadId));
            }

            String outcome = result.map(UploadStatus::wireValue).orElse("missing");
            span.setAttribute("upload.status", outcome);
            meterRegistry.counter("catalog.uploads.processed.total", "status", outcome).increment();
            sample.stop(Timer.builder("catalog.uploads.processing.duration").tag("status", outcome)
                    .register(meterRegistry));
            return result;

        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Synchronously processes up to {@code limit} uploads currently in {@code PROCESSING}, oldest first.
     *
     * @param limit
     *            max uploads to process
     * @return one result per upload attempted
     */
    public List<ProcessingResultType> processPending(int limit) {
        List<Long> uploadIds = QuarkusTransaction.requiringNew()
                .call(() -> Upload.findProcessing(null, limit).stream().map(u -> u.id).toList());

        List<ProcessingResultType> results = new ArrayList<>();
        for (Long uploadId : uploadIds) {
            String status = process(uploadId).map(UploadStatus::wireValue).orElse("missing");
            results.add(new ProcessingResultType(uploadId, status));
        }
        LOG.infof("Processed %d pending uploads", results.size());
        return results;
    }

    private UploadStatus processLocked(Long uploadId) {
        Upload upload = Upload.findByIdForUpdate(uploadId);
        if (upload == null) {
            LOG.debugf("Upload %d no longer exists, nothing to process", uploadId);
            return null;
        }
        if (upload.status != UploadStatus.PROCESSING) {
            LOG.debugf("Upload %d is %s, skipping processing", uploadId, upload.status);
            return upload.status;
        }

        try {
            runPipeline(upload);
        } catch (IOException | StorageException | IllegalArgumentException e) {
            LOG.errorf(e, "Variant processing failed for upload %d", uploadId);
            upload.transitionTo(UploadStatus.FAILED);
        }
        return upload.status;
    }

    private void runPipeline(Upload upload) throws IOException {
        List<Integer> missing = chunkAssembler.findMissingChunks(upload.id, upload.totalChunks);
        if (!missing.isEmpty()) {
            LOG.warnf("Upload %d is missing chunks %s, marking failed", upload.id, missing);
            upload.transitionTo(UploadStatus.FAILED);
            return;
        }

        AssembledFile assembled = chunkAssembler.assemble(upload.id, upload.totalChunks);
        chunkStore.storeAssembled(upload.id, assembled.bytes());

        if (!assembled.matches(upload.checksum)) {
            LOG.warnf("Checksum mismatch for upload %d: declared %s, assembled %s", upload.id, upload.checksum,
                    assembled.checksum());
            chunkStore.discardAssembled(upload.id);
            upload.transitionTo(UploadStatus.FAILED);
            return;
        }

        BufferedImage source = variantGenerator.decode(assembled.bytes());
        int created = 0;
        for (int width : ImageVariantGenerator.TARGET_WIDTHS) {
            String label = String.valueOf(width);
            if (ImageVariant.findByUploadAndVariant(upload.id, label).isPresent()) {
                LOG.debugf("Variant %s of upload %d already exists", label, upload.id);
                continue;
            }
            RenderedVariant rendered = variantGenerator.render(source, width);
            String path = chunkStore.storeVariant(upload.id, width, rendered.bytes(),
                    ImageVariantGenerator.CONTENT_TYPE);
            createVariant(upload, rendered, path);
            created++;
        }

        upload.transitionTo(UploadStatus.COMPLETED);
        chunkStore.discardAssembled(upload.id);
        LOG.infof("Upload %d completed (%d new variants, source %dx%d)", upload.id, created, source.getWidth(),
                source.getHeight());
    }

    private void createVariant(Upload upload, RenderedVariant rendered, String path) {
        ImageVariant variant = new ImageVariant();
        variant.upload = upload;
        variant.variant = rendered.label();
        variant.path = path;
        variant.width = rendered.width();
        variant.height = rendered.height();
        variant.checksum = rendered.checksum();
        variant.sizeBytes = rendered.bytes().length;
        variant.contentType = ImageVariantGenerator.CONTENT_TYPE;
        variant.createdAt = Instant.now();
        variant.persist();
        upload.variants.add(variant);

        LOG.debugf("Created variant %s of upload %d (%dx%d, %d bytes)", variant.variant, upload.id, variant.width,
                variant.height, variant.sizeBytes);
    }

    private UploadStatus markFailedIfNotTerminal(Long uploadId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Upload upload = Upload.findByIdForUpdate(uploadId);
            if (upload == null) {
                return null;
            }
            if (upload.status == UploadStatus.PROCESSING) {
                upload.transitionTo(UploadStatus.FAILED);
                LOG.warnf("Upload %d marked failed after rollback", uploadId);
            }
            return upload.status;
        });
    }
}
