/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.catalog.api.types.ChunkReceiptType;
import villagecompute.catalog.api.types.UploadType;
import villagecompute.catalog.data.models.Upload;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.exceptions.ResourceNotFoundException;
import villagecompute.catalog.exceptions.UploadConflictException;
import villagecompute.catalog.exceptions.ValidationException;
import villagecompute.catalog.jobs.JobType;
import villagecompute.catalog.observability.LoggingConfig;
import villagecompute.catalog.util.PersistenceErrors;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Bookkeeping for chunked uploads: one {@link Upload} per distinct checksum and the set of chunk indices received.
 *
 * <p>
 * <b>Chunk submission:</b>
 * <ol>
 * <li>Look up or create the upload for the checksum. {@code total_chunks} and {@code original_name} are fixed by the
 * first submission; a later submission declaring a different {@code total_chunks} is rejected.</li>
 * <li>Lock the upload row. An already-received index is a no-op and the stored chunk is never overwritten.</li>
 * <li>Otherwise persist the bytes, then record the index.</li>
 * <li>When every index is present, flip {@code UPLOADING -> PROCESSING} and enqueue
 * {@link JobType#UPLOAD_VARIANT_PROCESSING} in the same transaction.</li>
 * </ol>
 *
 * <p>
 * The row lock serializes concurrent submissions for one upload, so exactly one submission observes the final count
 * while the upload is still {@code UPLOADING} and dispatches processing.
 */
@ApplicationScoped
public class UploadLedger {

    private static final Logger LOG = Logger.getLogger(UploadLedger.class);

    public static final int MAX_CHECKSUM_LENGTH = 64;
    public static final int MAX_ORIGINAL_NAME_LENGTH = 1024;

    static final String COMPLETED_MESSAGE = "Upload complete, processing started";
    static final String ALREADY_RECEIVED_MESSAGE = "Upload already received";

    @Inject
    ChunkStore chunkStore;

    @Inject
    DelayedJobService jobService;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Records one chunk of an upload.
     *
     * @param checksum
     *            declared SHA-256 of the whole file (hex, max 64 characters)
     * @param chunkIndex
     *            zero-based chunk index, less than {@code totalChunks}
     * @param totalChunks
     *            declared chunk count, at least 1
     * @param originalName
     *            client filename
     * @param bytes
     *            chunk content
     * @return receipt with {@code uploading} progress or {@code completed}
     * @throws ValidationException
     *             if any argument is out of range
     * @throws UploadConflictException
     *             if {@code totalChunks} differs from the value fixed by the first submission
     */
    public ChunkReceiptType submitChunk(String checksum, int chunkIndex, int totalChunks, String originalName,
            byte[] bytes) {
        String normalizedChecksum = validate(checksum, chunkIndex, totalChunks, originalName, bytes);
        Long uploadId = resolveUploadId(normalizedChecksum, originalName.trim(), totalChunks);

        LoggingConfig.setUploadId(uploadId);
        try {
            return QuarkusTransaction.requiringNew()
                    .call(() -> recordChunk(uploadId, chunkIndex, totalChunks, bytes));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private ChunkReceiptType recordChunk(Long uploadId, int chunkIndex, int totalChunks, byte[] bytes) {
        Upload upload = Upload.findByIdForUpdate(uploadId);
        if (upload == null) {
            throw new ResourceNotFoundException("Upload " + uploadId + " disappeared during chunk submission");
        }

        if (upload.totalChunks != totalChunks) {
            countChunk("conflict");
            throw new UploadConflictException("Upload " + upload.id + " was started with total_chunks="
                    + upload.totalChunks + ", got total_chunks=" + totalChunks);
        }

        if (upload.status != UploadStatus.UPLOADING) {
            LOG.debugf("Chunk %d for upload %d ignored, upload is already %s", chunkIndex, upload.id, upload.status);
            countChunk("after_completion");
            return ChunkReceiptType.completed(upload.id, ALREADY_RECEIVED_MESSAGE);
        }

        if (upload.receivedChunks.contains(chunkIndex)) {
            LOG.debugf("Chunk %d for upload %d already received", chunkIndex, upload.id);
            countChunk("duplicate");
        } else {
            chunkStore.storeChunkIfAbsent(upload.id, chunkIndex, bytes);
            upload.receivedChunks.add(chunkIndex);
            upload.updatedAt = Instant.now();
            countChunk("accepted");
        }

        if (upload.allChunksReceived()) {
            upload.transitionTo(UploadStatus.PROCESSING);
            jobService.enqueue(JobType.UPLOAD_VARIANT_PROCESSING, Map.of("uploadId", upload.id));
            LOG.infof("Upload %d received all %d chunks, variant processing dispatched", upload.id,
                    upload.totalChunks);
            return ChunkReceiptType.completed(upload.id, COMPLETED_MESSAGE);
        }

        return ChunkReceiptType.uploading(upload.id, upload.receivedChunks.size(), upload.totalChunks,
                upload.progressPercent());
    }

    /**
     * Finds or creates the upload row for a checksum. A lost creation race is resolved by reading the winner's row.
     */
    private Long resolveUploadId(String checksum, String originalName, int totalChunks) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> Upload.findByChecksum(checksum).map(u -> u.id)
                    .orElseGet(() -> {
                        Upload created = Upload.create(checksum, originalName, totalChunks);
                        LOG.infof("Created upload %d for %s (%d chunks)", created.id, originalName, totalChunks);
                        return created.id;
                    }));
        } catch (RuntimeException e) {
            if (!PersistenceErrors.isUniqueViolation(e)) {
                throw e;
            }
            LOG.debugf("Lost creation race for checksum %s, reading existing upload", checksum);
            return QuarkusTransaction.requiringNew()
                    .call(() -> Upload.findByChecksum(checksum).map(u -> u.id).orElseThrow(() -> e));
        }
    }

    /**
     * Loads an upload for status inspection.
     *
     * @param uploadId
     *            upload primary key
     * @return upload with received chunks and variants
     * @throws ResourceNotFoundException
     *             if no such upload exists
     */
    @Transactional
    public UploadType describe(Long uploadId) {
        Upload upload = Upload.findById(uploadId);
        if (upload == null) {
            throw new ResourceNotFoundException("Upload not found: " + uploadId);
        }
        return UploadType.fromEntity(upload);
    }

    private String validate(String checksum, int chunkIndex, int totalChunks, String originalName, byte[] bytes) {
        if (checksum == null || checksum.isBlank()) {
            throw new ValidationException("checksum is required");
        }
        String normalized = checksum.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_CHECKSUM_LENGTH) {
            throw new ValidationException("checksum must be at most " + MAX_CHECKSUM_LENGTH + " characters");
        }
        if (totalChunks < 1) {
            throw new ValidationException("total_chunks must be at least 1");
        }
        if (chunkIndex < 0) {
            throw new ValidationException("chunk_index must be zero or greater");
        }
        if (chunkIndex >= totalChunks) {
            throw new ValidationException(
                    "chunk_index " + chunkIndex + " is out of range for total_chunks " + totalChunks);
        }
        if (originalName == null || originalName.isBlank()) {
            throw new ValidationException("original_name is required");
        }
        if (originalName.trim().length() > MAX_ORIGINAL_NAME_LENGTH) {
            throw new ValidationException("original_name must be at most " + MAX_ORIGINAL_NAME_LENGTH + " characters");
        }
        if (bytes == null) {
            throw new ValidationException("chunk is required");
        }
        return normalized;
    }

    private void countChunk(String result) {
        meterRegistry.counter("catalog.uploads.chunks.total", "result", result).increment();
    }
}
