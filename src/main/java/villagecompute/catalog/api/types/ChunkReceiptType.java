/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for one chunk submission.
 *
 * <p>
 * {@code status = "uploading"} carries the progress fields; {@code status = "completed"} means every chunk has been
 * received and processing was dispatched, not that variants exist yet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkReceiptType(
        @JsonProperty("status") String status,
        @JsonProperty("upload_id") Long uploadId,
        @JsonProperty("received_chunks_count") Integer receivedChunksCount,
        @JsonProperty("total_chunks") Integer totalChunks,
        @JsonProperty("progress") Integer progress,
        @JsonProperty("message") String message) {

    public static final String STATUS_UPLOADING = "uploading";
    public static final String STATUS_COMPLETED = "completed";

    public static ChunkReceiptType uploading(Long uploadId, int receivedChunksCount, int totalChunks, int progress) {
        return new ChunkReceiptType(STATUS_UPLOADING, uploadId, receivedChunksCount, totalChunks, progress, null);
    }

    public static ChunkReceiptType completed(Long uploadId, String message) {
        return new ChunkReceiptType(STATUS_COMPLETED, uploadId, null, null, null, message);
    }
}
