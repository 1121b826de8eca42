/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.catalog.data.models.Upload;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for upload status inspection.
 *
 * A {@code failed} status is how integrity problems (missing chunk, checksum mismatch, undecodable image) surface to
 * clients.
 */
public record UploadType(
        @JsonProperty("upload_id") Long uploadId,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("original_name") String originalName,
        @JsonProperty("status") String status,
        @JsonProperty("total_chunks") int totalChunks,
        @JsonProperty("received_chunks_count") int receivedChunksCount,
        @JsonProperty("received_chunks") List<Integer> receivedChunks,
        @JsonProperty("progress") int progress,
        @JsonProperty("variants") List<ImageVariantType> variants,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /**
     * Maps an entity, initializing its lazy collections. Call inside a transaction.
     */
    public static UploadType fromEntity(Upload upload) {
        List<ImageVariantType> variants = upload.variants.stream().map(ImageVariantType::fromEntity).toList();
        return new UploadType(upload.id, upload.checksum, upload.originalName, upload.status.wireValue(),
                upload.totalChunks, upload.receivedChunks.size(), List.copyOf(upload.receivedChunks),
                upload.progressPercent(), variants, upload.createdAt, upload.updatedAt);
    }
}
