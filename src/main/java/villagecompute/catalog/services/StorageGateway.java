/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import villagecompute.catalog.exceptions.StorageException;

/**
 * StorageGateway service for S3-compatible object storage (MinIO for dev, any S3 endpoint for prod).
 *
 * <p>
 * Backs the chunk store and the variant image store. Keys are always supplied by the caller (see {@link ChunkStore})
 * so the same logical object lands at the same location on every run.
 *
 * <p>
 * Every call is wrapped in an OpenTelemetry span and records Micrometer counters and timers under {@code storage.*}.
 * SDK failures surface as {@link StorageException}.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * storageGateway.put(BucketType.CHUNKS, "uploads/chunks/42/0", chunkBytes, "application/octet-stream");
 * byte[] bytes = storageGateway.download(BucketType.CHUNKS, "uploads/chunks/42/0");
 * </pre>
 */
@ApplicationScoped
public class StorageGateway {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    @Inject
    S3Client s3Client;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "catalog.storage.buckets.chunks")
    String chunksBucket;

    @ConfigProperty(
            name = "catalog.storage.buckets.images")
    String imagesBucket;

    /**
     * Bucket types per asset domain.
     */
    public enum BucketType {
        /**
         * Upload chunks and assembled intermediates.
         */
        CHUNKS,

        /**
         * Generated image variants.
         */
        IMAGES
    }

    /**
     * Stores an object at the given key, replacing anything already there.
     *
     * <p>
     * Callers that need first-write-wins semantics check {@link #exists(BucketType, String)} first.
     *
     * @param bucket
     *            target bucket
     * @param objectKey
     *            full object key
     * @param bytes
     *            object content
     * @param contentType
     *            MIME type recorded on the object
     * @throws StorageException
     *             if the upload fails
     */
    public void put(BucketType bucket, String objectKey, byte[] bytes, String contentType) {
        Span span = tracer.spanBuilder("storage.put").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", objectKey).setAttribute("size_bytes", bytes.length).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(bucketName).key(objectKey)
                    .contentType(contentType).metadata(buildMetadata()).build();

            s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Stored %s/%s (%d bytes, %dms)", bucketName, objectKey, bytes.length, latencyMs);

            recordTransferMetrics("uploads", "uploaded", bucket, bytes.length, latencyMs, true);
            span.setAttribute("put_success", true);

        } catch (S3Exception e) {
            long latencyMs = System.currentTimeMillis() - startTime;
            recordTransferMetrics("uploads", "uploaded", bucket, bytes.length, latencyMs, false);

            span.recordException(e);
            span.setAttribute("put_success", false);
            LOG.errorf(e, "Failed to store %s/%s: %s", bucket, objectKey, errorMessage(e));
            throw new StorageException("Storage put failed: " + errorMessage(e), e);

        } catch (RuntimeException e) {
            long latencyMs = System.currentTimeMillis() - startTime;
            recordTransferMetrics("uploads", "uploaded", bucket, bytes.length, latencyMs, false);

            span.recordException(e);
            span.setAttribute("put_success", false);
            LOG.errorf(e, "Failed to store %s/%s: %s", bucket, objectKey, e.getMessage());
            throw new StorageException("Storage put failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Downloads an object by key.
     *
     * @param bucket
     *            source bucket
     * @param objectKey
     *            full object key
     * @return raw object bytes
     * @throws StorageException
     *             if the object is missing or the download fails
     */
    public byte[] download(BucketType bucket, String objectKey) {
        Span span = tracer.spanBuilder("storage.download").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", objectKey).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucketName).key(objectKey).build();

            byte[] bytes = s3Client.getObjectAsBytes(getRequest).asByteArray();

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Downloaded %s/%s (%d bytes, %dms)", bucketName, objectKey, bytes.length, latencyMs);

            recordTransferMetrics("downloads", "downloaded", bucket, bytes.length, latencyMs, true);
            span.setAttribute("download_success", true);
            span.setAttribute("size_bytes", bytes.length);

            return bytes;

        } catch (S3Exception e) {
            long latencyMs = System.currentTimeMillis() - startTime;
            recordTransferMetrics("downloads", "downloaded", bucket, 0, latencyMs, false);

            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.errorf(e, "Failed to download %s: %s", objectKey, errorMessage(e));
            throw new StorageException("Storage download failed: " + errorMessage(e), e);

        } catch (RuntimeException e) {
            long latencyMs = System.currentTimeMillis() - startTime;
            recordTransferMetrics("downloads", "downloaded", bucket, 0, latencyMs, false);

            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.errorf(e, "Failed to download %s: %s", objectKey, e.getMessage());
            throw new StorageException("Storage download failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Checks whether an object exists (HEAD request).
     *
     * @param bucket
     *            source bucket
     * @param objectKey
     *            full object key
     * @return {@code true} if the object is present
     * @throws StorageException
     *             on any failure other than "not found"
     */
    public boolean exists(BucketType bucket, String objectKey) {
        Span span = tracer.spanBuilder("storage.exists").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", objectKey).startSpan();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(objectKey).build());
            span.setAttribute("exists", true);
            return true;

        } catch (NoSuchKeyException e) {
            span.setAttribute("exists", false);
            return false;

        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                span.setAttribute("exists", false);
                return false;
            }
            span.recordException(e);
            LOG.errorf(e, "Failed to check %s: %s", objectKey, errorMessage(e));
            throw new StorageException("Storage existence check failed: " + errorMessage(e), e);

        } finally {
            span.end();
        }
    }

    /**
     * Deletes an object. Deleting a missing key is not an error.
     *
     * @param bucket
     *            source bucket
     * @param objectKey
     *            full object key
     * @throws StorageException
     *             if deletion fails
     */
    public void delete(BucketType bucket, String objectKey) {
        Span span = tracer.spanBuilder("storage.delete").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", objectKey).startSpan();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(objectKey).build();

            s3Client.deleteObject(deleteRequest);

            LOG.debugf("Deleted object %s/%s", bucketName, objectKey);

            recordDeleteMetrics(bucket, true);
            span.setAttribute("delete_success", true);

        } catch (S3Exception e) {
            recordDeleteMetrics(bucket, false);

            span.recordException(e);
            span.setAttribute("delete_success", false);
            LOG.errorf(e, "Failed to delete %s: %s", objectKey, errorMessage(e));
            throw new StorageException("Storage deletion failed: " + errorMessage(e), e);

        } finally {
            span.end();
        }
    }

    /**
     * Resolves bucket name from configuration.
     *
     * @param bucket
     *            bucket type
     * @return configured bucket name
     */
    String getBucketName(BucketType bucket) {
        return switch (bucket) {
            case CHUNKS -> chunksBucket;
            case IMAGES -> imagesBucket;
        };
    }

    private Map<String, String> buildMetadata() {
        return Map.of("uploaded-at", Instant.now().toString(), "service", "catalog-ingest");
    }

    private static String errorMessage(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
            return e.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }

    /**
     * Records put/download metrics for monitoring and alerting.
     */
    private void recordTransferMetrics(String operation, String bytesSuffix, BucketType bucket, long bytes,
            long latencyMs, boolean success) {
        String status = success ? "success" : "failure";
        String bucketTag = bucket.name().toLowerCase();

        Counter.builder("storage." + operation + ".total").tag("bucket", bucketTag).tag("status", status)
                .register(meterRegistry).increment();

        if (success) {
            Counter.builder("storage.bytes." + bytesSuffix).tag("bucket", bucketTag).register(meterRegistry)
                    .increment(bytes);
        }

        Timer.builder("storage." + operation + ".duration").tag("bucket", bucketTag).tag("status", status)
                .register(meterRegistry).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Records deletion metrics for monitoring.
     */
    private void recordDeleteMetrics(BucketType bucket, boolean success) {
        String status = success ? "success" : "failure";

        Counter.builder("storage.deletes.total").tag("bucket", bucket.name().toLowerCase()).tag("status", status)
                .register(meterRegistry).increment();
    }
}
