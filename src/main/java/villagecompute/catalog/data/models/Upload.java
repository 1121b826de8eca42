/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.LockModeType;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import org.hibernate.annotations.SortNatural;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One logical file transfer, identified by the SHA-256 checksum the client declares for the whole file.
 *
 * <p>
 * <b>Lifecycle:</b> {@code UPLOADING} while chunks arrive, {@code PROCESSING} once every chunk index has been
 * received, then {@code COMPLETED} or {@code FAILED} after the assemble/variant run. Terminal states never re-enter
 * processing.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code checksum} (VARCHAR(64), UNIQUE) - declared content checksum, lowercase hex</li>
 * <li>{@code original_name} (TEXT) - client filename, used by the image linker</li>
 * <li>{@code total_chunks} (INT) - fixed on creation</li>
 * <li>{@code status} (TEXT) - UPLOADING, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code upload_chunks(upload_id, chunk_index)} - received chunk indices</li>
 * </ul>
 *
 * <p>
 * Row-level mutual exclusion for chunk bookkeeping and processing goes through {@link #findByIdForUpdate(Long)}.
 *
 * @see ImageVariant
 */
@Entity
@Table(
        name = "uploads")
@NamedQuery(
        name = Upload.QUERY_FIND_BY_STATUS_WITH_VARIANTS,
        query = "SELECT DISTINCT u FROM Upload u LEFT JOIN FETCH u.variants WHERE u.status = :status ORDER BY u.id DESC")
public class Upload extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_STATUS_WITH_VARIANTS = "Upload.findByStatusWithVariants";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            nullable = false,
            unique = true,
            length = 64)
    public String checksum;

    @Column(
            name = "original_name",
            nullable = false,
            length = 1024)
    public String originalName;

    @Column(
            name = "total_chunks",
            nullable = false)
    public int totalChunks;

    @ElementCollection(
            fetch = FetchType.LAZY)
    @CollectionTable(
            name = "upload_chunks",
            joinColumns = @JoinColumn(
                    name = "upload_id"))
    @Column(
            name = "chunk_index",
            nullable = false)
    @SortNatural
    public SortedSet<Integer> receivedChunks = new TreeSet<>();

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public UploadStatus status;

    @OneToMany(
            mappedBy = "upload",
            fetch = FetchType.LAZY)
    @OrderBy("width ASC")
    public List<ImageVariant> variants = new ArrayList<>();

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Upload lifecycle statuses.
     */
    public enum UploadStatus {
        UPLOADING, PROCESSING, COMPLETED, FAILED;

        /**
         * Whether processing has already reached a final outcome for this upload.
         */
        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        /**
         * Lowercase form used in API payloads.
         */
        public String wireValue() {
            return name().toLowerCase();
        }
    }

    /**
     * Finds an upload by its declared checksum.
     *
     * @param checksum
     *            lowercase hex checksum
     * @return the upload if one exists
     */
    public static Optional<Upload> findByChecksum(String checksum) {
        return find("checksum", checksum).firstResultOptional();
    }

    /**
     * Loads an upload holding a pessimistic write lock on its row until the surrounding transaction ends.
     *
     * @param id
     *            upload primary key
     * @return the locked upload, or {@code null} when the row does not exist
     */
    public static Upload findByIdForUpdate(Long id) {
        return findById(id, LockModeType.PESSIMISTIC_WRITE);
    }

    /**
     * Finds all uploads in a status with their variants fetched, newest first.
     *
     * @param status
     *            the status to filter on
     * @return uploads ordered by id DESC
     */
    public static List<Upload> findByStatusWithVariants(UploadStatus status) {
        return getEntityManager().createNamedQuery(QUERY_FIND_BY_STATUS_WITH_VARIANTS, Upload.class)
                .setParameter("status", status).getResultList();
    }

    /**
     * Finds uploads that have been in {@code PROCESSING} since before the given instant, oldest first.
     *
     * @param updatedBefore
     *            staleness threshold, or {@code null} for every processing upload
     * @param limit
     *            maximum rows returned
     * @return processing uploads ordered by updated_at ASC
     */
    public static List<Upload> findProcessing(Instant updatedBefore, int limit) {
        if (updatedBefore == null) {
            return find("status = ?1 ORDER BY updatedAt ASC, id ASC", UploadStatus.PROCESSING).page(0, limit).list();
        }
        return find("status = ?1 AND updatedAt < ?2 ORDER BY updatedAt ASC, id ASC", UploadStatus.PROCESSING,
                updatedBefore).page(0, limit).list();
    }

    /**
     * Finds the most recently created completed uploads.
     *
     * @param limit
     *            maximum rows returned
     * @return completed uploads ordered by id DESC
     */
    public static List<Upload> findRecentCompleted(int limit) {
        return find("status = ?1 ORDER BY id DESC", UploadStatus.COMPLETED).page(0, limit).list();
    }

    /**
     * Creates and persists a new upload in {@code UPLOADING} status with no chunks received.
     *
     * @param checksum
     *            lowercase hex checksum
     * @param originalName
     *            client filename
     * @param totalChunks
     *            expected number of chunks
     * @return persisted upload
     */
    public static Upload create(String checksum, String originalName, int totalChunks) {
        Upload upload = new Upload();
        upload.checksum = checksum;
        upload.originalName = originalName;
        upload.totalChunks = totalChunks;
        upload.status = UploadStatus.UPLOADING;
        upload.createdAt = Instant.now();
        upload.updatedAt = upload.createdAt;
        upload.persist();
        return upload;
    }

    /**
     * Whether every expected chunk index has been recorded.
     */
    public boolean allChunksReceived() {
        return receivedChunks.size() >= totalChunks;
    }

    /**
     * Received percentage, floored.
     */
    public int progressPercent() {
        if (totalChunks <= 0) {
            return 0;
        }
        return (int) Math.floor(receivedChunks.size() * 100.0 / totalChunks);
    }

    /**
     * Moves the upload to a new status and touches {@code updated_at}.
     *
     * <p>
     * Only {@code UPLOADING -> PROCESSING} and {@code PROCESSING -> COMPLETED|FAILED} are legal.
     *
     * @param newStatus
     *            target status
     * @throws IllegalStateException
     *             on any other transition
     */
    public void transitionTo(UploadStatus newStatus) {
        boolean legal = (status == UploadStatus.UPLOADING && newStatus == UploadStatus.PROCESSING)
                || (status == UploadStatus.PROCESSING && newStatus.isTerminal());
        if (!legal) {
            throw new IllegalStateException(
                    "Illegal upload status transition " + status + " -> " + newStatus + " for upload " + id);
        }
        this.status = newStatus;
        this.updatedAt = Instant.now();
    }
}
