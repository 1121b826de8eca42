/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jboss.logging.Logger;
import villagecompute.catalog.jobs.JobQueue;
import villagecompute.catalog.jobs.JobType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Row of the {@code delayed_jobs} queue behind upload variant processing and the pending-upload sweep.
 *
 * <p>
 * Workers poll for due rows and claim them with a conditional update on {@code status}, so a job is only
 * ever executed by the worker whose claim succeeded. Claims that are never released (crashed worker) become
 * reclaimable after {@link #STALE_LOCK_SECONDS}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code job_type} (TEXT) - {@link JobType} name</li>
 * <li>{@code queue} (TEXT) - JobQueue family (DEFAULT, BULK)</li>
 * <li>{@code priority} (INT) - Within-queue priority</li>
 * <li>{@code payload} (JSON) - Job parameters read by the handler</li>
 * <li>{@code status} (TEXT) - {@link JobStatus} name</li>
 * <li>{@code attempts} (INT) - incremented by each claim</li>
 * <li>{@code max_attempts} (INT) - Max attempts before moving to FAILED</li>
 * <li>{@code scheduled_at} (TIMESTAMPTZ) - not claimable before this; pushed out on retry</li>
 * <li>{@code locked_at} (TIMESTAMPTZ) - When a worker claimed the job</li>
 * <li>{@code locked_by} (TEXT) - {@code host:pid} of the claiming worker</li>
 * <li>{@code completed_at} / {@code failed_at} (TIMESTAMPTZ)</li>
 * <li>{@code last_error} (TEXT) - exception of the latest failed attempt, truncated</li>
 * </ul>
 *
 * @see villagecompute.catalog.services.DelayedJobService
 */
@Entity
@Table(
        name = "delayed_jobs")
public class DelayedJob extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(DelayedJob.class);

    /**
     * Seconds after which a PROCESSING claim is considered abandoned.
     */
    public static final long STALE_LOCK_SECONDS = 15 * 60;

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "job_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobType jobType;

    @Column(
            name = "queue",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobQueue queue;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "payload",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            name = "locked_at")
    public Instant lockedAt;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "failed_at")
    public Instant failedAt;

    @Column(
            name = "last_error",
            length = 4000)
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Job lifecycle statuses.
     */
    public enum JobStatus {
        PENDING, PROCESSING, COMPLETED, FAILED
    }

    /**
     * Due PENDING jobs of a queue, highest priority first, then oldest due time.
     */
    public static List<DelayedJob> findReadyJobs(JobQueue queue, int limit) {
        return find("queue = ?1 AND status = ?2 AND scheduledAt <= ?3 ORDER BY priority DESC, scheduledAt ASC, id ASC",
                queue, JobStatus.PENDING, Instant.now()).page(0, limit).list();
    }

    public static List<DelayedJob> findByStatus(JobStatus status) {
        return list("status = ?1 ORDER BY id DESC", status);
    }

    /**
     * Finds jobs of one type that are still waiting or running.
     *
     * @param jobType
     *            the job type
     * @return PENDING and PROCESSING jobs of that type
     */
    public static List<DelayedJob> findActiveByType(JobType jobType) {
        return find("jobType = ?1 AND status IN ?2 ORDER BY id ASC", jobType,
                List.of(JobStatus.PENDING, JobStatus.PROCESSING)).list();
    }

    /**
     * Atomically claims a PENDING job for a worker. Only one concurrent caller can succeed for a given job.
     *
     * @param jobId
     *            job primary key
     * @param workerId
     *            worker identifier (hostname:pid)
     * @return {@code true} if this caller now owns the job
     */
    public static boolean claim(Long jobId, String workerId) {
        Instant now = Instant.now();
        int updated = update(
                "status = ?1, lockedAt = ?2, lockedBy = ?3, attempts = attempts + 1, updatedAt = ?2 "
                        + "WHERE id = ?4 AND status = ?5",
                JobStatus.PROCESSING, now, workerId, jobId, JobStatus.PENDING);
        if (updated == 1) {
            LOG.debugf("Worker %s claimed job %d", workerId, jobId);
            return true;
        }
        return false;
    }

    /**
     * Returns PROCESSING jobs whose claim is older than {@link #STALE_LOCK_SECONDS} to PENDING.
     *
     * @param queue
     *            the queue to recover
     * @return number of jobs released
     */
    public static int releaseStaleLocks(JobQueue queue) {
        Instant threshold = Instant.now().minusSeconds(STALE_LOCK_SECONDS);
        int released = update(
                "status = ?1, lockedAt = null, lockedBy = null, updatedAt = ?2 "
                        + "WHERE queue = ?3 AND status = ?4 AND lockedAt < ?5",
                JobStatus.PENDING, Instant.now(), queue, JobStatus.PROCESSING, threshold);
        if (released > 0) {
            LOG.warnf("Released %d stale job locks on queue %s", released, queue);
        }
        return released;
    }

    /**
     * Persists a job that is due immediately. Runs in the caller's transaction.
     *
     * @param jobType
     *            job type; its queue and the queue priority are copied onto the row
     * @param payload
     *            handler parameters
     * @param maxAttempts
     *            attempts allowed before the job is failed
     * @return the persisted job
     */
    public static DelayedJob create(JobType jobType, Map<String, Object> payload, int maxAttempts) {
        DelayedJob job = new DelayedJob();
        job.jobType = jobType;
        job.queue = jobType.getQueue();
        job.priority = job.queue.getPriority();
        job.payload = payload;
        job.status = JobStatus.PENDING;
        job.maxAttempts = maxAttempts;
        job.createdAt = Instant.now();
        job.scheduledAt = job.createdAt;
        job.updatedAt = job.createdAt;
        job.persist();

        LOG.debugf("Queued %s job %d on %s", jobType, job.id, job.queue);
        return job;
    }

    public void markCompleted() {
        finish(JobStatus.COMPLETED);
        completedAt = updatedAt;
    }

    /**
     * Gives up on the job.
     *
     * @param errorMessage
     *            failure of the final attempt
     */
    public void markFailed(String errorMessage) {
        finish(JobStatus.FAILED);
        failedAt = updatedAt;
        lastError = truncate(errorMessage);
        LOG.errorf("%s job %d failed after %d attempts: %s", jobType, id, attempts, errorMessage);
    }

    /**
     * Puts the job back in the queue, due after the backoff.
     *
     * @param backoffSeconds
     *            delay before the job is ready again
     * @param errorMessage
     *            failure of the attempt that just ran
     */
    public void scheduleRetry(long backoffSeconds, String errorMessage) {
        finish(JobStatus.PENDING);
        scheduledAt = updatedAt.plusSeconds(backoffSeconds);
        lastError = truncate(errorMessage);
        LOG.warnf("%s job %d retrying at %s (attempt %d of %d)", jobType, id, scheduledAt, attempts, maxAttempts);
    }

    private void finish(JobStatus newStatus) {
        status = newStatus;
        lockedAt = null;
        lockedBy = null;
        updatedAt = Instant.now();
    }

    /**
     * Whether another attempt is allowed after the current one.
     */
    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 4000) {
            return message;
        }
        return message.substring(0, 4000);
    }
}
