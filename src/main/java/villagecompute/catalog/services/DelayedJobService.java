/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.catalog.data.models.DelayedJob;
import villagecompute.catalog.jobs.JobHandler;
import villagecompute.catalog.jobs.JobQueue;
import villagecompute.catalog.jobs.JobType;
import villagecompute.catalog.observability.LoggingConfig;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Database-backed job queue used to hand upload variant processing and upload sweeps off the request path.
 *
 * <p>
 * {@link #enqueue} writes a {@code delayed_jobs} row in the caller's transaction, so an upload only reaches
 * {@code PROCESSING} together with the job that will process it. {@link #processQueue} is driven by
 * {@link villagecompute.catalog.jobs.DelayedJobWorker}: it frees locks abandoned by dead workers, claims ready rows
 * one at a time with a conditional update, and runs the matching {@link JobHandler}.
 *
 * <p>
 * A handler exception puts the job back to {@code PENDING} after {@code 2^attempt * 30s} (jitter of a quarter either
 * way) until {@code catalog.jobs.max-attempts} is reached, then the job is {@code FAILED}. Delivery is
 * at-least-once.
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    private static final int BACKOFF_UNIT_SECONDS = 30;

    private static final double BACKOFF_JITTER = 0.25;

    private final Map<JobType, JobHandler> handlers;

    private final String workerId = resolveWorkerId();

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "catalog.jobs.max-attempts",
            defaultValue = "5")
    int maxAttempts;

    @Inject
    public DelayedJobService(Instance<JobHandler> discovered) {
        this.handlers = indexByType(discovered);
        LOG.infof("Job service ready on %s with handlers for %s", workerId, handlers.keySet());
    }

    /**
     * One handler per job type; a second bean for the same type fails startup.
     */
    private static Map<JobType, JobHandler> indexByType(Instance<JobHandler> discovered) {
        Map<JobType, JobHandler> byType = new EnumMap<>(JobType.class);
        for (JobHandler handler : discovered) {
            JobHandler previous = byType.putIfAbsent(handler.handlesType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Job type " + handler.handlesType() + " is handled by both "
                        + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        return byType;
    }

    /**
     * Queues a job. Joins the caller's transaction when there is one, so a rolled-back caller leaves no job behind.
     *
     * @param jobType
     *            job type, which also picks the queue
     * @param payload
     *            handler parameters, stored as JSON
     * @return id of the new {@code delayed_jobs} row
     */
    @Transactional
    public long enqueue(JobType jobType, Map<String, Object> payload) {
        DelayedJob job = DelayedJob.create(jobType, payload, maxAttempts);
        meterRegistry.counter("catalog.jobs.enqueued.total", "type", jobType.name()).increment();
        return job.id;
    }

    /**
     * Claims and executes up to {@code limit} ready jobs from one queue, each in its own transactions.
     *
     * @param queue
     *            the queue to drain
     * @param limit
     *            max jobs to run in this pass
     * @return number of jobs this worker claimed and ran
     */
    public int processQueue(JobQueue queue, int limit) {
        QuarkusTransaction.requiringNew().run(() -> DelayedJob.releaseStaleLocks(queue));

        List<Long> readyIds = QuarkusTransaction.requiringNew()
                .call(() -> DelayedJob.findReadyJobs(queue, limit).stream().map(job -> job.id).toList());

        int processed = 0;
        for (Long jobId : readyIds) {
            boolean claimed = QuarkusTransaction.requiringNew().call(() -> DelayedJob.claim(jobId, workerId));
            if (!claimed) {
                LOG.debugf("Job %d already claimed by another worker", jobId);
                continue;
            }
            DelayedJob job = QuarkusTransaction.requiringNew().call(() -> DelayedJob.<DelayedJob> findById(jobId));
            runClaimedJob(job);
            processed++;
        }
        return processed;
    }

    private void runClaimedJob(DelayedJob job) {
        try {
            executeJob(job.jobType, job.id, job.payload, job.attempts);
            QuarkusTransaction.requiringNew().run(() -> {
                DelayedJob managed = DelayedJob.findById(job.id);
                managed.markCompleted();
            });
            meterRegistry.counter("catalog.jobs.executed.total", "type", job.jobType.name(), "outcome", "completed")
                    .increment();
        } catch (Exception e) {
            recordFailure(job.id, job.jobType, e);
        }
    }

    private void recordFailure(Long jobId, JobType jobType, Exception error) {
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        String outcome = QuarkusTransaction.requiringNew().call(() -> {
            DelayedJob managed = DelayedJob.findById(jobId);
            if (managed.hasAttemptsRemaining()) {
                managed.scheduleRetry(calculateBackoffDelay(managed.attempts), message);
                return "retried";
            }
            managed.markFailed(message);
            return "failed";
        });
        meterRegistry.counter("catalog.jobs.executed.total", "type", jobType.name(), "outcome", outcome).increment();
    }

    /**
     * Runs the handler for one claimed job inside a {@code job.execute} span, with {@code job_id} and the trace ids
     * in the MDC.
     *
     * @throws IllegalStateException
     *             if no handler exists for the type
     * @throws Exception
     *             the handler's failure, already recorded on the span
     */
    public void executeJob(JobType jobType, Long jobId, Map<String, Object> payload, int attempt) throws Exception {
        JobHandler handler = handlers.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No job handler for " + jobType);
        }

        Span span = tracer.spanBuilder("job.execute")
                .setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name())
                .setAttribute("job.queue", jobType.getQueue().name())
                .setAttribute("job.attempt", attempt)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);
            LoggingConfig.setRequestOrigin("JobType." + jobType.name());

            handler.execute(jobId, payload);
            LOG.infof("%s job %d done (attempt %d)", jobType, jobId, attempt);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            LOG.errorf(e, "%s job %d threw on attempt %d", jobType, jobId, attempt);
            throw e;

        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Seconds until the next try of a job that has failed {@code attempt} times: {@code 2^attempt * 30}, scaled by a
     * random factor in {@code [0.75, 1.25]}.
     */
    public long calculateBackoffDelay(int attempt) {
        long nominal = (1L << attempt) * BACKOFF_UNIT_SECONDS;
        double factor = 1.0 - BACKOFF_JITTER + ThreadLocalRandom.current().nextDouble(2 * BACKOFF_JITTER);
        return (long) (nominal * factor);
    }

    /**
     * Identifier stamped into {@code locked_by} for jobs claimed by this process.
     */
    public String getWorkerId() {
        return workerId;
    }

    private static String resolveWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ProcessHandle.current().pid();
    }
}
