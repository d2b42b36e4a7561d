package com.example.pawluxe_export.service;

import com.example.pawluxe_export.config.ExportQueueProperties;
import com.example.pawluxe_export.dto.ExportJobView;
import com.example.pawluxe_export.dto.RenderJob;
import com.example.pawluxe_export.dto.RenderResult;
import com.example.pawluxe_export.engine.Interfaces.ClipRenderEngine;
import com.example.pawluxe_export.engine.RenderCancellation;
import com.example.pawluxe_export.exception.InvalidTransitionException;
import com.example.pawluxe_export.exception.JobNotFoundException;
import com.example.pawluxe_export.exception.RenderCanceledException;
import com.example.pawluxe_export.exception.RenderException;
import com.example.pawluxe_export.exception.StorageException;
import com.example.pawluxe_export.model.ExportJob;
import com.example.pawluxe_export.service.Interfaces.StorageService;
import com.example.pawluxe_export.util.ExportJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-process worker loop: claim one job, render it, report the outcome. Runs one render at a time; any
 * number of processes may poll the same table.
 */
@Service
public class ExportDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExportDispatcher.class);

    private final ExportJobService jobService;
    private final ClipRenderEngine renderEngine;
    private final StorageService storage;
    private final TaskScheduler scheduler;
    private final ExportQueueProperties properties;
    private final String workerId;
    private final Clock clock;

    public ExportDispatcher(ExportJobService jobService,
                            ClipRenderEngine renderEngine,
                            StorageService storage,
                            @Qualifier("exportTaskScheduler") TaskScheduler scheduler,
                            ExportQueueProperties properties,
                            @Qualifier("exportWorkerId") String workerId,
                            Clock clock) {
        this.jobService = jobService;
        this.renderEngine = renderEngine;
        this.storage = storage;
        this.scheduler = scheduler;
        this.properties = properties;
        this.workerId = workerId;
        this.clock = clock;
    }

    /**
     * One poll tick.
     *
     * @return {@code true} when a job was claimed.
     */
    public boolean poll() {
        Optional<ExportJob> claimed = jobService.claimNext(workerId);
        if (claimed.isEmpty()) {
            LOGGER.debug("Worker poll tick - no jobs claimed worker={}", workerId);
            return false;
        }
        process(claimed.get());
        return true;
    }

    public String getWorkerId() {
        return workerId;
    }

    private void process(ExportJob job) {
        UUID jobId = job.getId();
        // cancel can land between claim and here
        ExportJobView current = jobService.get(jobId);
        if (current.status() != ExportJobStatus.RUNNING) {
            LOGGER.info("JOB SKIPPED jobId={} worker={} status={} after claim", jobId, workerId, current.status());
            return;
        }

        RenderCancellation cancellation = new RenderCancellation();
        Duration beatEvery = properties.getWorker().getHeartbeatInterval();
        ScheduledFuture<?> heartbeat = scheduler.scheduleAtFixedRate(
                () -> beat(jobId, cancellation), clock.instant().plus(beatEvery), beatEvery);

        String attemptTag = attemptTag(job);
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} worker={} attempt={} tag={} camera={} kind={} timeout={}s",
                jobId, workerId, job.getRetryCount() + 1, attemptTag, job.getRenderParams().cameraId(),
                job.getRenderParams().kind(), job.getTimeoutSeconds());

        RenderResult result = null;
        RenderException renderFailure = null;
        RuntimeException crash = null;
        try {
            result = renderEngine.render(
                    new RenderJob(jobId, attemptTag, job.getRenderParams(), Duration.ofSeconds(job.getTimeoutSeconds())),
                    cancellation);
        } catch (RenderException e) {
            renderFailure = e;
        } catch (RuntimeException e) {
            crash = e;
        } finally {
            heartbeat.cancel(false);
        }
        long tookMs = (System.nanoTime() - t0) / 1_000_000;

        if (result != null) {
            reportDone(jobId, result, tookMs);
        } else if (renderFailure instanceof RenderCanceledException) {
            LOGGER.info("JOB ABORTED jobId={} worker={} in={}ms: {}", jobId, workerId, tookMs, renderFailure.getMessage());
        } else if (renderFailure != null) {
            reportFailure(jobId, renderFailure.getMessage(), renderFailure.isRetryable(), tookMs);
        } else {
            LOGGER.error("Job {} crashed: {}", jobId, crash.toString(), crash);
            reportFailure(jobId, crash.toString(), true, tookMs);
        }
    }

    // every claim stamps claimedAt, so two attempts of one job never publish to the same files
    private String attemptTag(ExportJob job) {
        Instant claimedAt = job.getClaimedAt() != null ? job.getClaimedAt() : clock.instant();
        return claimedAt.toEpochMilli() + "-" + (job.getRetryCount() + 1);
    }

    private void reportDone(UUID jobId, RenderResult result, long tookMs) {
        try {
            jobService.markDone(jobId, workerId, result.outputPath().toString(), result.manifestPath().toString());
            LOGGER.info("JOB DONE jobId={} worker={} excerpts={} in={}ms", jobId, workerId, result.excerptCount(), tookMs);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            LOGGER.warn("JOB RESULT DISCARDED jobId={} worker={}: {}", jobId, workerId, e.getMessage());
            discard(result.outputPath());
            discard(result.manifestPath());
        }
    }

    private void reportFailure(UUID jobId, String error, boolean retryable, long tookMs) {
        try {
            ExportJobStatus next = jobService.markFailed(jobId, workerId, error, retryable);
            LOGGER.info("JOB FAILED jobId={} worker={} retryable={} next={} in={}ms error={}",
                    jobId, workerId, retryable, next, tookMs, error);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            LOGGER.warn("JOB FAILURE NOT RECORDED jobId={} worker={}: {}", jobId, workerId, e.getMessage());
        }
    }

    private void beat(UUID jobId, RenderCancellation cancellation) {
        try {
            if (!jobService.heartbeat(jobId, workerId)) {
                LOGGER.info("job no longer owned, aborting render jobId={} worker={}", jobId, workerId);
                cancellation.cancel();
            }
        } catch (RuntimeException e) {
            // the stale reaper decides if we are gone; keep rendering
            LOGGER.warn("heartbeat failed jobId={} worker={}: {}", jobId, workerId, e.toString());
        }
    }

    private void discard(Path artifact) {
        try {
            storage.delete(artifact);
        } catch (StorageException e) {
            LOGGER.warn("could not delete orphaned artifact {}: {}", artifact, e.getMessage());
        }
    }
}
