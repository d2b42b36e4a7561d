package com.example.pawluxe_export.service;

import com.example.pawluxe_export.config.ExportQueueProperties;
import com.example.pawluxe_export.dto.EnqueueRequest;
import com.example.pawluxe_export.dto.ExportJobView;
import com.example.pawluxe_export.dto.RenderParams;
import com.example.pawluxe_export.dto.SourceSegment;
import com.example.pawluxe_export.exception.InvalidTransitionException;
import com.example.pawluxe_export.exception.JobNotFoundException;
import com.example.pawluxe_export.exception.MalformedRequestException;
import com.example.pawluxe_export.model.ExportJob;
import com.example.pawluxe_export.repository.ExportJobRepository;
import com.example.pawluxe_export.util.BackoffPolicy;
import com.example.pawluxe_export.util.DedupeKeys;
import com.example.pawluxe_export.util.ExportJobStatus;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The job store: durable export jobs plus the claim and lifecycle operations every dispatcher and
 * operator goes through. All coordination between worker processes happens in these methods.
 */
@Service
public class ExportJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExportJobService.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final ExportJobRepository jobRepo;
    private final BackoffPolicy backoffPolicy;
    private final ExportQueueProperties properties;
    private final Validator validator;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public ExportJobService(ExportJobRepository jobRepo,
                            BackoffPolicy backoffPolicy,
                            ExportQueueProperties properties,
                            Validator validator,
                            Clock clock,
                            PlatformTransactionManager transactionManager) {
        this.jobRepo = jobRepo;
        this.backoffPolicy = backoffPolicy;
        this.properties = properties;
        this.validator = validator;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(transactionManager);
    }

    public UUID enqueue(String dedupeKey, RenderParams params, Integer timeoutSeconds, Integer maxRetries) {
        return enqueue(new EnqueueRequest(dedupeKey, params, timeoutSeconds, maxRetries));
    }

    /**
     * Persists a pending job, or returns the id of the pending/running job that already holds the same
     * dedupe key.
     *
     * @throws MalformedRequestException when the request is invalid; nothing is written in that case.
     */
    public UUID enqueue(EnqueueRequest request) {
        validate(request);
        RenderParams params = request.params();
        String dedupeKey = request.dedupeKey() == null || request.dedupeKey().isBlank()
                ? DedupeKeys.derive(params)
                : request.dedupeKey().trim();
        int maxRetries = request.maxRetries() != null
                ? request.maxRetries()
                : properties.getJobs().getDefaultMaxRetries();
        int timeoutSeconds = request.timeoutSeconds() != null
                ? request.timeoutSeconds()
                : (int) properties.getJobs().getDefaultTimeout().toSeconds();

        Optional<UUID> existing = findActiveId(dedupeKey);
        if (existing.isPresent()) {
            LOGGER.info("Duplicate submission dedupeKey={} resolved to jobId={}", dedupeKey, existing.get());
            return existing.get();
        }

        ExportJob job = new ExportJob(UUID.randomUUID(), dedupeKey, params, maxRetries, timeoutSeconds, clock.instant());
        try {
            txTemplate.executeWithoutResult(status -> jobRepo.saveAndFlush(job));
        } catch (DataIntegrityViolationException e) {
            // a concurrent enqueue won the unique active key
            UUID winner = findActiveId(dedupeKey).orElseThrow(() -> e);
            LOGGER.info("Duplicate submission dedupeKey={} lost insert race to jobId={}", dedupeKey, winner);
            return winner;
        }
        LOGGER.info("JOB ENQUEUED jobId={} dedupeKey={} camera={} kind={} maxRetries={} timeout={}s",
                job.getId(), dedupeKey, params.cameraId(), params.kind(), maxRetries, timeoutSeconds);
        return job.getId();
    }

    /**
     * Claims the oldest eligible pending job for {@code workerId}. Rows that another worker is claiming at
     * the same moment are skipped, never waited for.
     */
    @Transactional
    public Optional<ExportJob> claimNext(String workerId) {
        Objects.requireNonNull(workerId, "workerId");
        Instant now = clock.instant();
        Optional<UUID> candidate = jobRepo.lockNextEligibleId(now);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        UUID id = candidate.get();
        if (jobRepo.claim(id, workerId, now) != 1) {
            LOGGER.debug("claim lost jobId={} worker={}", id, workerId);
            return Optional.empty();
        }
        LOGGER.info("JOB CLAIMED jobId={} worker={}", id, workerId);
        return jobRepo.findById(id);
    }

    @Transactional
    public void markDone(UUID jobId, String workerId, String outputPath, String manifestPath) {
        int updated = jobRepo.markDone(jobId, workerId, outputPath, manifestPath, clock.instant());
        if (updated == 0) {
            throw rejected(jobId, ExportJobStatus.DONE, "not running under worker " + workerId);
        }
        LOGGER.info("JOB DONE jobId={} worker={} output={}", jobId, workerId, outputPath);
    }

    public ExportJobStatus markFailed(UUID jobId, String workerId, String error) {
        return markFailed(jobId, workerId, error, true);
    }

    /**
     * Records a failed attempt. A retryable failure with budget left goes back to pending after the
     * backoff delay; anything else is terminal.
     *
     * @return the status the job was moved to.
     */
    @Transactional
    public ExportJobStatus markFailed(UUID jobId, String workerId, String error, boolean retryable) {
        ExportJob job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        boolean budgetLeft = job.getRetryCount() < job.getMaxRetries();
        ExportJobStatus target = retryable && budgetLeft ? ExportJobStatus.PENDING : ExportJobStatus.FAILED;
        if (job.getStatus() != ExportJobStatus.RUNNING || !Objects.equals(workerId, job.getOwningWorker())) {
            throw new InvalidTransitionException(jobId, job.getStatus(), target, "not running under worker " + workerId);
        }

        Instant now = clock.instant();
        String message = truncate(error == null || error.isBlank() ? "unknown error" : error);
        if (target == ExportJobStatus.PENDING) {
            int nextRetry = job.getRetryCount() + 1;
            Instant nextRunAt = backoffPolicy.nextRunAt(nextRetry, now);
            if (jobRepo.requeue(jobId, workerId, job.getRetryCount(), nextRunAt, message, now) == 0) {
                throw rejected(jobId, ExportJobStatus.PENDING, "attempt already reported");
            }
            LOGGER.info("JOB REQUEUED jobId={} retry={}/{} nextRunAt={} error={}",
                    jobId, nextRetry, job.getMaxRetries(), nextRunAt, message);
            return ExportJobStatus.PENDING;
        }

        String finalMessage = retryable
                ? truncate("retries exhausted (" + job.getRetryCount() + "/" + job.getMaxRetries() + "): " + message)
                : message;
        if (jobRepo.markFailed(jobId, workerId, finalMessage, now) == 0) {
            throw rejected(jobId, ExportJobStatus.FAILED, "attempt already reported");
        }
        LOGGER.warn("JOB FAILED jobId={} retries={}/{} error={}", jobId, job.getRetryCount(), job.getMaxRetries(), finalMessage);
        return ExportJobStatus.FAILED;
    }

    /**
     * Cancels a pending or running job. For a running job this only flags it; the owning dispatcher
     * notices on its next heartbeat and aborts the render.
     */
    @Transactional
    public void cancel(UUID jobId) {
        ExportJob job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.getStatus().canTransitionTo(ExportJobStatus.CANCELED)) {
            throw new InvalidTransitionException(jobId, job.getStatus(), ExportJobStatus.CANCELED);
        }
        if (jobRepo.cancel(jobId, clock.instant()) == 0) {
            throw rejected(jobId, ExportJobStatus.CANCELED, null);
        }
        if (job.getStatus() == ExportJobStatus.RUNNING) {
            LOGGER.info("JOB CANCELED jobId={} (abort requested from worker={})", jobId, job.getOwningWorker());
        } else {
            LOGGER.info("JOB CANCELED jobId={}", jobId);
        }
    }

    /**
     * Operator retry of a failed or canceled job. Starts a fresh lifecycle: the retry budget is reset to
     * zero and earlier timestamps, error and outputs are cleared.
     */
    public void retry(UUID jobId) {
        ExportJob job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus() != ExportJobStatus.FAILED && job.getStatus() != ExportJobStatus.CANCELED) {
            throw new InvalidTransitionException(jobId, job.getStatus(), ExportJobStatus.PENDING);
        }
        Optional<UUID> holder = findActiveId(job.getDedupeKey());
        if (holder.isPresent()) {
            throw new InvalidTransitionException(jobId, job.getStatus(), ExportJobStatus.PENDING,
                    "job " + holder.get() + " is already active for dedupe key " + job.getDedupeKey());
        }
        int updated;
        try {
            updated = txTemplate.execute(status -> jobRepo.retry(jobId, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            throw new InvalidTransitionException(jobId, job.getStatus(), ExportJobStatus.PENDING,
                    "another job became active for dedupe key " + job.getDedupeKey());
        }
        if (updated == 0) {
            throw rejected(jobId, ExportJobStatus.PENDING, null);
        }
        LOGGER.info("JOB RETRY REQUESTED jobId={} previousStatus={}", jobId, job.getStatus());
    }

    /**
     * Liveness signal from the owning worker.
     *
     * @return {@code false} when the job is no longer running under {@code workerId}; the render should
     * be abandoned.
     */
    @Transactional
    public boolean heartbeat(UUID jobId, String workerId) {
        return jobRepo.heartbeat(jobId, workerId, clock.instant()) == 1;
    }

    /**
     * Fails running jobs whose owner stopped sending heartbeats, using the same retry budget as a render
     * failure.
     *
     * @return number of jobs recovered.
     */
    public int recoverStale() {
        Duration staleAfter = properties.getWorker().getStaleAfter();
        Instant cutoff = clock.instant().minus(staleAfter);
        int recovered = 0;
        for (ExportJob job : jobRepo.findStaleRunning(cutoff)) {
            Instant lastSeen = job.getHeartbeatAt() != null ? job.getHeartbeatAt() : job.getClaimedAt();
            try {
                ExportJobStatus next = markFailed(job.getId(), job.getOwningWorker(),
                        "worker lease expired (worker=" + job.getOwningWorker() + ", last heartbeat " + lastSeen + ")", true);
                recovered++;
                LOGGER.warn("STALE JOB RECOVERED jobId={} worker={} lastHeartbeat={} next={}",
                        job.getId(), job.getOwningWorker(), lastSeen, next);
            } catch (InvalidTransitionException | JobNotFoundException e) {
                LOGGER.debug("stale recovery skipped jobId={}: {}", job.getId(), e.getMessage());
            }
        }
        return recovered;
    }

    @Transactional(readOnly = true)
    public ExportJobView get(UUID jobId) {
        return jobRepo.findById(jobId)
                .map(ExportJobView::from)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private Optional<UUID> findActiveId(String dedupeKey) {
        return jobRepo.findByActiveDedupeKey(dedupeKey)
                .filter(job -> job.getStatus().isActive())
                .map(ExportJob::getId);
    }

    private RuntimeException rejected(UUID jobId, ExportJobStatus attempted, String reason) {
        return jobRepo.findById(jobId)
                .<RuntimeException>map(j -> new InvalidTransitionException(jobId, j.getStatus(), attempted, reason))
                .orElseGet(() -> new JobNotFoundException(jobId));
    }

    private void validate(EnqueueRequest request) {
        if (request == null) {
            throw new MalformedRequestException("request is required");
        }
        List<String> problems = new ArrayList<>();
        for (ConstraintViolation<EnqueueRequest> violation : validator.validate(request)) {
            problems.add(violation.getPropertyPath() + " " + violation.getMessage());
        }
        RenderParams params = request.params();
        if (params != null && params.windowStart() != null && params.windowEnd() != null
                && !params.windowEnd().isAfter(params.windowStart())) {
            problems.add("params.windowEnd must be after params.windowStart");
        }
        if (params != null && params.segments() != null) {
            for (int i = 0; i < params.segments().size(); i++) {
                SourceSegment segment = params.segments().get(i);
                if (segment != null && segment.start() != null && segment.end() != null
                        && !segment.end().isAfter(segment.start())) {
                    problems.add("params.segments[" + i + "].end must be after start");
                }
            }
        }
        if (request.maxRetries() != null && request.maxRetries() > properties.getJobs().getMaxRetriesLimit()) {
            problems.add("maxRetries must be <= " + properties.getJobs().getMaxRetriesLimit());
        }
        if (request.timeoutSeconds() != null
                && request.timeoutSeconds() > properties.getJobs().getMaxTimeout().toSeconds()) {
            problems.add("timeoutSeconds must be <= " + properties.getJobs().getMaxTimeout().toSeconds());
        }
        if (!problems.isEmpty()) {
            problems.sort(String::compareTo);
            throw new MalformedRequestException(problems);
        }
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
