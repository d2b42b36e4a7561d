package com.example.pawluxe_export.service;

import com.example.pawluxe_export.config.ExportQueueProperties;
import com.example.pawluxe_export.dto.EnqueueRequest;
import com.example.pawluxe_export.dto.ExportJobView;
import com.example.pawluxe_export.dto.RenderParams;
import com.example.pawluxe_export.exception.InvalidTransitionException;
import com.example.pawluxe_export.exception.JobNotFoundException;
import com.example.pawluxe_export.exception.MalformedRequestException;
import com.example.pawluxe_export.model.ExportJob;
import com.example.pawluxe_export.repository.ExportJobRepository;
import com.example.pawluxe_export.support.MutableClock;
import com.example.pawluxe_export.support.RenderFixtures;
import com.example.pawluxe_export.util.BackoffPolicy;
import com.example.pawluxe_export.util.ClipKind;
import com.example.pawluxe_export.util.DedupeKeys;
import com.example.pawluxe_export.util.ExportJobStatus;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.example.pawluxe_export.support.RenderFixtures.T0;
import static com.example.pawluxe_export.support.RenderFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import({ExportJobService.class, ExportJobServiceTest.TestConfig.class})
class ExportJobServiceTest {

    @TestConfiguration
    static class TestConfig {
        @Bean
        MutableClock testClock() {
            return new MutableClock(T0);
        }

        @Bean
        BackoffPolicy backoffPolicy() {
            return BackoffPolicy.withoutJitter(Duration.ofSeconds(1), Duration.ofSeconds(300));
        }

        @Bean
        ExportQueueProperties exportQueueProperties() {
            return new ExportQueueProperties();
        }

        @Bean
        Validator validator() {
            return Validation.buildDefaultValidatorFactory().getValidator();
        }
    }

    @Autowired
    private ExportJobService jobService;

    @Autowired
    private ExportJobRepository jobRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(T0);
    }

    @Test
    void enqueueReturnsSameJobWhileKeyIsActive() {
        UUID first = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);
        UUID second = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);

        assertThat(second).isEqualTo(first);
        assertThat(jobRepository.count()).isEqualTo(1);
        assertThat(jobService.get(first).status()).isEqualTo(ExportJobStatus.PENDING);
    }

    @Test
    void enqueueAfterTerminalStateCreatesNewJob() {
        UUID first = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);
        jobService.claimNext("w1").orElseThrow();
        jobService.markDone(first, "w1", "/exports/a.mp4", "/exports/a.json");

        UUID second = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);

        assertThat(second).isNotEqualTo(first);
        assertThat(jobService.get(first).status()).isEqualTo(ExportJobStatus.DONE);
        assertThat(jobService.get(second).status()).isEqualTo(ExportJobStatus.PENDING);
    }

    @Test
    void enqueueDerivesKeyAndDefaultsWhenOmitted() {
        RenderParams params = window("camA", 10, 40);
        UUID id = jobService.enqueue(EnqueueRequest.of(params));

        ExportJobView view = jobService.get(id);
        assertThat(view.dedupeKey()).isEqualTo(DedupeKeys.derive(params));
        assertThat(view.maxRetries()).isEqualTo(3);
        assertThat(view.timeoutSeconds()).isEqualTo(600);
        assertThat(view.retryCount()).isZero();
        assertThat(view.createdAt()).isEqualTo(T0);
    }

    @Test
    void malformedRequestIsRejectedWithoutWritingARow() {
        RenderParams backwards = new RenderParams("camA", T0.plusSeconds(30), T0, ClipKind.FULL,
                window("camA", 0, 30).segments(), null, true);
        RenderParams noSegments = new RenderParams("camA", T0, T0.plusSeconds(30), ClipKind.FULL,
                List.of(), null, true);

        MalformedRequestException ex = assertThrows(MalformedRequestException.class,
                () -> jobService.enqueue("k1", backwards, 60, 1));
        assertThat(ex.getViolations()).anyMatch(v -> v.contains("windowEnd"));

        assertThrows(MalformedRequestException.class, () -> jobService.enqueue("k2", noSegments, 60, 1));
        assertThrows(MalformedRequestException.class, () -> jobService.enqueue("k3", window("camA", 0, 30), 0, 1));
        assertThrows(MalformedRequestException.class, () -> jobService.enqueue("k4", window("camA", 0, 30), 60, -1));
        assertThrows(MalformedRequestException.class, () -> jobService.enqueue("k5", window("camA", 0, 30), 60, 21));
        assertThrows(MalformedRequestException.class, () -> jobService.enqueue(null));

        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void retryableFailuresBackOffUntilBudgetIsExhausted() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);

        assertThat(jobService.claimNext("w1")).map(ExportJob::getId).contains(id);
        assertThat(jobService.markFailed(id, "w1", "ffmpeg exited 1")).isEqualTo(ExportJobStatus.PENDING);
        ExportJobView afterFirst = jobService.get(id);
        assertThat(afterFirst.retryCount()).isEqualTo(1);
        assertThat(afterFirst.nextRunAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(afterFirst.errorMessage()).isEqualTo("ffmpeg exited 1");

        // not eligible before the backoff delay has elapsed
        assertThat(jobService.claimNext("w1")).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        assertThat(jobService.claimNext("w1")).isPresent();
        assertThat(jobService.markFailed(id, "w1", "ffmpeg exited 1")).isEqualTo(ExportJobStatus.PENDING);
        assertThat(jobService.get(id).retryCount()).isEqualTo(2);
        assertThat(jobService.get(id).nextRunAt()).isEqualTo(T0.plusSeconds(3));

        clock.advance(Duration.ofSeconds(2));
        assertThat(jobService.claimNext("w1")).isPresent();
        assertThat(jobService.markFailed(id, "w1", "ffmpeg exited 1")).isEqualTo(ExportJobStatus.FAILED);

        ExportJobView failed = jobService.get(id);
        assertThat(failed.status()).isEqualTo(ExportJobStatus.FAILED);
        assertThat(failed.retryCount()).isEqualTo(2);
        assertThat(failed.finishedAt()).isNotNull();
        assertThat(failed.errorMessage()).startsWith("retries exhausted (2/2)").contains("ffmpeg exited 1");

        clock.advance(Duration.ofHours(1));
        assertThat(jobService.claimNext("w1")).isEmpty();
    }

    @Test
    void singleRetryThenFailure() {
        UUID j1 = jobService.enqueue("camA-win-1", window("camA", 0, 30), 5, 1);

        assertThat(jobService.claimNext("w1")).map(ExportJob::getId).contains(j1);
        jobService.markFailed(j1, "w1", "render failed");
        ExportJobView requeued = jobService.get(j1);
        assertThat(requeued.status()).isEqualTo(ExportJobStatus.PENDING);
        assertThat(requeued.retryCount()).isEqualTo(1);
        assertThat(requeued.nextRunAt()).isNotNull();

        clock.set(requeued.nextRunAt());
        assertThat(jobService.claimNext("w1")).map(ExportJob::getId).contains(j1);
        assertThat(jobService.markFailed(j1, "w1", "render failed")).isEqualTo(ExportJobStatus.FAILED);
        assertThat(jobService.get(j1).retryCount()).isEqualTo(1);
    }

    @Test
    void nonRetryableFailureIsTerminalRightAway() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 3);
        jobService.claimNext("w1").orElseThrow();

        assertThat(jobService.markFailed(id, "w1", "no overlapping footage", false)).isEqualTo(ExportJobStatus.FAILED);

        ExportJobView view = jobService.get(id);
        assertThat(view.retryCount()).isZero();
        assertThat(view.errorMessage()).isEqualTo("no overlapping footage");
    }

    @Test
    void claimMarksRunningAndKeepsFirstStartTime() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);

        ExportJob claimed = jobService.claimNext("w1").orElseThrow();
        assertThat(claimed.getStatus()).isEqualTo(ExportJobStatus.RUNNING);
        assertThat(claimed.getOwningWorker()).isEqualTo("w1");
        assertThat(claimed.getStartedAt()).isEqualTo(T0);

        jobService.markFailed(id, "w1", "boom");
        clock.advance(Duration.ofSeconds(5));
        ExportJob again = jobService.claimNext("w2").orElseThrow();

        assertThat(again.getOwningWorker()).isEqualTo("w2");
        assertThat(again.getStartedAt()).isEqualTo(T0);
        assertThat(again.getClaimedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(again.getErrorMessage()).isNull();
    }

    @Test
    void claimTakesOldestEligibleJobFirst() {
        UUID older = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);
        clock.advance(Duration.ofSeconds(1));
        UUID newer = jobService.enqueue("camB-win-1", window("camB", 0, 30), 60, 2);

        assertThat(jobService.claimNext("w1")).map(ExportJob::getId).contains(older);
        assertThat(jobService.claimNext("w2")).map(ExportJob::getId).contains(newer);
        assertThat(jobService.claimNext("w3")).isEmpty();
    }

    @Test
    void canceledPendingJobIsNeverClaimed() {
        UUID id = jobService.enqueue("camB-win-2", window("camB", 60, 90), 60, 2);

        jobService.cancel(id);

        assertThat(jobService.claimNext("w1")).isEmpty();
        ExportJobView view = jobService.get(id);
        assertThat(view.status()).isEqualTo(ExportJobStatus.CANCELED);
        assertThat(view.canceledAt()).isEqualTo(T0);
        assertThrows(InvalidTransitionException.class, () -> jobService.cancel(id));
    }

    @Test
    void cancelingRunningJobRevokesTheWorker() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);
        jobService.claimNext("w1").orElseThrow();
        assertThat(jobService.heartbeat(id, "w1")).isTrue();

        jobService.cancel(id);

        assertThat(jobService.heartbeat(id, "w1")).isFalse();
        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> jobService.markDone(id, "w1", "/exports/a.mp4", "/exports/a.json"));
        assertThat(ex.getCurrent()).isEqualTo(ExportJobStatus.CANCELED);
        assertThat(jobService.get(id).outputPath()).isNull();
    }

    @Test
    void doneJobIsImmutable() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);
        jobService.claimNext("w1").orElseThrow();
        jobService.markDone(id, "w1", "/exports/a.mp4", "/exports/a.json");

        assertThrows(InvalidTransitionException.class, () -> jobService.cancel(id));
        assertThrows(InvalidTransitionException.class, () -> jobService.retry(id));
        assertThrows(InvalidTransitionException.class, () -> jobService.markFailed(id, "w1", "late"));
        assertThrows(InvalidTransitionException.class, () -> jobService.markDone(id, "w1", "/x", "/y"));

        ExportJobView view = jobService.get(id);
        assertThat(view.status()).isEqualTo(ExportJobStatus.DONE);
        assertThat(view.outputPath()).isEqualTo("/exports/a.mp4");
        assertThat(view.manifestPath()).isEqualTo("/exports/a.json");
    }

    @Test
    void onlyTheOwningWorkerCanReportOutcome() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);
        jobService.claimNext("w1").orElseThrow();

        assertThrows(InvalidTransitionException.class, () -> jobService.markDone(id, "w2", "/x", "/y"));
        assertThrows(InvalidTransitionException.class, () -> jobService.markFailed(id, "w2", "boom"));
        assertThat(jobService.heartbeat(id, "w2")).isFalse();

        ExportJobView view = jobService.get(id);
        assertThat(view.status()).isEqualTo(ExportJobStatus.RUNNING);
        assertThat(view.retryCount()).isZero();
    }

    @Test
    void unknownJobIsReportedAsNotFound() {
        UUID missing = UUID.randomUUID();

        assertThrows(JobNotFoundException.class, () -> jobService.get(missing));
        assertThrows(JobNotFoundException.class, () -> jobService.cancel(missing));
        assertThrows(JobNotFoundException.class, () -> jobService.retry(missing));
        assertThrows(JobNotFoundException.class, () -> jobService.markFailed(missing, "w1", "boom"));
        assertThrows(JobNotFoundException.class, () -> jobService.markDone(missing, "w1", "/x", "/y"));
    }

    @Test
    void operatorRetryStartsFreshLifecycle() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 1);
        jobService.claimNext("w1").orElseThrow();
        jobService.markFailed(id, "w1", "corrupt segment", false);

        clock.advance(Duration.ofMinutes(5));
        jobService.retry(id);

        ExportJobView view = jobService.get(id);
        assertThat(view.status()).isEqualTo(ExportJobStatus.PENDING);
        assertThat(view.retryCount()).isZero();
        assertThat(view.errorMessage()).isNull();
        assertThat(view.startedAt()).isNull();
        assertThat(view.finishedAt()).isNull();
        assertThat(jobService.claimNext("w2")).map(ExportJob::getId).contains(id);
    }

    @Test
    void retryOfCanceledJobIsAllowed() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 1);
        jobService.cancel(id);

        jobService.retry(id);

        ExportJobView view = jobService.get(id);
        assertThat(view.status()).isEqualTo(ExportJobStatus.PENDING);
        assertThat(view.canceledAt()).isNull();
    }

    @Test
    void retryIsRefusedWhileAnotherJobHoldsTheKey() {
        UUID failed = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 0);
        jobService.claimNext("w1").orElseThrow();
        jobService.markFailed(failed, "w1", "boom");
        UUID replacement = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 0);

        assertThat(replacement).isNotEqualTo(failed);
        assertThrows(InvalidTransitionException.class, () -> jobService.retry(failed));
        assertThrows(InvalidTransitionException.class, () -> jobService.retry(replacement));
        assertThat(jobService.get(failed).status()).isEqualTo(ExportJobStatus.FAILED);
    }

    @Test
    void staleRunningJobIsRecoveredThroughRetryBudget() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 1);
        jobService.claimNext("w1").orElseThrow();

        clock.advance(Duration.ofMinutes(3));
        assertThat(jobService.recoverStale()).isEqualTo(1);

        ExportJobView view = jobService.get(id);
        assertThat(view.status()).isEqualTo(ExportJobStatus.PENDING);
        assertThat(view.retryCount()).isEqualTo(1);
        assertThat(view.errorMessage()).contains("worker lease expired");
        assertThat(jobService.heartbeat(id, "w1")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        jobService.claimNext("w2").orElseThrow();
        clock.advance(Duration.ofMinutes(3));
        assertThat(jobService.recoverStale()).isEqualTo(1);
        assertThat(jobService.get(id).status()).isEqualTo(ExportJobStatus.FAILED);
    }

    @Test
    void heartbeatKeepsJobAlive() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 1);
        jobService.claimNext("w1").orElseThrow();

        clock.advance(Duration.ofSeconds(100));
        assertThat(jobService.heartbeat(id, "w1")).isTrue();
        clock.advance(Duration.ofSeconds(100));

        assertThat(jobService.recoverStale()).isZero();
        assertThat(jobService.get(id).status()).isEqualTo(ExportJobStatus.RUNNING);
    }

    @Test
    void claimNextOnEmptyQueueReturnsNothing() {
        Optional<ExportJob> claimed = jobService.claimNext("w1");

        assertThat(claimed).isEmpty();
        assertThat(jobRepository.countByStatus(ExportJobStatus.RUNNING)).isZero();
    }

    @Test
    void errorMessageIsTruncated() {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 0);
        jobService.claimNext("w1").orElseThrow();

        jobService.markFailed(id, "w1", "x".repeat(5000), false);

        assertThat(jobService.get(id).errorMessage()).hasSize(2000);
    }

    @Test
    void sourceEventIdIsStoredAsBackReference() {
        RenderParams base = RenderFixtures.window("camA", 0, 30);
        RenderParams params = new RenderParams(base.cameraId(), base.windowStart(), base.windowEnd(), base.kind(),
                base.segments(), "evt-42", true);

        UUID id = jobService.enqueue(EnqueueRequest.of(params));

        assertThat(jobService.get(id).sourceEventId()).isEqualTo("evt-42");
        assertThat(jobRepository.findById(id)).map(ExportJob::getRenderParams).contains(params);
    }

    @Test
    void timestampsFollowTheClock() {
        Instant submitted = T0.plusSeconds(42);
        clock.set(submitted);
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 1);
        clock.advance(Duration.ofSeconds(8));
        jobService.claimNext("w1").orElseThrow();
        clock.advance(Duration.ofSeconds(10));
        jobService.markDone(id, "w1", "/exports/a.mp4", "/exports/a.json");

        ExportJobView view = jobService.get(id);
        assertThat(view.createdAt()).isEqualTo(submitted);
        assertThat(view.startedAt()).isEqualTo(submitted.plusSeconds(8));
        assertThat(view.finishedAt()).isEqualTo(submitted.plusSeconds(18));
    }
}
