package com.example.pawluxe_export.service;

import com.example.pawluxe_export.config.ExportQueueProperties;
import com.example.pawluxe_export.model.ExportJob;
import com.example.pawluxe_export.repository.ExportJobRepository;
import com.example.pawluxe_export.support.MutableClock;
import com.example.pawluxe_export.util.BackoffPolicy;
import com.example.pawluxe_export.util.ExportJobStatus;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.pawluxe_export.support.RenderFixtures.T0;
import static com.example.pawluxe_export.support.RenderFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs real competing transactions against the database, so the test itself must stay out of a
 * transaction.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ExportJobService.class, ExportJobStoreConcurrencyTest.TestConfig.class})
class ExportJobStoreConcurrencyTest {

    private static final int WORKERS = 8;

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

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
        jobRepository.deleteAll();
        clock.set(T0);
    }

    @Test
    void singlePendingJobIsClaimedByExactlyOneWorker() throws Exception {
        UUID id = jobService.enqueue("camA-win-1", window("camA", 0, 30), 60, 2);

        List<Optional<ExportJob>> results = race(WORKERS);

        List<ExportJob> winners = results.stream().flatMap(Optional::stream).toList();
        assertThat(winners).hasSize(1);
        assertThat(winners.get(0).getId()).isEqualTo(id);
        assertThat(jobService.get(id).status()).isEqualTo(ExportJobStatus.RUNNING);
    }

    @Test
    void everyJobIsClaimedOnceWhenWorkersOutnumberJobs() throws Exception {
        for (int i = 0; i < 3; i++) {
            jobService.enqueue("camA-win-" + i, window("camA", i * 30, i * 30 + 30), 60, 2);
            clock.advance(Duration.ofMillis(10));
        }

        List<Optional<ExportJob>> results = race(WORKERS);

        List<UUID> claimed = results.stream().flatMap(Optional::stream).map(ExportJob::getId).toList();
        assertThat(claimed).hasSize(3).doesNotHaveDuplicates();
        assertThat(jobRepository.countByStatus(ExportJobStatus.RUNNING)).isEqualTo(3);
        assertThat(jobRepository.countByStatus(ExportJobStatus.PENDING)).isZero();
    }

    @Test
    void concurrentEnqueuesOfOneKeyShareOneJob() throws Exception {
        executor = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> errors = ConcurrentHashMap.newKeySet();
        List<Future<UUID>> futures = new ArrayList<>();
        for (int i = 0; i < WORKERS; i++) {
            futures.add(executor.submit(() -> {
                start.await(5, TimeUnit.SECONDS);
                try {
                    return jobService.enqueue("camB-win-2", window("camB", 0, 30), 60, 2);
                } catch (RuntimeException e) {
                    errors.add(e.toString());
                    return null;
                }
            }));
        }
        start.countDown();
        Set<UUID> ids = ConcurrentHashMap.newKeySet();
        for (Future<UUID> future : futures) {
            UUID id = future.get(20, TimeUnit.SECONDS);
            if (id != null) {
                ids.add(id);
            }
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertThat(errors).isEmpty();
        assertThat(ids).hasSize(1);
        assertThat(jobRepository.count()).isEqualTo(1);
        assertThat(jobService.get(ids.iterator().next()).status()).isEqualTo(ExportJobStatus.PENDING);
    }

    private List<Optional<ExportJob>> race(int workers) throws Exception {
        executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> errors = ConcurrentHashMap.newKeySet();
        List<Future<Optional<ExportJob>>> futures = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            String workerId = "w" + i;
            futures.add(executor.submit(() -> {
                start.await(5, TimeUnit.SECONDS);
                try {
                    return jobService.claimNext(workerId);
                } catch (RuntimeException e) {
                    errors.add(e.toString());
                    return Optional.<ExportJob>empty();
                }
            }));
        }
        start.countDown();
        List<Optional<ExportJob>> results = new ArrayList<>();
        for (Future<Optional<ExportJob>> future : futures) {
            results.add(future.get(20, TimeUnit.SECONDS));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertThat(errors).isEmpty();
        return results;
    }
}
