package com.example.pawluxe_export.config;

import com.example.pawluxe_export.service.ExportDispatcher;
import com.example.pawluxe_export.service.StaleJobReaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Registers the poll loop and the stale sweep with fixed delays, so a long render never overlaps the next
 * tick. Off with {@code export.worker.enabled=false} for producer-only processes and tests.
 */
@Configuration
@ConditionalOnProperty(prefix = "export.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExportWorkerConfig implements SchedulingConfigurer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExportWorkerConfig.class);

    private final ExportDispatcher dispatcher;
    private final StaleJobReaper reaper;
    private final ThreadPoolTaskScheduler scheduler;
    private final ExportQueueProperties properties;

    public ExportWorkerConfig(ExportDispatcher dispatcher,
                              StaleJobReaper reaper,
                              @Qualifier("exportTaskScheduler") ThreadPoolTaskScheduler scheduler,
                              ExportQueueProperties properties) {
        this.dispatcher = dispatcher;
        this.reaper = reaper;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        ExportQueueProperties.Worker worker = properties.getWorker();
        registrar.setScheduler(scheduler);
        registrar.addFixedDelayTask(this::pollSafely, worker.getPollInterval());
        registrar.addFixedDelayTask(this::reapSafely, worker.getReapInterval());
        LOGGER.info("Export worker started id={} poll={} reap={} staleAfter={}",
                dispatcher.getWorkerId(), worker.getPollInterval(), worker.getReapInterval(), worker.getStaleAfter());
    }

    private void pollSafely() {
        try {
            dispatcher.poll();
        } catch (RuntimeException e) {
            // keep the loop alive when the store is briefly unreachable
            LOGGER.error("Worker poll failed: {}", e.toString(), e);
        }
    }

    private void reapSafely() {
        try {
            reaper.reap();
        } catch (RuntimeException e) {
            LOGGER.error("Stale sweep failed: {}", e.toString(), e);
        }
    }
}
