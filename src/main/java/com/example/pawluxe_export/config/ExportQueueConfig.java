package com.example.pawluxe_export.config;

import com.example.pawluxe_export.engine.ClipCommandFactory;
import com.example.pawluxe_export.engine.FfmpegClipCommandFactory;
import com.example.pawluxe_export.engine.FfmpegClipRenderEngine;
import com.example.pawluxe_export.engine.Interfaces.ClipRenderEngine;
import com.example.pawluxe_export.engine.ProcessRunner;
import com.example.pawluxe_export.selector.ExcerptPlanner;
import com.example.pawluxe_export.selector.PlannerConfig;
import com.example.pawluxe_export.service.Interfaces.StorageService;
import com.example.pawluxe_export.service.LocalStorageService;
import com.example.pawluxe_export.util.BackoffPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;

/**
 * Wires the queue, the renderer and the scheduler pool from {@link ExportQueueProperties}.
 * Configuration that does not pass {@link ExportQueueProperties#validate()} stops the context.
 */
@Configuration
@EnableConfigurationProperties(ExportQueueProperties.class)
public class ExportQueueConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExportQueueConfig.class);

    public ExportQueueConfig(ExportQueueProperties properties) {
        properties.validate();
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffPolicy backoffPolicy(ExportQueueProperties properties) {
        ExportQueueProperties.Backoff backoff = properties.getBackoff();
        return new BackoffPolicy(backoff.getBase(), backoff.getMax(), backoff.getJitter());
    }

    @Bean(name = "exportWorkerId")
    public String exportWorkerId(ExportQueueProperties properties) {
        String configured = properties.getWorker().getId();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        String id = host + "-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
        LOGGER.info("Export worker id generated: {}", id);
        return id;
    }

    @Bean(name = "exportTaskScheduler")
    public ThreadPoolTaskScheduler exportTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // poll loop, heartbeat, stale sweep
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("export-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public StorageService storageService(ExportQueueProperties properties) {
        Path base = Path.of(properties.getRender().getExportDir());
        LOGGER.info("Export storage wired: base={}", base.toAbsolutePath());
        return new LocalStorageService(base);
    }

    @Bean
    public ClipCommandFactory clipCommandFactory(ExportQueueProperties properties) {
        ExportQueueProperties.Render render = properties.getRender();
        return new FfmpegClipCommandFactory(render.getFfmpegBin(), render.getPreset(), render.getCrf());
    }

    @Bean
    public ExcerptPlanner excerptPlanner(ExportQueueProperties properties) {
        return new ExcerptPlanner(PlannerConfig.from(properties.getRender()));
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public ClipRenderEngine clipRenderEngine(StorageService storageService,
                                             ClipCommandFactory clipCommandFactory,
                                             ExcerptPlanner excerptPlanner,
                                             ProcessRunner processRunner,
                                             ObjectMapper objectMapper,
                                             Clock clock,
                                             ExportQueueProperties properties) {
        String scratch = properties.getRender().getScratchDir();
        Path scratchRoot = scratch == null || scratch.isBlank() ? null : Path.of(scratch);
        LOGGER.info("Render engine wired: ffmpeg={}, scratch={}",
                properties.getRender().getFfmpegBin(), scratchRoot == null ? "<tmp>" : scratchRoot);
        return new FfmpegClipRenderEngine(storageService, clipCommandFactory, excerptPlanner,
                processRunner, objectMapper, clock, scratchRoot);
    }
}
