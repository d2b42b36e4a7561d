package com.example.pawluxe_export.engine;

import com.example.pawluxe_export.dto.ExportManifest;
import com.example.pawluxe_export.dto.RenderJob;
import com.example.pawluxe_export.dto.RenderParams;
import com.example.pawluxe_export.dto.RenderResult;
import com.example.pawluxe_export.engine.Interfaces.ClipRenderEngine;
import com.example.pawluxe_export.exception.PermanentRenderFailureException;
import com.example.pawluxe_export.exception.RenderCanceledException;
import com.example.pawluxe_export.exception.RenderException;
import com.example.pawluxe_export.exception.RenderTimeoutException;
import com.example.pawluxe_export.exception.TransientRenderFailureException;
import com.example.pawluxe_export.selector.Excerpt;
import com.example.pawluxe_export.selector.ExcerptPlanner;
import com.example.pawluxe_export.service.Interfaces.StorageService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders an export as trim-per-excerpt followed by a concat, inside a scratch directory that is removed on
 * every exit path. The manifest is always published; the video only when requested.
 */
public class FfmpegClipRenderEngine implements ClipRenderEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegClipRenderEngine.class);

    private final StorageService storageService;
    private final ClipCommandFactory commands;
    private final ExcerptPlanner planner;
    private final ProcessRunner processRunner;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final @Nullable Path scratchRoot;

    public FfmpegClipRenderEngine(StorageService storageService,
                                  ClipCommandFactory commands,
                                  ExcerptPlanner planner,
                                  ProcessRunner processRunner,
                                  ObjectMapper mapper,
                                  Clock clock,
                                  @Nullable Path scratchRoot) {
        this.storageService = storageService;
        this.commands = commands;
        this.planner = planner;
        this.processRunner = processRunner;
        this.mapper = mapper;
        this.clock = clock;
        this.scratchRoot = scratchRoot != null ? scratchRoot.toAbsolutePath().normalize() : null;
    }

    @Override
    public RenderResult render(RenderJob job, RenderCancellation cancellation) throws RenderException {
        try {
            return renderInScratch(job, cancellation);
        } catch (RenderException e) {
            logCleanupFailures(job, e);
            throw e;
        }
    }

    private RenderResult renderInScratch(RenderJob job, RenderCancellation cancellation) throws RenderException {
        long deadline = System.nanoTime() + job.timeout().toNanos();
        RenderParams params = job.params();

        List<Excerpt> excerpts = planner.plan(params);
        if (excerpts.isEmpty()) {
            throw new PermanentRenderFailureException("No recorded footage overlaps window "
                    + params.windowStart() + " - " + params.windowEnd() + " of camera " + params.cameraId());
        }
        // recordings may still be flushing to disk; a later attempt can find them
        List<String> missing = excerpts.stream()
                .map(Excerpt::segmentPath)
                .filter(path -> !Files.isRegularFile(Path.of(path)))
                .distinct()
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new TransientRenderFailureException("Recorded segment files not available for job "
                    + job.jobId() + ": " + String.join(", ", missing));
        }
        double totalSeconds = excerpts.stream().mapToDouble(Excerpt::durationSeconds).sum();

        try (ScratchDirectory scratch = openScratch(job)) {
            LOGGER.debug("render jobId={} scratch={} excerpts={}", job.jobId(), scratch.path(), excerpts.size());
            Path manifestTmp = scratch.resolve("manifest.json");
            ExportManifest manifest = new ExportManifest(job.jobId(), params.cameraId(), params.windowStart(),
                    params.windowEnd(), params.kind(), params.sourceEventId(), clock.instant(), excerpts);
            mapper.writerWithDefaultPrettyPrinter().writeValue(manifestTmp.toFile(), manifest);

            Path videoTmp = params.shouldRenderVideo()
                    ? renderVideo(job, excerpts, scratch, deadline, cancellation)
                    : null;

            if (cancellation != null && cancellation.isCancelled()) {
                throw new RenderCanceledException("render aborted before publish");
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new RenderTimeoutException(job.timeout());
            }

            Path manifestOut = storageService.manifestPath(job.jobId(), job.attemptTag());
            storageService.publish(manifestTmp, manifestOut);
            Path output = manifestOut;
            if (videoTmp != null) {
                output = storageService.videoPath(job.jobId(), job.attemptTag());
                storageService.publish(videoTmp, output);
            }
            LOGGER.info("render finished jobId={} attempt={} excerpts={} seconds={} output={}",
                    job.jobId(), job.attemptTag(), excerpts.size(),
                    String.format(Locale.ROOT, "%.1f", totalSeconds), output);
            return new RenderResult(output, manifestOut, excerpts.size(), totalSeconds);
        } catch (IOException e) {
            throw new TransientRenderFailureException("Render I/O failed for job " + job.jobId() + ": " + e.getMessage(), e);
        }
    }

    ScratchDirectory openScratch(RenderJob job) throws IOException {
        return ScratchDirectory.create(scratchRoot, "export-" + job.jobId() + "-");
    }

    // a failed cleanup behind a render failure only shows up as a suppressed exception
    private static void logCleanupFailures(RenderJob job, RenderException e) {
        for (Throwable suppressed : e.getSuppressed()) {
            if (suppressed instanceof IOException) {
                LOGGER.warn("scratch cleanup failed jobId={} after {}: {}",
                        job.jobId(), e.getClass().getSimpleName(), suppressed.getMessage());
            }
        }
    }

    private Path renderVideo(RenderJob job, List<Excerpt> excerpts, ScratchDirectory scratch, long deadline,
                             RenderCancellation cancellation) throws RenderException, IOException {
        List<Path> parts = new ArrayList<>();
        for (int i = 0; i < excerpts.size(); i++) {
            Path part = scratch.resolve(String.format(Locale.ROOT, "part_%04d.mp4", i));
            processRunner.run(commands.trim(excerpts.get(i), part), deadline, job.timeout(), cancellation);
            parts.add(part);
        }

        Path listFile = scratch.resolve("concat.txt");
        String list = parts.stream()
                .map(p -> "file '" + p.toAbsolutePath() + "'")
                .collect(Collectors.joining("\n"));
        Files.writeString(listFile, list, StandardCharsets.UTF_8);

        Path out = scratch.resolve("export.mp4");
        processRunner.run(commands.concat(listFile, out), deadline, job.timeout(), cancellation);
        if (!Files.isRegularFile(out)) {
            throw new TransientRenderFailureException("Renderer produced no output for job " + job.jobId());
        }
        return out;
    }
}
