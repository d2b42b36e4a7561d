package com.example.pawluxe_export.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Versioned configuration for the export queue. Every default used by producers, the dispatcher,
 * the backoff policy and the renderer is declared here and nowhere else.
 */
@ConfigurationProperties(prefix = "export")
public class ExportQueueProperties {

    public static final Set<Integer> SUPPORTED_CONFIG_VERSIONS = Set.of(1);

    private int configVersion = 1;
    private Worker worker = new Worker();
    private Backoff backoff = new Backoff();
    private Jobs jobs = new Jobs();
    private Render render = new Render();
    private Ingest ingest = new Ingest();

    public int getConfigVersion() {
        return configVersion;
    }

    public void setConfigVersion(int configVersion) {
        this.configVersion = configVersion;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    /**
     * Checks the bound values as a whole.
     *
     * @throws IllegalStateException listing every problem found.
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (!SUPPORTED_CONFIG_VERSIONS.contains(configVersion)) {
            problems.add("export.config-version " + configVersion + " is not supported (supported: " + SUPPORTED_CONFIG_VERSIONS + ")");
        }
        requirePositive(problems, "export.worker.poll-interval", worker.pollInterval);
        requirePositive(problems, "export.worker.heartbeat-interval", worker.heartbeatInterval);
        requirePositive(problems, "export.worker.reap-interval", worker.reapInterval);
        requirePositive(problems, "export.worker.stale-after", worker.staleAfter);
        if (worker.staleAfter != null && worker.heartbeatInterval != null
                && worker.staleAfter.compareTo(worker.heartbeatInterval.multipliedBy(2)) <= 0) {
            problems.add("export.worker.stale-after must exceed twice export.worker.heartbeat-interval");
        }
        requirePositive(problems, "export.backoff.base", backoff.base);
        requirePositive(problems, "export.backoff.max", backoff.max);
        if (backoff.base != null && backoff.max != null && backoff.max.compareTo(backoff.base) < 0) {
            problems.add("export.backoff.max must be >= export.backoff.base");
        }
        if (backoff.jitter < 0.0 || backoff.jitter > 1.0) {
            problems.add("export.backoff.jitter must be within [0, 1]");
        }
        if (jobs.defaultMaxRetries < 0 || jobs.defaultMaxRetries > jobs.maxRetriesLimit) {
            problems.add("export.jobs.default-max-retries must be within [0, max-retries-limit]");
        }
        requirePositive(problems, "export.jobs.default-timeout", jobs.defaultTimeout);
        requirePositive(problems, "export.jobs.max-timeout", jobs.maxTimeout);
        if (jobs.defaultTimeout != null && jobs.maxTimeout != null && jobs.defaultTimeout.compareTo(jobs.maxTimeout) > 0) {
            problems.add("export.jobs.default-timeout must not exceed export.jobs.max-timeout");
        }
        if (render.ffmpegBin == null || render.ffmpegBin.isBlank()) {
            problems.add("export.render.ffmpeg-bin is required");
        }
        if (render.exportDir == null || render.exportDir.isBlank()) {
            problems.add("export.render.export-dir is required");
        }
        requirePositive(problems, "export.render.highlight-per-clip", render.highlightPerClip);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid export configuration: " + String.join("; ", problems));
        }
    }

    private static void requirePositive(List<String> problems, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(name + " must be a positive duration");
        }
    }

    public static class Worker {
        private boolean enabled = true;
        /** Worker identity; derived from host and pid when blank. */
        private String id;
        private Duration pollInterval = Duration.ofMillis(1500);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration staleAfter = Duration.ofMinutes(2);
        private Duration reapInterval = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public Duration getReapInterval() {
            return reapInterval;
        }

        public void setReapInterval(Duration reapInterval) {
            this.reapInterval = reapInterval;
        }
    }

    public static class Backoff {
        private Duration base = Duration.ofSeconds(1);
        private Duration max = Duration.ofSeconds(300);
        /** Fraction of the computed delay that may be removed at random. */
        private double jitter = 0.0;

        public Duration getBase() {
            return base;
        }

        public void setBase(Duration base) {
            this.base = base;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Jobs {
        private int defaultMaxRetries = 3;
        private Duration defaultTimeout = Duration.ofSeconds(600);
        private int maxRetriesLimit = 20;
        private Duration maxTimeout = Duration.ofHours(6);

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public int getMaxRetriesLimit() {
            return maxRetriesLimit;
        }

        public void setMaxRetriesLimit(int maxRetriesLimit) {
            this.maxRetriesLimit = maxRetriesLimit;
        }

        public Duration getMaxTimeout() {
            return maxTimeout;
        }

        public void setMaxTimeout(Duration maxTimeout) {
            this.maxTimeout = maxTimeout;
        }
    }

    public static class Render {
        private String ffmpegBin = "ffmpeg";
        private String exportDir = "storage/exports";
        /** Parent of per-attempt scratch directories; system temp when blank. */
        private String scratchDir;
        private String preset = "veryfast";
        private int crf = 24;
        private Duration mergeGap = Duration.ofMillis(200);
        private Duration minExcerpt = Duration.ofMillis(300);
        private Duration highlightTarget = Duration.ofSeconds(30);
        private Duration highlightPerClip = Duration.ofSeconds(4);

        public String getFfmpegBin() {
            return ffmpegBin;
        }

        public void setFfmpegBin(String ffmpegBin) {
            this.ffmpegBin = ffmpegBin;
        }

        public String getExportDir() {
            return exportDir;
        }

        public void setExportDir(String exportDir) {
            this.exportDir = exportDir;
        }

        public String getScratchDir() {
            return scratchDir;
        }

        public void setScratchDir(String scratchDir) {
            this.scratchDir = scratchDir;
        }

        public String getPreset() {
            return preset;
        }

        public void setPreset(String preset) {
            this.preset = preset;
        }

        public int getCrf() {
            return crf;
        }

        public void setCrf(int crf) {
            this.crf = crf;
        }

        public Duration getMergeGap() {
            return mergeGap;
        }

        public void setMergeGap(Duration mergeGap) {
            this.mergeGap = mergeGap;
        }

        public Duration getMinExcerpt() {
            return minExcerpt;
        }

        public void setMinExcerpt(Duration minExcerpt) {
            this.minExcerpt = minExcerpt;
        }

        public Duration getHighlightTarget() {
            return highlightTarget;
        }

        public void setHighlightTarget(Duration highlightTarget) {
            this.highlightTarget = highlightTarget;
        }

        public Duration getHighlightPerClip() {
            return highlightPerClip;
        }

        public void setHighlightPerClip(Duration highlightPerClip) {
            this.highlightPerClip = highlightPerClip;
        }
    }

    public static class Ingest {
        private Duration padding = Duration.ofSeconds(3);
        private double minConfidence = 0.0;

        public Duration getPadding() {
            return padding;
        }

        public void setPadding(Duration padding) {
            this.padding = padding;
        }

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }
    }
}
