package com.example.pawluxe_export.model;

import com.example.pawluxe_export.dto.RenderParams;
import com.example.pawluxe_export.util.ExportJobStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A durable render request. Status changes go through the conditional updates in
 * {@link com.example.pawluxe_export.repository.ExportJobRepository}; the setters exist for inserts and
 * for tests.
 */
@Entity
@Table(
        name = "export_job",
        indexes = {
                @Index(name = "idx_export_job_claim", columnList = "status, next_run_at, created_at"),
                @Index(name = "idx_export_job_dedupe", columnList = "dedupe_key")
        }
)
public class ExportJob {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "dedupe_key", nullable = false, length = 255)
    private String dedupeKey;

    // equals dedupeKey while PENDING/RUNNING, null otherwise; unique in the table
    @Column(name = "active_dedupe_key", length = 255)
    private String activeDedupeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ExportJobStatus status = ExportJobStatus.PENDING;

    @Convert(converter = RenderParamsConverter.class)
    @Column(name = "render_params", nullable = false)
    private RenderParams renderParams;

    @Column(name = "source_event_id", length = 64)
    private String sourceEventId;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "timeout_seconds", nullable = false)
    private int timeoutSeconds;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "owning_worker", length = 128)
    private String owningWorker;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "output_path", length = 1024)
    private String outputPath;

    @Column(name = "manifest_path", length = 1024)
    private String manifestPath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    protected ExportJob() {}

    public ExportJob(UUID id, String dedupeKey, RenderParams renderParams, int maxRetries, int timeoutSeconds, Instant createdAt) {
        this.id = id;
        this.dedupeKey = dedupeKey;
        this.activeDedupeKey = dedupeKey;
        this.renderParams = renderParams;
        this.sourceEventId = renderParams != null ? renderParams.sourceEventId() : null;
        this.maxRetries = maxRetries;
        this.timeoutSeconds = timeoutSeconds;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = ExportJobStatus.PENDING;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getDedupeKey() {
        return dedupeKey;
    }

    public void setDedupeKey(String dedupeKey) {
        this.dedupeKey = dedupeKey;
    }

    public String getActiveDedupeKey() {
        return activeDedupeKey;
    }

    public void setActiveDedupeKey(String activeDedupeKey) {
        this.activeDedupeKey = activeDedupeKey;
    }

    public ExportJobStatus getStatus() {
        return status;
    }

    public void setStatus(ExportJobStatus status) {
        this.status = status;
    }

    public RenderParams getRenderParams() {
        return renderParams;
    }

    public void setRenderParams(RenderParams renderParams) {
        this.renderParams = renderParams;
    }

    public String getSourceEventId() {
        return sourceEventId;
    }

    public void setSourceEventId(String sourceEventId) {
        this.sourceEventId = sourceEventId;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public String getOwningWorker() {
        return owningWorker;
    }

    public void setOwningWorker(String owningWorker) {
        this.owningWorker = owningWorker;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public String getManifestPath() {
        return manifestPath;
    }

    public void setManifestPath(String manifestPath) {
        this.manifestPath = manifestPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(Instant claimedAt) {
        this.claimedAt = claimedAt;
    }

    public Instant getHeartbeatAt() {
        return heartbeatAt;
    }

    public void setHeartbeatAt(Instant heartbeatAt) {
        this.heartbeatAt = heartbeatAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public Instant getCanceledAt() {
        return canceledAt;
    }

    public void setCanceledAt(Instant canceledAt) {
        this.canceledAt = canceledAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
