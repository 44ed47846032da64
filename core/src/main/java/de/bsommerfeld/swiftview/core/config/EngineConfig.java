package de.bsommerfeld.swiftview.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import de.bsommerfeld.swiftview.core.domain.TargetSize;

/**
 * Engine tuning knobs, persisted as {@code engine.json} in the app data
 * directory. Every field carries a default so a missing or partial file
 * still yields a working engine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    private static final int CORES = Runtime.getRuntime().availableProcessors();

    @JsonProperty("thumbnailWidth")
    @JsonPropertyDescription("Thumbnail bounding box width in pixels (default: 256)")
    private int thumbnailWidth = 256;

    @JsonProperty("thumbnailHeight")
    @JsonPropertyDescription("Thumbnail bounding box height in pixels (default: 195)")
    private int thumbnailHeight = 195;

    @JsonProperty("ioThreads")
    @JsonPropertyDescription("Scheduling/IO pool size (default: between 2 and 4)")
    private int ioThreads = Math.max(2, Math.min(4, CORES));

    @JsonProperty("decodeWorkers")
    @JsonPropertyDescription("Concurrent decode slots (default: core count)")
    private int decodeWorkers = CORES;

    @JsonProperty("processIsolation")
    @JsonPropertyDescription("Decode in separate worker processes (default: true)")
    private boolean processIsolation = true;

    @JsonProperty("workerHeapMb")
    @JsonPropertyDescription("Max heap of each decode worker process in MB (default: 512)")
    private int workerHeapMb = 512;

    @JsonProperty("busyTimeoutMs")
    @JsonPropertyDescription("SQLite lock wait per attempt in ms (default: 5000)")
    private int busyTimeoutMs = 5000;

    @JsonProperty("writeRetries")
    @JsonPropertyDescription("Retries of a store write on busy/locked (default: 3)")
    private int writeRetries = 3;

    @JsonProperty("retryBackoffMs")
    @JsonPropertyDescription("Initial retry backoff in ms, doubled per attempt (default: 50)")
    private long retryBackoffMs = 50;

    @JsonProperty("pumpBatchSize")
    @JsonPropertyDescription("Missing thumbnails requested per pump tick (default: 8)")
    private int pumpBatchSize = 8;

    @JsonProperty("pumpIntervalMs")
    @JsonPropertyDescription("Delay between pump ticks in ms (default: 15)")
    private long pumpIntervalMs = 15;

    @JsonProperty("scanChunkSize")
    @JsonPropertyDescription("Paths per bulk scan query (default: 800)")
    private int scanChunkSize = 800;

    @JsonProperty("scanReadPolicy")
    @JsonPropertyDescription("OPERATOR or DIRECT reads for the folder-open bulk scan (default: OPERATOR)")
    private ReadPolicy scanReadPolicy = ReadPolicy.OPERATOR;

    @JsonProperty("probeReadPolicy")
    @JsonPropertyDescription("OPERATOR or DIRECT reads for single thumbnail lookups (default: DIRECT)")
    private ReadPolicy probeReadPolicy = ReadPolicy.DIRECT;

    public TargetSize thumbnailSize() {
        return TargetSize.of(thumbnailWidth, thumbnailHeight);
    }

    public int getThumbnailWidth() {
        return thumbnailWidth;
    }

    public void setThumbnailWidth(int thumbnailWidth) {
        this.thumbnailWidth = thumbnailWidth;
    }

    public int getThumbnailHeight() {
        return thumbnailHeight;
    }

    public void setThumbnailHeight(int thumbnailHeight) {
        this.thumbnailHeight = thumbnailHeight;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public void setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
    }

    public int getDecodeWorkers() {
        return decodeWorkers;
    }

    public void setDecodeWorkers(int decodeWorkers) {
        this.decodeWorkers = decodeWorkers;
    }

    public boolean isProcessIsolation() {
        return processIsolation;
    }

    public void setProcessIsolation(boolean processIsolation) {
        this.processIsolation = processIsolation;
    }

    public int getWorkerHeapMb() {
        return workerHeapMb;
    }

    public void setWorkerHeapMb(int workerHeapMb) {
        this.workerHeapMb = workerHeapMb;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public int getWriteRetries() {
        return writeRetries;
    }

    public void setWriteRetries(int writeRetries) {
        this.writeRetries = writeRetries;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public int getPumpBatchSize() {
        return pumpBatchSize;
    }

    public void setPumpBatchSize(int pumpBatchSize) {
        this.pumpBatchSize = pumpBatchSize;
    }

    public long getPumpIntervalMs() {
        return pumpIntervalMs;
    }

    public void setPumpIntervalMs(long pumpIntervalMs) {
        this.pumpIntervalMs = pumpIntervalMs;
    }

    public int getScanChunkSize() {
        return scanChunkSize;
    }

    public void setScanChunkSize(int scanChunkSize) {
        this.scanChunkSize = scanChunkSize;
    }

    public ReadPolicy getScanReadPolicy() {
        return scanReadPolicy;
    }

    public void setScanReadPolicy(ReadPolicy scanReadPolicy) {
        this.scanReadPolicy = scanReadPolicy;
    }

    public ReadPolicy getProbeReadPolicy() {
        return probeReadPolicy;
    }

    public void setProbeReadPolicy(ReadPolicy probeReadPolicy) {
        this.probeReadPolicy = probeReadPolicy;
    }
}
