package org.smileyface.scopedcrawler.processor;

import java.time.Instant;

/**
 * Immutable snapshot of a worker's status.
 */
public final class WorkerStatus {
    private final String id;
    private final WorkerState state;
    private final long processedCount;
    private final long emittedCount;
    private final String lastUrl;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public WorkerStatus(String id, WorkerState state, long processedCount, long emittedCount, String lastUrl,
                        String lastError, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.state = state;
        this.processedCount = processedCount;
        this.emittedCount = emittedCount;
        this.lastUrl = lastUrl;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public WorkerState getState() { return state; }
    public long getProcessedCount() { return processedCount; }
    public long getEmittedCount() { return emittedCount; }
    public String getLastUrl() { return lastUrl; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
