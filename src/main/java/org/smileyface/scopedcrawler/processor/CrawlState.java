package org.smileyface.scopedcrawler.processor;

/**
 * Lifecycle of a {@link CrawlEngine}.
 */
public enum CrawlState {
    IDLE,
    RUNNING,
    /** Frontier drained with no fetch in flight. */
    COMPLETED,
    /** Page budget reached. */
    BUDGET_EXHAUSTED,
    /** Stopped by the caller. */
    CANCELLED,
    /** Invalid configuration detected at start; nothing was emitted. */
    FAILED;

    public boolean isTerminal() {
        return this != IDLE && this != RUNNING;
    }
}
