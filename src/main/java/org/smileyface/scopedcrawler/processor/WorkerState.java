package org.smileyface.scopedcrawler.processor;

/**
 * Lifecycle state of a CrawlWorker.
 */
public enum WorkerState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}
