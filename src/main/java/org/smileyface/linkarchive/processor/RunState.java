package org.smileyface.linkarchive.processor;

/**
 * Lifecycle state of a ScrapeOrchestrator run.
 */
public enum RunState {
    NEW,
    RUNNING,
    CANCELLED,
    COMPLETED,
    ERROR
}
