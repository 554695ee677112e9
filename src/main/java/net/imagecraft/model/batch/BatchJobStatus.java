package net.imagecraft.model.batch;

/**
 * Lifecycle of an asynchronous batch job. Transitions PROCESSING to COMPLETE exactly once.
 */
public enum BatchJobStatus {
    PROCESSING,
    COMPLETE
}
