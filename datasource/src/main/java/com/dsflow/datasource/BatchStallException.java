package com.dsflow.datasource;

/**
 * A batch could not be filled: every recent sample was rejected, failed or timed out, or no
 * worker delivered a sample within the stall timeout.
 */
public class BatchStallException extends RuntimeException {
    private final int collected;
    private final int requested;

    public BatchStallException(String message, int collected, int requested) {
        super(message);
        this.collected = collected;
        this.requested = requested;
    }

    public BatchStallException(String message, int collected, int requested, Throwable cause) {
        super(message, cause);
        this.collected = collected;
        this.requested = requested;
    }

    /** Samples gathered before giving up; they are discarded. */
    public int getCollected() {
        return collected;
    }

    public int getRequested() {
        return requested;
    }
}
