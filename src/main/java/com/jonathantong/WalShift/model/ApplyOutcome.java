package com.jonathantong.WalShift.model;

/**
 * What happened to a single change event
 */
public enum ApplyOutcome {
    UPSERTED,
    DELETED,
    /** Valid envelope, but the image or key the operation needs is missing */
    SKIPPED,
    /** Payload could not be decoded */
    MALFORMED,
    /** The replica rejected the write */
    FAILED;

    public boolean isApplied() {
        return this == UPSERTED || this == DELETED;
    }
}
