package com.fragmentdl.models;

/**
 * Lifecycle of one fragment. Monotonic apart from the
 * {@link #DOWNLOADING} / {@link #RETRY_WAITING} cycle.
 */
public enum FragmentState {
    PENDING,
    DOWNLOADING,
    RETRY_WAITING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(FragmentState next) {
        return switch (this) {
            case PENDING -> next == DOWNLOADING || next == COMPLETED || next == FAILED;
            case DOWNLOADING -> next == RETRY_WAITING || next == COMPLETED || next == FAILED;
            case RETRY_WAITING -> next == DOWNLOADING || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
