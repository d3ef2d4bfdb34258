package com.fragmentdl.presenters;

import com.fragmentdl.models.ProgressSnapshot;

import java.time.Duration;

/**
 * Renders progress snapshots. Called from a single reporting thread at {@link #refreshInterval()}.
 */
public interface Presenter {

    void render(ProgressSnapshot snapshot);

    Duration refreshInterval();

    /**
     * Called once with the final snapshot after the job reached a terminal state.
     */
    default void finish(ProgressSnapshot snapshot) {
        render(snapshot);
    }
}
