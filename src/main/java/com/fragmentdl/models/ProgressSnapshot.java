package com.fragmentdl.models;

import java.time.Instant;
import java.util.List;

/**
 * Immutable point-in-time progress readout. Safe to hand to a renderer as is.
 *
 * @param takenAt          when the snapshot was produced
 * @param fragments        per-fragment view, ordered by index
 * @param percent          overall completion, 0 when the total is unknown
 * @param bytesPerSecond   sum of per-fragment instantaneous speeds
 * @param bytesDownloaded  aggregate bytes, never lower than in an earlier snapshot of the same job
 * @param bytesTotal       resource length, or {@link ProbeResult#UNKNOWN_SIZE}
 */
public record ProgressSnapshot(
        Instant takenAt,
        List<FragmentProgress> fragments,
        double percent,
        double bytesPerSecond,
        long bytesDownloaded,
        long bytesTotal
) {
    public ProgressSnapshot {
        fragments = List.copyOf(fragments);
    }

    public static ProgressSnapshot empty(Instant at) {
        return new ProgressSnapshot(at, List.of(), 0, 0, 0, ProbeResult.UNKNOWN_SIZE);
    }

    public long completedFragments() {
        return fragments.stream().filter(f -> f.state() == FragmentState.COMPLETED).count();
    }

    public record FragmentProgress(
            int index,
            FragmentState state,
            double percent,
            double bytesPerSecond,
            long bytesDownloaded,
            long bytesTotal
    ) {
    }
}
