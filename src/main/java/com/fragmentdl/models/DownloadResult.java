package com.fragmentdl.models;

import com.fragmentdl.exceptions.ErrorKind;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Terminal report of one job.
 *
 * @param state         {@link JobState#COMPLETED} or {@link JobState#FAILED}
 * @param filePath      the merged artifact, {@code null} on failure
 * @param errorKind     root cause category, {@code null} on success
 * @param errorMessage  root cause description, {@code null} on success
 * @param httpStatus    last HTTP status observed with the failure, if any
 * @param fellBack      whether the job finished through the single-stream fallback
 * @param finalSnapshot last progress readout
 * @param elapsed       wall time from probe to terminal state
 */
public record DownloadResult(
        JobState state,
        Path filePath,
        ErrorKind errorKind,
        String errorMessage,
        Integer httpStatus,
        boolean fellBack,
        ProgressSnapshot finalSnapshot,
        Duration elapsed
) {
    public static DownloadResult completed(Path filePath, boolean fellBack, ProgressSnapshot snapshot,
                                           Duration elapsed) {
        return new DownloadResult(JobState.COMPLETED, filePath, null, null, null, fellBack, snapshot, elapsed);
    }

    public static DownloadResult failed(ErrorKind kind, String message, Integer httpStatus,
                                        boolean fellBack, ProgressSnapshot snapshot, Duration elapsed) {
        return new DownloadResult(JobState.FAILED, null, kind, message, httpStatus, fellBack, snapshot, elapsed);
    }

    public boolean success() {
        return state == JobState.COMPLETED;
    }

    public long bytesDownloaded() {
        return finalSnapshot == null ? 0 : finalSnapshot.bytesDownloaded();
    }

    /**
     * Average throughput over the whole job in bytes per second.
     */
    public double averageSpeed() {
        double seconds = elapsed == null ? 0 : elapsed.toNanos() / 1_000_000_000.0;
        return seconds > 0 ? bytesDownloaded() / seconds : 0;
    }
}
