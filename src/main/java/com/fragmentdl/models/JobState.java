package com.fragmentdl.models;

public enum JobState {
    PROBING,
    PLANNING,
    DOWNLOADING,
    FALLBACK_DOWNLOADING,
    MERGING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
