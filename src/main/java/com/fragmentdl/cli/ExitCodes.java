package com.fragmentdl.cli;

import com.fragmentdl.exceptions.ErrorKind;

/**
 * Process exit codes. Each failure category maps to its own code.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int USAGE = 1;
    public static final int PROBE_FAILED = 2;
    public static final int DOWNLOAD_FAILED = 3;
    public static final int MERGE_FAILED = 4;
    public static final int CONFIGURATION = 5;
    public static final int DISK_IO = 6;
    public static final int CANCELLED = 130;

    private ExitCodes() {
    }

    public static int forKind(ErrorKind kind) {
        return switch (kind) {
            case PROBE -> PROBE_FAILED;
            case TRANSIENT_NETWORK, NON_RETRYABLE_REQUEST, FRAGMENT_EXHAUSTED -> DOWNLOAD_FAILED;
            case MERGE_INTEGRITY -> MERGE_FAILED;
            case CONFIGURATION -> CONFIGURATION;
            case DISK_IO -> DISK_IO;
            case CANCELLED -> CANCELLED;
        };
    }
}
