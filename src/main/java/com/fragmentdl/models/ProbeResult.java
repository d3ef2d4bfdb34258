package com.fragmentdl.models;

/**
 * Outcome of the size/capability probe.
 *
 * @param totalSize      resource length in bytes, or {@link #UNKNOWN_SIZE}
 * @param supportsRanges whether the server answered a byte-range request with exactly that range
 */
public record ProbeResult(long totalSize, boolean supportsRanges) {

    public static final long UNKNOWN_SIZE = -1;

    public ProbeResult {
        if (totalSize < 0) {
            totalSize = UNKNOWN_SIZE;
            supportsRanges = false;
        }
    }

    public static ProbeResult unknownSize() {
        return new ProbeResult(UNKNOWN_SIZE, false);
    }

    public boolean isSizeKnown() {
        return totalSize != UNKNOWN_SIZE;
    }
}
