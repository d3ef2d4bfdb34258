package com.fragmentdl.models;

import lombok.Getter;

import java.nio.file.Path;

/**
 * One planned byte range {@code [start, end)} of the resource and its download bookkeeping.
 * <p>
 * Mutated only by the worker that owns it. Other threads read the volatile fields.
 */
@Getter
public class Fragment {

    public static final long UNKNOWN_END = -1;

    private final int index;
    private final long start;
    private volatile long end;
    private final Path storePath;

    private volatile FragmentState state = FragmentState.PENDING;
    private volatile long bytesPersisted;
    private volatile int attempts;
    private volatile String lastError;

    public Fragment(int index, long start, long end, Path storePath) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (start < 0) throw new IllegalArgumentException("start must be >= 0");
        if (end != UNKNOWN_END && end < start) {
            throw new IllegalArgumentException("end must be >= start, got [" + start + ", " + end + ")");
        }
        this.index = index;
        this.start = start;
        this.end = end;
        this.storePath = storePath;
    }

    public boolean hasKnownEnd() {
        return end != UNKNOWN_END;
    }

    public long length() {
        return hasKnownEnd() ? end - start : UNKNOWN_END;
    }

    /**
     * @return bytes still to fetch, or {@link #UNKNOWN_END} for a stream of unknown length
     */
    public long remaining() {
        return hasKnownEnd() ? end - start - bytesPersisted : UNKNOWN_END;
    }

    /**
     * First absolute offset not yet persisted.
     */
    public long nextOffset() {
        return start + bytesPersisted;
    }

    public void transitionTo(FragmentState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Fragment " + index + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    public int beginAttempt() {
        transitionTo(FragmentState.DOWNLOADING);
        return ++attempts;
    }

    /**
     * Counts bytes that are already written to the store.
     */
    public void advance(long written) {
        bytesPersisted += written;
    }

    /**
     * Drops persisted progress, used when the server can only restart the stream from the beginning.
     */
    public void rewind() {
        bytesPersisted = 0;
    }

    /**
     * Fixes the end of a stream of unknown length once it reached EOF.
     */
    public void seal() {
        if (!hasKnownEnd()) {
            end = start + bytesPersisted;
        }
    }

    public void recordError(String message) {
        lastError = message;
    }

    @Override
    public String toString() {
        return "Fragment{" + index + " [" + start + ", " + (hasKnownEnd() ? end : "?") + ") " + state
                + ", persisted=" + bytesPersisted + ", attempts=" + attempts + "}";
    }
}
