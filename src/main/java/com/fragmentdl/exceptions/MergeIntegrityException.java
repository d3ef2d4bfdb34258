package com.fragmentdl.exceptions;

public class MergeIntegrityException extends DownloadException {

    private final long expectedBytes;
    private final long writtenBytes;

    public MergeIntegrityException(long expectedBytes, long writtenBytes) {
        super(ErrorKind.MERGE_INTEGRITY,
                "Merged size mismatch. Expected: " + expectedBytes + ", Actual: " + writtenBytes);
        this.expectedBytes = expectedBytes;
        this.writtenBytes = writtenBytes;
    }

    public long getExpectedBytes() {
        return expectedBytes;
    }

    public long getWrittenBytes() {
        return writtenBytes;
    }
}
