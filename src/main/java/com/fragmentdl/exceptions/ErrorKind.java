package com.fragmentdl.exceptions;

/**
 * Categories of terminal failure a caller can tell apart.
 */
public enum ErrorKind {
    PROBE,
    TRANSIENT_NETWORK,
    NON_RETRYABLE_REQUEST,
    FRAGMENT_EXHAUSTED,
    DISK_IO,
    MERGE_INTEGRITY,
    CONFIGURATION,
    CANCELLED
}
