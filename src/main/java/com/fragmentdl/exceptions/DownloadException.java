package com.fragmentdl.exceptions;

/**
 * Base type for every failure raised by the download engine.
 */
public class DownloadException extends Exception {

    private final ErrorKind kind;
    private final Integer httpStatus;

    public DownloadException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public DownloadException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public DownloadException(ErrorKind kind, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the last HTTP status observed before the failure, or {@code null} when none was received
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
