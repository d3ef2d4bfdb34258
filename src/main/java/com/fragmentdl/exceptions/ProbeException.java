package com.fragmentdl.exceptions;

/**
 * The size/capability probe could not reach the resource or got a non-success status.
 */
public class ProbeException extends DownloadException {

    public ProbeException(String message, Integer httpStatus, Throwable cause) {
        super(ErrorKind.PROBE, message, httpStatus, cause);
    }
}
