package com.fragmentdl.exceptions;

/**
 * Timeout, reset or 5xx. Retried inside the fragment worker.
 */
public class TransientNetworkException extends DownloadException {

    public TransientNetworkException(String message, Integer httpStatus, Throwable cause) {
        super(ErrorKind.TRANSIENT_NETWORK, message, httpStatus, cause);
    }
}
