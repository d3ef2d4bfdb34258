package com.fragmentdl.exceptions;

/**
 * A request the server will not satisfy no matter how often it is repeated:
 * 4xx outside the retry allow-list, TLS verification failure, or a range the
 * server refused to honor.
 */
public class NonRetryableRequestException extends DownloadException {

    public NonRetryableRequestException(String message, Integer httpStatus, Throwable cause) {
        super(ErrorKind.NON_RETRYABLE_REQUEST, message, httpStatus, cause);
    }
}
