package com.fragmentdl.exceptions;

public class FragmentExhaustedException extends DownloadException {

    public FragmentExhaustedException(int fragmentIndex, int attempts, TransientNetworkException lastFailure) {
        super(ErrorKind.FRAGMENT_EXHAUSTED,
                "Fragment " + fragmentIndex + " failed after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure.getHttpStatus(), lastFailure);
    }
}
