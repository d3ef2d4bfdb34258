package com.fragmentdl.exceptions;

public class DownloadCancelledException extends DownloadException {

    public DownloadCancelledException(String reason) {
        super(ErrorKind.CANCELLED, "Download cancelled: " + reason);
    }
}
