package com.fragmentdl.exceptions;

import java.io.IOException;

/**
 * Local storage failure (no space left, permission denied). Stops the job without fallback.
 */
public class DiskIOException extends DownloadException {

    public DiskIOException(String message, IOException cause) {
        super(ErrorKind.DISK_IO, message, cause);
    }
}
