package com.fragmentdl.exceptions;

/**
 * Invalid or unreadable settings. Raised before any network activity.
 */
public class ConfigurationException extends DownloadException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
