package com.fragmentdl.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fragmentdl.exceptions.ConfigurationException;
import lombok.With;

import java.time.Duration;

/**
 * User-facing settings persisted as the JSON configuration document.
 * Missing values fall back to the defaults below.
 */
@With
@JsonPropertyOrder({"max_concurrent_fragments", "chunk_size", "timeout", "retry_attempts",
        "output_directory", "temp_directory", "verify_ssl", "show_progress", "progress_style"})
public record DownloadSettings(
        @JsonProperty("max_concurrent_fragments") Integer maxConcurrentFragments,
        @JsonProperty("chunk_size") Integer chunkSize,
        @JsonProperty("timeout") Integer timeout,
        @JsonProperty("retry_attempts") Integer retryAttempts,
        @JsonProperty("output_directory") String outputDirectory,
        @JsonProperty("temp_directory") String tempDirectory,
        @JsonProperty("verify_ssl") Boolean verifySsl,
        @JsonProperty("show_progress") Boolean showProgress,
        @JsonProperty("progress_style") ProgressStyle progressStyle
) {
    public DownloadSettings {
        if (maxConcurrentFragments == null) maxConcurrentFragments = 4;
        if (chunkSize == null) chunkSize = 8192;
        if (timeout == null) timeout = 30;
        if (retryAttempts == null) retryAttempts = 3;
        if (outputDirectory == null) outputDirectory = "./downloads";
        if (tempDirectory == null) tempDirectory = "./temp";
        if (verifySsl == null) verifySsl = true;
        if (showProgress == null) showProgress = true;
        if (progressStyle == null) progressStyle = ProgressStyle.INLINE;
    }

    public static DownloadSettings defaults() {
        return new DownloadSettings(null, null, null, null, null, null, null, null, null);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(timeout);
    }

    public DownloadSettings validate() throws ConfigurationException {
        requirePositive("max_concurrent_fragments", maxConcurrentFragments);
        requirePositive("chunk_size", chunkSize);
        requirePositive("timeout", timeout);
        requirePositive("retry_attempts", retryAttempts);
        if (outputDirectory.isBlank()) {
            throw new ConfigurationException("output_directory must not be blank");
        }
        if (tempDirectory.isBlank()) {
            throw new ConfigurationException("temp_directory must not be blank");
        }
        return this;
    }

    private static void requirePositive(String field, int value) throws ConfigurationException {
        if (value < 1) {
            throw new ConfigurationException(field + " must be a positive integer, got " + value);
        }
    }
}
