package com.fragmentdl.models;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * One logical transfer. Created per run and discarded at its end.
 *
 * @param source          resource locator
 * @param destination     final artifact path
 * @param tempDirectory   scratch directory for fragment stores
 * @param totalSize       resource length, {@link ProbeResult#UNKNOWN_SIZE} until probed
 * @param supportsRanges  range capability, false until probed
 * @param fragmentCount   requested number of fragments
 * @param concurrency     worker pool bound
 * @param chunkSize       bytes per streamed read
 * @param requestTimeout  per-request connect/stall timeout
 * @param overallTimeout  job deadline, {@link Duration#ZERO} for none
 */
public record DownloadJob(
        URI source,
        Path destination,
        Path tempDirectory,
        long totalSize,
        boolean supportsRanges,
        int fragmentCount,
        int concurrency,
        int chunkSize,
        Duration requestTimeout,
        Duration overallTimeout
) {
    public DownloadJob {
        if (source == null) throw new IllegalArgumentException("source is required");
        if (destination == null) throw new IllegalArgumentException("destination is required");
        if (tempDirectory == null) throw new IllegalArgumentException("tempDirectory is required");
        if (fragmentCount < 1) throw new IllegalArgumentException("fragmentCount must be >= 1");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(30);
        if (overallTimeout == null) overallTimeout = Duration.ZERO;
        if (totalSize < 0) totalSize = ProbeResult.UNKNOWN_SIZE;
    }

    public DownloadJob withProbe(ProbeResult probe) {
        return new DownloadJob(source, destination, tempDirectory, probe.totalSize(), probe.supportsRanges(),
                fragmentCount, concurrency, chunkSize, requestTimeout, overallTimeout);
    }

    public DownloadJob withTotalSize(long size) {
        return new DownloadJob(source, destination, tempDirectory, size, supportsRanges,
                fragmentCount, concurrency, chunkSize, requestTimeout, overallTimeout);
    }

    public boolean isSizeKnown() {
        return totalSize != ProbeResult.UNKNOWN_SIZE;
    }

    public String fileName() {
        return destination.getFileName().toString();
    }
}
