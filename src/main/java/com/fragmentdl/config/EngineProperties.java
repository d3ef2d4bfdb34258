package com.fragmentdl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine tuning that is not part of the user's JSON settings.
 */
@ConfigurationProperties(prefix = "fragmentdl")
public record EngineProperties(
        String configFile,
        long minFragmentSize,
        Retry retry,
        Duration speedWindow,
        Duration overallTimeout,
        int probeAttempts,
        Duration shutdownGrace
) {
    public EngineProperties {
        if (configFile == null) configFile = "download_config.json";
        if (minFragmentSize == 0) minFragmentSize = 262144L; // 256 KiB
        if (retry == null) retry = new Retry(null, 0, null);
        if (speedWindow == null) speedWindow = Duration.ofSeconds(3);
        if (overallTimeout == null) overallTimeout = Duration.ZERO;
        if (probeAttempts == 0) probeAttempts = 2;
        if (shutdownGrace == null) shutdownGrace = Duration.ofSeconds(5);
    }

    public static EngineProperties defaults() {
        return new EngineProperties(null, 0, null, null, null, 0, null);
    }

    /**
     * Backoff shape. The attempt limit comes from the user's {@code retry_attempts}.
     */
    public record Retry(Duration baseDelay, double multiplier, Duration jitter) {
        public Retry {
            if (baseDelay == null) baseDelay = Duration.ofSeconds(1);
            if (multiplier == 0) multiplier = 2.0;
            if (jitter == null) jitter = Duration.ofMillis(250);
        }
    }
}
