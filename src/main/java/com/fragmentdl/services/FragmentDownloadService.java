package com.fragmentdl.services;

import com.fragmentdl.config.DownloadSettings;
import com.fragmentdl.config.EngineProperties;
import com.fragmentdl.config.HttpClientFactory;
import com.fragmentdl.exceptions.ConfigurationException;
import com.fragmentdl.exceptions.ErrorKind;
import com.fragmentdl.models.DownloadJob;
import com.fragmentdl.models.DownloadResult;
import com.fragmentdl.models.ProbeResult;
import com.fragmentdl.models.ProgressSnapshot;
import com.fragmentdl.presenters.Presenter;
import com.fragmentdl.presenters.ProgressReporter;
import com.fragmentdl.utils.CancellationToken;
import com.fragmentdl.utils.ProgressAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Entry point for one download: assembles the engine from the user's settings and runs it.
 */
@Service
@Slf4j
public class FragmentDownloadService {

    static final String DEFAULT_FILE_NAME = "downloaded_file";

    private final EngineProperties properties;
    private final HttpClientFactory httpClientFactory;
    private final Clock clock;

    public FragmentDownloadService(EngineProperties properties, HttpClientFactory httpClientFactory, Clock clock) {
        this.properties = properties;
        this.httpClientFactory = httpClientFactory;
        this.clock = clock;
    }

    /**
     * Downloads {@code source} into the configured output directory.
     *
     * @param fileName  destination file name, derived from the URL when {@code null}
     * @param presenter progress renderer, {@code null} for none
     */
    public DownloadResult download(DownloadSettings settings, URI source, String fileName, Presenter presenter,
                                   CancellationToken token) {
        DownloadJob job;
        HttpClient client;
        try {
            settings.validate();
            client = httpClientFactory.create(settings);
            String name = fileName == null || fileName.isBlank() ? deriveFileName(source) : fileName;
            job = new DownloadJob(source, Path.of(settings.outputDirectory()).resolve(name),
                    Path.of(settings.tempDirectory()), ProbeResult.UNKNOWN_SIZE, false,
                    settings.maxConcurrentFragments(), settings.maxConcurrentFragments(), settings.chunkSize(),
                    settings.requestTimeout(), properties.overallTimeout());
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return DownloadResult.failed(ErrorKind.CONFIGURATION, e.getMessage(), null, false,
                    ProgressSnapshot.empty(clock.instant()), Duration.ZERO);
        } catch (IllegalArgumentException e) {
            log.error("Invalid download request: {}", e.getMessage());
            return DownloadResult.failed(ErrorKind.CONFIGURATION, e.getMessage(), null, false,
                    ProgressSnapshot.empty(clock.instant()), Duration.ZERO);
        }

        RetryPolicy retryPolicy = RetryPolicy.of(settings.retryAttempts(), properties.retry());
        ProgressAggregator progress = new ProgressAggregator(clock, properties.speedWindow());
        DownloadOrchestrator orchestrator = new DownloadOrchestrator(client,
                new RangeProbe(client, settings.requestTimeout()),
                new FragmentPlanner(properties.minFragmentSize()),
                retryPolicy, new FragmentMerger(), progress, clock, properties.probeAttempts());

        if (presenter == null) {
            return orchestrator.run(job, token);
        }
        try (ProgressReporter ignored = ProgressReporter.start(presenter, progress::snapshot)) {
            return orchestrator.run(job, token);
        }
    }

    /**
     * Last path segment of the URL, or {@value #DEFAULT_FILE_NAME} when it has none.
     */
    public static String deriveFileName(URI source) {
        String path = source.getPath();
        if (path == null || path.isEmpty()) {
            return DEFAULT_FILE_NAME;
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        String segment = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return segment.isBlank() ? DEFAULT_FILE_NAME : segment;
    }
}
