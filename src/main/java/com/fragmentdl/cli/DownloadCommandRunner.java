package com.fragmentdl.cli;

import com.fragmentdl.config.DownloadSettings;
import com.fragmentdl.config.DownloadSettingsStore;
import com.fragmentdl.config.EngineProperties;
import com.fragmentdl.config.ProgressStyle;
import com.fragmentdl.exceptions.ConfigurationException;
import com.fragmentdl.models.DownloadResult;
import com.fragmentdl.presenters.Presenter;
import com.fragmentdl.presenters.Presenters;
import com.fragmentdl.services.FragmentDownloadService;
import com.fragmentdl.utils.ByteSizes;
import com.fragmentdl.utils.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line front end: {@code download <url>} and {@code config}.
 */
@Component
@Slf4j
public class DownloadCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = """
            Usage:
              download <url> [--filename=NAME] [--no-progress] [--progress-style=inline|full_screen|simple]
              config [--show] [--fragments=N] [--chunk-size=N] [--timeout=N] [--retry-attempts=N]
                     [--output-dir=PATH] [--temp-dir=PATH] [--ssl-verify|--no-ssl-verify]
                     [--show-progress|--no-progress] [--progress-style=STYLE] [--save]""";

    private final FragmentDownloadService downloadService;
    private final DownloadSettingsStore settingsStore;
    private final EngineProperties properties;
    private final PrintStream out;

    private volatile int exitCode = ExitCodes.SUCCESS;

    @Autowired
    public DownloadCommandRunner(FragmentDownloadService downloadService, DownloadSettingsStore settingsStore,
                                 EngineProperties properties) {
        this(downloadService, settingsStore, properties, System.out);
    }

    DownloadCommandRunner(FragmentDownloadService downloadService, DownloadSettingsStore settingsStore,
                          EngineProperties properties, PrintStream out) {
        this.downloadService = downloadService;
        this.settingsStore = settingsStore;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            usage("No command given");
            return;
        }
        try {
            switch (positional.get(0)) {
                case "download" -> download(args, positional);
                case "config" -> config(args);
                default -> usage("Unknown command: " + positional.get(0));
            }
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            out.println("Configuration error: " + e.getMessage());
            exitCode = ExitCodes.CONFIGURATION;
        }
    }

    private void download(ApplicationArguments args, List<String> positional) throws ConfigurationException {
        if (positional.size() != 2) {
            usage("download expects exactly one URL");
            return;
        }
        URI source;
        try {
            source = URI.create(positional.get(1));
        } catch (IllegalArgumentException e) {
            usage("Invalid URL: " + positional.get(1));
            return;
        }
        if (source.getScheme() == null || !source.getScheme().toLowerCase().startsWith("http")) {
            usage("Only http and https URLs are supported: " + source);
            return;
        }

        DownloadSettings settings = settingsStore.load();
        if (args.containsOption("no-progress")) {
            settings = settings.withShowProgress(false);
        }
        String style = singleValue(args, "progress-style");
        if (style != null) {
            settings = settings.withProgressStyle(parseStyle(style));
        }
        settings.validate();

        Presenter presenter = settings.showProgress()
                ? Presenters.forStyle(settings.progressStyle(), out, Presenters.terminalSupportsAnsi())
                : null;

        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            token.cancel("interrupted by user");
            try {
                finished.await(properties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "download-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        out.println("Downloading " + source);
        DownloadResult result;
        try {
            result = downloadService.download(settings, source, singleValue(args, "filename"), presenter, token);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
        report(result);
    }

    private void report(DownloadResult result) {
        if (result.success()) {
            out.println();
            out.println("Download completed: " + result.filePath());
            out.printf("Downloaded %s in %.1fs (%s/s)%s%n", ByteSizes.format(result.bytesDownloaded()),
                    result.elapsed().toMillis() / 1000.0, ByteSizes.format(result.averageSpeed()),
                    result.fellBack() ? " using single-stream fallback" : "");
            exitCode = ExitCodes.SUCCESS;
            return;
        }
        out.println();
        out.println("Download failed [" + result.errorKind() + "]: " + result.errorMessage()
                + (result.httpStatus() != null ? " (HTTP " + result.httpStatus() + ")" : ""));
        exitCode = ExitCodes.forKind(result.errorKind());
    }

    private void config(ApplicationArguments args) throws ConfigurationException {
        DownloadSettings settings = settingsStore.load();
        DownloadSettings updated = applyOverrides(settings, args).validate();

        if (args.containsOption("save")) {
            settingsStore.save(updated);
            out.println("Configuration saved to " + settingsStore.getLocation());
        } else if (!updated.equals(settings)) {
            out.println("Changes apply to this run only. Use --save to persist them.");
        }
        out.println(settingsStore.toJson(updated));
        exitCode = ExitCodes.SUCCESS;
    }

    static DownloadSettings applyOverrides(DownloadSettings settings, ApplicationArguments args)
            throws ConfigurationException {
        String value;
        if ((value = singleValue(args, "fragments")) != null) {
            settings = settings.withMaxConcurrentFragments(parseInt("fragments", value));
        }
        if ((value = singleValue(args, "chunk-size")) != null) {
            settings = settings.withChunkSize(parseInt("chunk-size", value));
        }
        if ((value = singleValue(args, "timeout")) != null) {
            settings = settings.withTimeout(parseInt("timeout", value));
        }
        if ((value = singleValue(args, "retry-attempts")) != null) {
            settings = settings.withRetryAttempts(parseInt("retry-attempts", value));
        }
        if ((value = singleValue(args, "output-dir")) != null) {
            settings = settings.withOutputDirectory(value);
        }
        if ((value = singleValue(args, "temp-dir")) != null) {
            settings = settings.withTempDirectory(value);
        }
        if ((value = singleValue(args, "progress-style")) != null) {
            settings = settings.withProgressStyle(parseStyle(value));
        }
        if (args.containsOption("ssl-verify")) {
            settings = settings.withVerifySsl(true);
        }
        if (args.containsOption("no-ssl-verify")) {
            settings = settings.withVerifySsl(false);
        }
        if (args.containsOption("show-progress")) {
            settings = settings.withShowProgress(true);
        }
        if (args.containsOption("no-progress")) {
            settings = settings.withShowProgress(false);
        }
        return settings;
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static int parseInt(String option, String value) throws ConfigurationException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + option + " expects an integer, got '" + value + "'", e);
        }
    }

    private static ProgressStyle parseStyle(String value) throws ConfigurationException {
        try {
            return ProgressStyle.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private void usage(String problem) {
        out.println(problem);
        out.println(USAGE);
        exitCode = ExitCodes.USAGE;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping shutdown hook");
        }
    }
}
