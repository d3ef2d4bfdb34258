package com.fragmentdl.presenters;

import com.fragmentdl.models.ProgressSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.function.Supplier;

/**
 * Feeds snapshots to a presenter at the presenter's own cadence, independently of the workers.
 */
@Slf4j
public class ProgressReporter implements AutoCloseable {

    private final Presenter presenter;
    private final Supplier<ProgressSnapshot> source;
    private final ThreadPoolTaskScheduler scheduler;

    private ProgressReporter(Presenter presenter, Supplier<ProgressSnapshot> source) {
        this.presenter = presenter;
        this.source = source;
        this.scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("progress-reporter-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(1);
        // a failed frame is logged and the next one is still drawn
        scheduler.setErrorHandler(e -> log.warn("Progress rendering failed", e));
        scheduler.initialize();
    }

    public static ProgressReporter start(Presenter presenter, Supplier<ProgressSnapshot> source) {
        ProgressReporter reporter = new ProgressReporter(presenter, source);
        reporter.scheduler.scheduleAtFixedRate(() -> presenter.render(source.get()), presenter.refreshInterval());
        return reporter;
    }

    /**
     * Stops the refresh loop and renders the final snapshot.
     */
    @Override
    public void close() {
        scheduler.shutdown();
        presenter.finish(source.get());
    }
}
