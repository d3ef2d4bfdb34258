package com.fragmentdl.services;

import com.fragmentdl.exceptions.DiskIOException;
import com.fragmentdl.exceptions.DownloadCancelledException;
import com.fragmentdl.exceptions.DownloadException;
import com.fragmentdl.exceptions.NonRetryableRequestException;
import com.fragmentdl.exceptions.ProbeException;
import com.fragmentdl.models.DownloadJob;
import com.fragmentdl.models.DownloadResult;
import com.fragmentdl.models.Fragment;
import com.fragmentdl.models.JobState;
import com.fragmentdl.models.ProbeResult;
import com.fragmentdl.utils.ByteSizes;
import com.fragmentdl.utils.CancellationToken;
import com.fragmentdl.utils.ProgressAggregator;
import com.fragmentdl.utils.StallWatchdog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * Drives one job through probe, plan, download (with single-stream fallback) and merge.
 * <p>
 * Fallback happens only when a fragment fails with a non-retryable request error under a plan of
 * several fragments. Disk failures, exhausted retries and cancellation end the job.
 */
@Slf4j
public class DownloadOrchestrator {

    private final HttpClient client;
    private final RangeProbe rangeProbe;
    private final FragmentPlanner planner;
    private final RetryPolicy retryPolicy;
    private final FragmentMerger merger;
    private final ProgressAggregator progress;
    private final Clock clock;
    private final int probeAttempts;

    private volatile JobState state = JobState.PROBING;
    private volatile boolean fellBack;

    public DownloadOrchestrator(HttpClient client, RangeProbe rangeProbe, FragmentPlanner planner,
                                RetryPolicy retryPolicy, FragmentMerger merger, ProgressAggregator progress,
                                Clock clock, int probeAttempts) {
        this.client = client;
        this.rangeProbe = rangeProbe;
        this.planner = planner;
        this.retryPolicy = retryPolicy;
        this.merger = merger;
        this.progress = progress;
        this.clock = clock;
        this.probeAttempts = Math.max(1, probeAttempts);
    }

    public JobState getState() {
        return state;
    }

    /**
     * Runs the job to a terminal state. Failures are reported in the result, never thrown.
     */
    public DownloadResult run(DownloadJob job, CancellationToken jobToken) {
        Instant startedAt = clock.instant();
        log.info("Starting download: {} -> {}", job.source(), job.destination());

        try (StallWatchdog watchdog = new StallWatchdog()) {
            Duration deadline = job.overallTimeout();
            if (!deadline.isZero()) {
                watchdog.schedule(() -> jobToken.cancel("overall timeout of " + deadline.toMillis() + " ms exceeded"),
                        deadline);
            }

            transition(JobState.PROBING);
            job = job.withProbe(probe(job, jobToken));

            transition(JobState.PLANNING);
            prepareDirectories(job);
            List<Fragment> plan = planner.plan(job);

            transition(JobState.DOWNLOADING);
            try {
                runRound(job, plan, jobToken, watchdog);
            } catch (NonRetryableRequestException e) {
                if (plan.size() == 1 || jobToken.isCancelled()) {
                    throw e;
                }
                log.warn("Fragmented download failed ({}). Falling back to a single stream", e.getMessage());
                merger.discard(plan);
                fellBack = true;
                transition(JobState.FALLBACK_DOWNLOADING);
                plan = planner.singleStream(job);
                runRound(job, plan, jobToken, watchdog);
            }

            if (!job.isSizeKnown()) {
                job = job.withTotalSize(plan.get(0).getBytesPersisted());
                progress.updateTotal(job.totalSize());
            }
            jobToken.throwIfCancelled();

            transition(JobState.MERGING);
            merger.merge(plan, job.destination(), job.totalSize());

            transition(JobState.COMPLETED);
            Duration elapsed = Duration.between(startedAt, clock.instant());
            DownloadResult result = DownloadResult.completed(job.destination(), fellBack, progress.snapshot(), elapsed);
            log.info("Download completed in {} ms ({}/s): {}", elapsed.toMillis(),
                    ByteSizes.format(result.averageSpeed()), job.destination());
            return result;
        } catch (DownloadException e) {
            JobState failedIn = state;
            transition(JobState.FAILED);
            log.error("Download of {} failed during {} [{}]: {}", job.source(), failedIn, e.getKind(), e.getMessage());
            return DownloadResult.failed(e.getKind(), e.getMessage(), e.getHttpStatus(), fellBack,
                    progress.snapshot(), Duration.between(startedAt, clock.instant()));
        }
    }

    private ProbeResult probe(DownloadJob job, CancellationToken jobToken)
            throws ProbeException, DownloadCancelledException {
        for (int attempt = 1; ; attempt++) {
            try {
                return rangeProbe.probe(job.source(), jobToken);
            } catch (ProbeException e) {
                if (attempt >= probeAttempts) {
                    throw e;
                }
                log.warn("Probe attempt {} failed: {}. Probing once more", attempt, e.getMessage());
                jobToken.sleep(retryPolicy.backoffFor(1));
            }
        }
    }

    private static void prepareDirectories(DownloadJob job) throws DiskIOException {
        try {
            Files.createDirectories(job.tempDirectory());
            Path parent = job.destination().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new DiskIOException("Cannot create download directories: " + e.getMessage(), e);
        }
    }

    /**
     * Runs every fragment of the plan on a bounded pool and waits for all of them. The first failure
     * cancels the round, the remaining workers are drained before it is rethrown.
     */
    private void runRound(DownloadJob job, List<Fragment> plan, CancellationToken jobToken, StallWatchdog watchdog)
            throws DownloadException {
        CancellationToken roundToken = jobToken.child();
        progress.track(plan, job.totalSize());
        int poolSize = Math.min(job.concurrency(), plan.size());
        log.info("Downloading {} fragment(s) with {} worker(s)", plan.size(), poolSize);

        ThreadPoolTaskExecutor executor = newExecutor(poolSize);
        try {
            CompletionService<Fragment> completion = new ExecutorCompletionService<>(executor.getThreadPoolExecutor());
            WorkerContext context = new WorkerContext(client, job, retryPolicy, progress, watchdog, roundToken, clock);
            for (Fragment fragment : plan) {
                completion.submit(new FragmentWorker(fragment, context));
            }

            Throwable failure = null;
            for (int i = 0; i < plan.size(); i++) {
                Future<Fragment> done = completion.take();
                try {
                    done.get();
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = e.getCause();
                        roundToken.cancel("fragment failure: " + failure.getMessage());
                    }
                }
            }
            if (jobToken.isCancelled()) {
                throw new DownloadCancelledException(jobToken.getReason());
            }
            if (failure != null) {
                throw rethrow(failure);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            roundToken.cancel("interrupted");
            throw new DownloadCancelledException("interrupted");
        } finally {
            roundToken.cancel("round finished");
            executor.shutdown();
        }
    }

    private static ThreadPoolTaskExecutor newExecutor(int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("fragment-worker-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    // only called once every worker of the round has finished
    private static DownloadException rethrow(Throwable cause) {
        if (cause instanceof DownloadException de) {
            return de;
        }
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        throw new IllegalStateException("Unexpected worker failure", cause);
    }

    private void transition(JobState next) {
        JobState previous = state;
        state = next;
        log.debug("Job state {} -> {}", previous, next);
    }
}
