package com.fragmentdl.services;

import com.fragmentdl.models.DownloadJob;
import com.fragmentdl.utils.CancellationToken;
import com.fragmentdl.utils.ProgressAggregator;
import com.fragmentdl.utils.StallWatchdog;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Collaborators shared by every worker of one download round.
 */
public record WorkerContext(
        HttpClient client,
        DownloadJob job,
        RetryPolicy retryPolicy,
        ProgressAggregator progress,
        StallWatchdog watchdog,
        CancellationToken token,
        Clock clock
) {
}
