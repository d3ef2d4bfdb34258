package com.fragmentdl.utils;

import com.fragmentdl.exceptions.DownloadCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Job-scoped cancellation signal.
 * <p>
 * Blocking calls register the resource they block on; cancelling closes every registered
 * resource, wakes every {@link #sleep(Duration)} and cancels every child token.
 */
@Slf4j
public final class CancellationToken {

    private final CountDownLatch signal = new CountDownLatch(1);
    private final Set<AutoCloseable> resources = ConcurrentHashMap.newKeySet();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * Creates a token that is cancelled together with this one but can also be cancelled on its own.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        children.add(child);
        if (isCancelled()) {
            child.cancel(reason);
        }
        return child;
    }

    public void cancel(String why) {
        synchronized (this) {
            if (reason != null) {
                return;
            }
            reason = why;
        }
        log.debug("Cancelling: {}", why);
        signal.countDown();
        for (AutoCloseable resource : resources) {
            closeQuietly(resource);
        }
        for (CancellationToken child : children) {
            child.cancel(why);
        }
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() throws DownloadCancelledException {
        if (isCancelled()) {
            throw new DownloadCancelledException(reason);
        }
    }

    /**
     * Waits for {@code delay} unless cancelled first.
     *
     * @throws DownloadCancelledException as soon as the token is cancelled
     */
    public void sleep(Duration delay) throws DownloadCancelledException {
        try {
            if (signal.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new DownloadCancelledException(reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("interrupted");
        }
    }

    /**
     * Ties a blocking resource to this token. The resource is closed immediately if the token is already cancelled.
     */
    public Registration register(AutoCloseable resource) {
        resources.add(resource);
        if (isCancelled()) {
            closeQuietly(resource);
        }
        return () -> resources.remove(resource);
    }

    private static void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.debug("Closing {} on cancellation failed: {}", resource, e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
