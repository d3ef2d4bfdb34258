package com.fragmentdl.services;

import com.fragmentdl.exceptions.DiskIOException;
import com.fragmentdl.exceptions.DownloadException;
import com.fragmentdl.exceptions.FragmentExhaustedException;
import com.fragmentdl.exceptions.NonRetryableRequestException;
import com.fragmentdl.exceptions.TransientNetworkException;
import com.fragmentdl.models.DownloadJob;
import com.fragmentdl.models.Fragment;
import com.fragmentdl.models.FragmentState;
import com.fragmentdl.utils.CancellationToken;
import com.fragmentdl.utils.StallWatchdog;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Downloads one fragment into its own store, resuming from the last persisted byte after transient failures.
 */
@Slf4j
public class FragmentWorker implements Callable<Fragment> {

    private static final Set<Integer> RETRYABLE_CLIENT_ERRORS = Set.of(408, 425, 429);
    private static final Pattern CONTENT_RANGE_START = Pattern.compile("bytes\\s+(\\d+)-");

    private final Fragment fragment;
    private final WorkerContext context;
    private final DownloadJob job;
    private final CancellationToken token;

    public FragmentWorker(Fragment fragment, WorkerContext context) {
        this.fragment = fragment;
        this.context = context;
        this.job = context.job();
        this.token = context.token();
    }

    @Override
    public Fragment call() throws DownloadException {
        try {
            download();
            return fragment;
        } catch (DownloadException e) {
            fragment.recordError(e.getMessage());
            if (fragment.getState() != FragmentState.FAILED) {
                fragment.transitionTo(FragmentState.FAILED);
            }
            publishState();
            throw e;
        }
    }

    private void download() throws DownloadException {
        token.throwIfCancelled();
        if (fragment.hasKnownEnd() && fragment.length() == 0) {
            writeStore(InputStream.nullInputStream(), null, null);
            complete();
            return;
        }

        while (true) {
            token.throwIfCancelled();
            int attempt = fragment.beginAttempt();
            publishState();
            try {
                fetch();
                complete();
                return;
            } catch (TransientNetworkException e) {
                token.throwIfCancelled();
                if (!context.retryPolicy().canRetry(attempt)) {
                    log.warn("Fragment {} giving up after {} attempts: {}", fragment.getIndex(), attempt, e.getMessage());
                    throw new FragmentExhaustedException(fragment.getIndex(), attempt, e);
                }
                Duration delay = context.retryPolicy().delayFor(attempt, ThreadLocalRandom.current());
                log.warn("Fragment {} attempt {} failed: {}. Resuming at offset {} in {} ms",
                        fragment.getIndex(), attempt, e.getMessage(), fragment.nextOffset(), delay.toMillis());
                fragment.recordError(e.getMessage());
                fragment.transitionTo(FragmentState.RETRY_WAITING);
                publishState();
                token.sleep(delay);
            }
        }
    }

    private void fetch() throws DownloadException {
        boolean ranged = needsRange();
        HttpRequest.Builder request = HttpRequest.newBuilder(job.source())
                .timeout(job.requestTimeout())
                .GET();
        if (ranged) {
            request.header("Range", rangeHeader());
        }

        HttpResponse<InputStream> response;
        try {
            response = HttpCalls.await(
                    context.client().sendAsync(request.build(), HttpResponse.BodyHandlers.ofInputStream()), token);
        } catch (SSLHandshakeException e) {
            throw new NonRetryableRequestException("TLS handshake failed: " + e.getMessage(), null, e);
        } catch (IOException e) {
            throw new TransientNetworkException("Request failed: " + describe(e), null, e);
        }

        int status = response.statusCode();
        InputStream body = response.body();
        try (CancellationToken.Registration ignored = token.register(body);
             StallWatchdog.Watch watch = context.watchdog().watch(body, job.requestTimeout())) {
            if (restartRequired(response, ranged)) {
                log.warn("Server ignored range for fragment {}, restarting it from the first byte", fragment.getIndex());
                fragment.rewind();
                context.progress().rewind(fragment.getIndex(), context.clock().instant());
            }
            writeStore(body, watch, status);
        } finally {
            closeBody(body);
        }
    }

    /**
     * Checks the response status.
     *
     * @return true when the server sent the whole resource although a later offset was requested
     */
    private boolean restartRequired(HttpResponse<InputStream> response, boolean ranged) throws DownloadException {
        int status = response.statusCode();
        if (status == 206) {
            long expected = fragment.nextOffset();
            long actual = contentRangeStart(response, expected);
            if (actual != expected) {
                throw new NonRetryableRequestException("Server returned range starting at " + actual
                        + ", requested " + expected, status, null);
            }
            return false;
        }
        if (status == 200) {
            if (!ranged || coversWholeResource()) {
                return fragment.getBytesPersisted() > 0;
            }
            throw new NonRetryableRequestException("Server ignored range request for fragment "
                    + fragment.getIndex(), status, null);
        }
        if (status >= 500 || RETRYABLE_CLIENT_ERRORS.contains(status)) {
            throw new TransientNetworkException("HTTP " + status, status, null);
        }
        throw new NonRetryableRequestException("HTTP " + status + " for fragment " + fragment.getIndex(), status, null);
    }

    private long contentRangeStart(HttpResponse<InputStream> response, long fallback)
            throws NonRetryableRequestException {
        String header = response.headers().firstValue("Content-Range").orElse(null);
        if (header == null) {
            return fallback;
        }
        Matcher matcher = CONTENT_RANGE_START.matcher(header);
        if (!matcher.find()) {
            return fallback;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new NonRetryableRequestException("Malformed Content-Range '" + header + "' for fragment "
                    + fragment.getIndex(), response.statusCode(), e);
        }
    }

    /**
     * Appends the body to the store, starting at the fragment's persisted byte count.
     * Each chunk is fully written before the persisted counter moves.
     */
    private void writeStore(InputStream body, StallWatchdog.Watch watch, Integer status) throws DownloadException {
        try (FileChannel channel = FileChannel.open(fragment.getStorePath(),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            long persisted = fragment.getBytesPersisted();
            if (channel.size() < persisted) {
                throw new DiskIOException("Store " + fragment.getStorePath() + " is shorter than its "
                        + persisted + " persisted bytes", new IOException("store truncated externally"));
            }
            // drops bytes of a write that was interrupted before it was counted
            channel.truncate(persisted);
            channel.position(persisted);

            byte[] buffer = new byte[job.chunkSize()];
            long remaining = fragment.remaining();
            while (remaining != 0) {
                int wanted = remaining < 0 ? buffer.length : (int) Math.min(buffer.length, remaining);
                int read = read(body, buffer, wanted, watch, status);
                if (read < 0) {
                    break;
                }
                token.throwIfCancelled();
                ByteBuffer chunk = ByteBuffer.wrap(buffer, 0, read);
                while (chunk.hasRemaining()) {
                    channel.write(chunk);
                }
                fragment.advance(read);
                context.progress().ingest(fragment.getIndex(), read, context.clock().instant());
                if (watch != null) {
                    watch.touch();
                }
                if (remaining > 0) {
                    remaining -= read;
                }
            }
            if (remaining > 0) {
                token.throwIfCancelled();
                if (watch != null && watch.isStalled()) {
                    throw new TransientNetworkException("No data received for "
                            + job.requestTimeout().toSeconds() + "s", status, null);
                }
                throw new TransientNetworkException("Stream ended early, " + remaining + " bytes missing", status, null);
            }
            channel.force(true);
        } catch (IOException e) {
            throw new DiskIOException("Cannot write fragment store " + fragment.getStorePath() + ": " + e.getMessage(), e);
        }
    }

    private int read(InputStream body, byte[] buffer, int length, StallWatchdog.Watch watch, Integer status)
            throws DownloadException {
        try {
            return body.read(buffer, 0, length);
        } catch (IOException e) {
            token.throwIfCancelled();
            if (watch != null && watch.isStalled()) {
                throw new TransientNetworkException("No data received for " + job.requestTimeout().toSeconds() + "s",
                        status, e);
            }
            throw new TransientNetworkException("Connection lost: " + describe(e), status, e);
        }
    }

    private void complete() {
        fragment.seal();
        context.progress().updateLength(fragment.getIndex(), fragment.length());
        fragment.transitionTo(FragmentState.COMPLETED);
        publishState();
        log.debug("Fragment {} completed: {} bytes in {} attempts",
                fragment.getIndex(), fragment.getBytesPersisted(), fragment.getAttempts());
    }

    private boolean needsRange() {
        return job.supportsRanges() && (fragment.getBytesPersisted() > 0 || !coversWholeResource());
    }

    private boolean coversWholeResource() {
        return fragment.getStart() == 0 && (!fragment.hasKnownEnd() || fragment.getEnd() == job.totalSize());
    }

    private String rangeHeader() {
        String last = fragment.hasKnownEnd() ? String.valueOf(fragment.getEnd() - 1) : "";
        return "bytes=" + fragment.nextOffset() + "-" + last;
    }

    private void publishState() {
        context.progress().updateState(fragment.getIndex(), fragment.getState());
    }

    private void closeBody(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Closing response body of fragment {} failed: {}", fragment.getIndex(), e.getMessage());
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
