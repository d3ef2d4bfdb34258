package com.fragmentdl.services;

import com.fragmentdl.exceptions.DownloadCancelledException;
import com.fragmentdl.utils.CancellationToken;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Blocking wait on an asynchronous exchange that a {@link CancellationToken} can abort.
 */
final class HttpCalls {

    private HttpCalls() {
    }

    static <T> HttpResponse<T> await(CompletableFuture<HttpResponse<T>> exchange, CancellationToken token)
            throws IOException, DownloadCancelledException {
        try (CancellationToken.Registration ignored = token.register(() -> exchange.cancel(true))) {
            return exchange.get();
        } catch (CancellationException e) {
            throw new DownloadCancelledException(token.getReason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exchange.cancel(true);
            throw new DownloadCancelledException("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException(cause);
        }
    }
}
