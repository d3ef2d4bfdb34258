package com.fragmentdl.utils;

import com.fragmentdl.exceptions.DownloadCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void cancelClosesRegisteredResourcesOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger closed = new AtomicInteger();
        token.register(closed::incrementAndGet);

        token.cancel("first");
        token.cancel("second");

        assertThat(closed).hasValue(1);
        assertThat(token.getReason()).isEqualTo("first");
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(DownloadCancelledException.class)
                .hasMessage("Download cancelled: first");
    }

    @Test
    void releasedResourceIsNotClosed() {
        CancellationToken token = new CancellationToken();
        AtomicInteger closed = new AtomicInteger();
        try (CancellationToken.Registration ignored = token.register(closed::incrementAndGet)) {
            assertThat(token.isCancelled()).isFalse();
        }

        token.cancel("done");

        assertThat(closed).hasValue(0);
    }

    @Test
    void registeringOnCancelledTokenClosesImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel("gone");
        AtomicInteger closed = new AtomicInteger();

        token.register(closed::incrementAndGet);

        assertThat(closed).hasValue(1);
    }

    @Test
    void parentCancelsChildrenButNotTheOtherWay() {
        CancellationToken parent = new CancellationToken();
        CancellationToken first = parent.child();
        CancellationToken second = parent.child();

        first.cancel("round finished");
        assertThat(parent.isCancelled()).isFalse();
        assertThat(second.isCancelled()).isFalse();

        parent.cancel("user");
        assertThat(second.isCancelled()).isTrue();
        assertThat(second.getReason()).isEqualTo("user");
        assertThat(parent.child().isCancelled()).isTrue();
    }

    @Test
    void sleepWakesUpOnCancel() {
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(() -> token.cancel("stop"), 100, TimeUnit.MILLISECONDS);
        long started = System.nanoTime();
        try {
            assertThatThrownBy(() -> token.sleep(Duration.ofSeconds(30)))
                    .isInstanceOf(DownloadCancelledException.class);
        } finally {
            scheduler.shutdownNow();
        }
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void sleepCompletesWithoutCancel() {
        CancellationToken token = new CancellationToken();

        assertThatCode(() -> token.sleep(Duration.ofMillis(20))).doesNotThrowAnyException();
    }
}
