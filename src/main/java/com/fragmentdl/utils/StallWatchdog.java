package com.fragmentdl.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timer shared by one job: closes streams that stop delivering bytes and fires job deadlines.
 */
@Slf4j
public class StallWatchdog implements AutoCloseable {

    private static final long MIN_CHECK_MILLIS = 50;

    private final ThreadPoolTaskScheduler scheduler;

    public StallWatchdog() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("stall-watchdog-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
    }

    /**
     * Closes {@code resource} once {@code timeout} passes without {@link Watch#touch()}.
     */
    public Watch watch(AutoCloseable resource, Duration timeout) {
        return new Watch(resource, timeout);
    }

    public ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        return scheduler.schedule(action, scheduler.getClock().instant().plus(delay));
    }

    @Override
    public void close() {
        scheduler.shutdown();
    }

    public final class Watch implements AutoCloseable {

        private final AutoCloseable resource;
        private final long timeoutNanos;
        private final AtomicLong lastActivity = new AtomicLong(System.nanoTime());
        private final ScheduledFuture<?> check;
        private volatile boolean stalled;

        private Watch(AutoCloseable resource, Duration timeout) {
            this.resource = resource;
            this.timeoutNanos = timeout.toNanos();
            Duration period = Duration.ofMillis(Math.max(MIN_CHECK_MILLIS, timeout.toMillis() / 4));
            this.check = scheduler.scheduleAtFixedRate(this::check, scheduler.getClock().instant().plus(period), period);
        }

        public void touch() {
            lastActivity.set(System.nanoTime());
        }

        public boolean isStalled() {
            return stalled;
        }

        private void check() {
            if (System.nanoTime() - lastActivity.get() < timeoutNanos) {
                return;
            }
            stalled = true;
            check.cancel(false);
            try {
                resource.close();
            } catch (Exception e) {
                log.debug("Closing stalled stream failed: {}", e.getMessage());
            }
        }

        @Override
        public void close() {
            check.cancel(false);
        }
    }
}
