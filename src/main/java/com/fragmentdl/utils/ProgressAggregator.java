package com.fragmentdl.utils;

import com.fragmentdl.models.Fragment;
import com.fragmentdl.models.FragmentState;
import com.fragmentdl.models.ProbeResult;
import com.fragmentdl.models.ProgressSnapshot;
import com.fragmentdl.models.ProgressSnapshot.FragmentProgress;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects byte deltas from concurrently running workers and turns them into {@link ProgressSnapshot}s.
 * <p>
 * Counters are atomics and each speed window has its own short lock, so ingestion never waits on I/O.
 * Aggregate bytes reported by successive snapshots never decrease, even when a fragment restarts or
 * the plan is replaced by a single-stream fallback.
 */
@Slf4j
public class ProgressAggregator {

    private static final int SAMPLES_PER_WINDOW = 32;

    private final Clock clock;
    private final Duration window;
    private final long sampleSpacingNanos;
    private final AtomicLong highWater = new AtomicLong();

    private volatile List<FragmentCounter> counters = List.of();
    private volatile long totalBytes = ProbeResult.UNKNOWN_SIZE;

    public ProgressAggregator(Clock clock, Duration window) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("speed window must be positive");
        }
        this.clock = clock;
        this.window = window;
        this.sampleSpacingNanos = window.toNanos() / SAMPLES_PER_WINDOW;
    }

    /**
     * Starts tracking a new plan. Fragment indexes must match list positions.
     */
    public void track(List<Fragment> plan, long total) {
        Instant now = clock.instant();
        List<FragmentCounter> fresh = new ArrayList<>(plan.size());
        for (Fragment fragment : plan) {
            fresh.add(new FragmentCounter(fragment.length(), fragment.getBytesPersisted(), fragment.getState(), now));
        }
        this.totalBytes = total;
        this.counters = List.copyOf(fresh);
        log.debug("Tracking {} fragments, total {} bytes", plan.size(), total);
    }

    public void updateTotal(long total) {
        this.totalBytes = total;
    }

    /**
     * Records {@code bytesAdded} newly persisted bytes of fragment {@code index}.
     */
    public void ingest(int index, long bytesAdded, Instant timestamp) {
        FragmentCounter counter = counter(index);
        if (counter != null) {
            counter.add(bytesAdded, timestamp);
        }
    }

    /**
     * Resets a fragment that had to restart from its first byte.
     */
    public void rewind(int index, Instant timestamp) {
        FragmentCounter counter = counter(index);
        if (counter != null) {
            counter.reset(timestamp);
        }
    }

    public void updateState(int index, FragmentState state) {
        FragmentCounter counter = counter(index);
        if (counter != null) {
            counter.state = state;
        }
    }

    public void updateLength(int index, long length) {
        FragmentCounter counter = counter(index);
        if (counter != null) {
            counter.length = length;
        }
    }

    public ProgressSnapshot snapshot() {
        Instant now = clock.instant();
        List<FragmentCounter> current = counters;
        List<FragmentProgress> fragments = new ArrayList<>(current.size());
        long sum = 0;
        double speed = 0;
        boolean allCompleted = !current.isEmpty();
        for (int i = 0; i < current.size(); i++) {
            FragmentCounter counter = current.get(i);
            long bytes = counter.bytes.get();
            long length = counter.length;
            FragmentState state = counter.state;
            double fragmentSpeed = counter.speed(now);
            sum += bytes;
            speed += fragmentSpeed;
            allCompleted &= state == FragmentState.COMPLETED;
            fragments.add(new FragmentProgress(i, state, percent(bytes, length, state == FragmentState.COMPLETED),
                    fragmentSpeed, bytes, length));
        }
        long total = totalBytes;
        long downloaded = highWater.accumulateAndGet(sum, Math::max);
        return new ProgressSnapshot(now, fragments, percent(downloaded, total, allCompleted), speed, downloaded, total);
    }

    private FragmentCounter counter(int index) {
        List<FragmentCounter> current = counters;
        if (index < 0 || index >= current.size()) {
            log.debug("Ignoring progress for untracked fragment {}", index);
            return null;
        }
        return current.get(index);
    }

    private static double percent(long bytes, long total, boolean completed) {
        if (total > 0) {
            return Math.min(100.0, bytes * 100.0 / total);
        }
        return completed ? 100.0 : 0.0;
    }

    private record Sample(Instant at, long cumulative) {
    }

    private final class FragmentCounter {

        private final AtomicLong bytes;
        private final Deque<Sample> samples = new ArrayDeque<>();
        private volatile long length;
        private volatile FragmentState state;

        private FragmentCounter(long length, long initialBytes, FragmentState state, Instant now) {
            this.length = length;
            this.state = state;
            this.bytes = new AtomicLong(initialBytes);
            samples.addLast(new Sample(now, initialBytes));
        }

        private void add(long delta, Instant at) {
            long cumulative = bytes.addAndGet(delta);
            synchronized (samples) {
                // the newest sample is replaced while it is still close to the one before it
                Sample last = samples.pollLast();
                Sample previous = samples.peekLast();
                boolean coalesce = previous != null
                        && Duration.between(previous.at(), at).toNanos() < sampleSpacingNanos;
                if (last != null && !coalesce) {
                    samples.addLast(last);
                }
                samples.addLast(new Sample(at, cumulative));
                prune(at);
            }
        }

        private void reset(Instant at) {
            bytes.set(0);
            synchronized (samples) {
                samples.clear();
                samples.addLast(new Sample(at, 0));
            }
        }

        /**
         * Bytes per second over the sliding window ending at {@code now}. A fragment with no samples
         * inside the window reports zero.
         */
        private double speed(Instant now) {
            Sample base;
            Sample last;
            synchronized (samples) {
                prune(now);
                base = samples.peekFirst();
                last = samples.peekLast();
            }
            if (base == null || base == last) {
                return 0;
            }
            long elapsedNanos = Duration.between(base.at(), now).toNanos();
            if (elapsedNanos <= 0) {
                return 0;
            }
            return (last.cumulative() - base.cumulative()) * 1_000_000_000.0 / elapsedNanos;
        }

        // keeps the newest sample older than the window as the baseline
        private void prune(Instant now) {
            Instant cutoff = now.minus(window);
            while (samples.size() > 1) {
                Sample first = samples.pollFirst();
                Sample next = samples.peekFirst();
                if (next == null || !next.at().isBefore(cutoff)) {
                    samples.addFirst(first);
                    return;
                }
            }
        }
    }
}
