package com.fragmentdl.models;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FragmentTest {

    @Test
    void tracksResumeOffset() {
        Fragment fragment = new Fragment(1, 20_000, 60_000, Path.of("f.part1"));

        assertThat(fragment.getState()).isEqualTo(FragmentState.PENDING);
        assertThat(fragment.beginAttempt()).isEqualTo(1);
        fragment.advance(10_000);

        assertThat(fragment.nextOffset()).isEqualTo(30_000);
        assertThat(fragment.remaining()).isEqualTo(30_000);

        fragment.rewind();
        assertThat(fragment.nextOffset()).isEqualTo(20_000);
    }

    @Test
    void retryCycleFollowsStateMachine() {
        Fragment fragment = new Fragment(0, 0, 10, Path.of("f.part0"));

        fragment.beginAttempt();
        fragment.transitionTo(FragmentState.RETRY_WAITING);
        assertThat(fragment.beginAttempt()).isEqualTo(2);
        fragment.transitionTo(FragmentState.COMPLETED);

        assertThatThrownBy(() -> fragment.transitionTo(FragmentState.DOWNLOADING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pendingCannotWaitForRetry() {
        Fragment fragment = new Fragment(0, 0, 10, Path.of("f.part0"));

        assertThatThrownBy(() -> fragment.transitionTo(FragmentState.RETRY_WAITING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void openEndedStreamIsSealedAtEof() {
        Fragment stream = new Fragment(0, 0, Fragment.UNKNOWN_END, Path.of("f.stream"));
        stream.advance(4321);

        assertThat(stream.remaining()).isEqualTo(Fragment.UNKNOWN_END);
        stream.seal();

        assertThat(stream.getEnd()).isEqualTo(4321);
        assertThat(stream.remaining()).isZero();
        assertThat(stream.length()).isEqualTo(4321);
    }

    @Test
    void rejectsInvertedRange() {
        assertThatThrownBy(() -> new Fragment(0, 100, 50, Path.of("f.part0")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
