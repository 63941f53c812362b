package io.asyncly.core.journal;

import static io.asyncly.core.journal.JournalEntry.Side.LEFT;
import static io.asyncly.core.journal.JournalEntry.Side.RIGHT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.asyncly.core.AsynclyFactory;
import io.asyncly.core.AsynclyRuntime;
import io.asyncly.core.computation.Computation;
import io.asyncly.core.execution.RecordedResult;
import io.asyncly.core.execution.RecordedRun;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CheckpointsTest {

    private AsynclyRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = AsynclyFactory.createRuntime();
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    /// Every element times ten; elements matched by `pauseAt` pause first.
    private static Computation<Integer> scaled(List<Integer> elements, int pauseAt) {
        return Computation.each(elements)
                .flatMap(
                        x ->
                                x % pauseAt == 0
                                        ? Computation.pause().then(Computation.of(x * 10))
                                        : Computation.of(x * 10));
    }

    @Nested
    class PausedBranches {

        @Test
        void shouldCaptureExactlyOneJournalForOnePausedBranch() throws Exception {
            // Given
            Computation<Integer> computation = Computation.threads(0, scaled(List.of(1, 2, 3), 3));

            // When
            RecordedResult<Integer> result = runtime.toListRecorded(computation);

            // Then
            assertThat(result.values()).containsExactly(10, 20);
            assertThat(result.recordings())
                    .containsExactly(
                            Journal.of(
                                    JournalEntry.choice(RIGHT),
                                    JournalEntry.choice(RIGHT),
                                    JournalEntry.choice(LEFT),
                                    JournalEntry.paused()));
        }

        @Test
        void shouldReturnSameJournalsFromDiscardingRecorder() throws Exception {
            Computation<Integer> computation = Computation.threads(0, scaled(List.of(1, 2, 3), 3));

            List<Journal> recordings = runtime.runAsynclyRecorded(computation);

            assertThat(recordings).isEqualTo(runtime.toListRecorded(computation).recordings());
        }

        @Test
        void shouldCaptureNothingWhenNoBranchPauses() throws Exception {
            RecordedResult<Integer> result =
                    runtime.toListRecorded(Computation.each(List.of(1, 2, 3)));

            assertThat(result.isComplete()).isTrue();
            assertThat(result.values()).containsExactlyInAnyOrder(1, 2, 3);
        }
    }

    @Nested
    class Replay {

        @Test
        void shouldCompleteUninterruptedResultsAfterReplay() throws Exception {
            // Given
            Computation<Integer> computation = scaled(List.of(1, 2, 3, 4, 5, 6), 2);
            List<Integer> uninterrupted = runtime.toList(computation);

            // When
            RecordedResult<Integer> recorded = runtime.toListRecorded(computation);
            List<Integer> resumed =
                    runtime.toList(Checkpoints.playRecordings(computation, recorded.recordings()));

            // Then
            List<Integer> union = new ArrayList<>(recorded.values());
            union.addAll(resumed);
            assertThat(uninterrupted).containsExactlyInAnyOrder(10, 20, 30, 40, 50, 60);
            assertThat(union).containsExactlyInAnyOrderElementsOf(uninterrupted);
            assertThat(recorded.recordings()).hasSize(3);
        }

        @Test
        void shouldNotRerunRecordedEffects() throws Exception {
            AtomicInteger effectRuns = new AtomicInteger();
            Computation<Integer> computation =
                    Computation.threads(
                            0,
                            Computation.each(List.of(1, 2))
                                    .flatMap(
                                            x ->
                                                    Computation.record(
                                                                    () -> {
                                                                        effectRuns.incrementAndGet();
                                                                        return x * 100;
                                                                    })
                                                            .flatMap(
                                                                    v ->
                                                                            x == 2
                                                                                    ? Computation.pause()
                                                                                            .then(Computation.of(v))
                                                                                    : Computation.of(v))));

            RecordedResult<Integer> recorded = runtime.toListRecorded(computation);
            List<Integer> resumed =
                    runtime.toList(Checkpoints.playRecordings(computation, recorded.recordings()));

            assertThat(recorded.values()).containsExactly(100);
            assertThat(recorded.recordings())
                    .containsExactly(
                            Journal.of(
                                    JournalEntry.choice(RIGHT),
                                    JournalEntry.choice(LEFT),
                                    JournalEntry.recorded(200),
                                    JournalEntry.paused()));
            assertThat(resumed).containsExactly(200);
            assertThat(effectRuns).hasValue(2);
        }

        @Test
        void shouldResumeBranchThatPausesTwice() throws Exception {
            Computation<Integer> computation =
                    Computation.threads(
                            0,
                            Computation.each(List.of(1, 2))
                                    .flatMap(
                                            x ->
                                                    Computation.pause()
                                                            .then(Computation.pause())
                                                            .then(Computation.of(x))));

            List<Journal> first = runtime.runAsynclyRecorded(computation);
            RecordedResult<Integer> second =
                    runtime.toListRecorded(Checkpoints.playRecordings(computation, first));
            List<Integer> third =
                    runtime.toList(Checkpoints.playRecordings(computation, second.recordings()));

            assertThat(first).hasSize(2);
            assertThat(second.values()).isEmpty();
            assertThat(second.recordings())
                    .containsExactlyInAnyOrder(
                            Journal.of(
                                    JournalEntry.choice(LEFT),
                                    JournalEntry.paused(),
                                    JournalEntry.paused()),
                            Journal.of(
                                    JournalEntry.choice(RIGHT),
                                    JournalEntry.choice(LEFT),
                                    JournalEntry.paused(),
                                    JournalEntry.paused()));
            assertThat(third).containsExactlyInAnyOrder(1, 2);
        }

        @Test
        void shouldPlayNothingForEmptyRecordingSet() throws Exception {
            List<Integer> resumed =
                    runtime.toList(Checkpoints.playRecordings(scaled(List.of(1, 2), 2), List.of()));

            assertThat(resumed).isEmpty();
        }

        @Test
        void shouldFailOnJournalFromDifferentComputation() {
            Computation<Integer> computation = Computation.record(() -> 1);
            Journal foreign = Journal.of(JournalEntry.choice(LEFT));

            assertThatThrownBy(
                            () -> runtime.toList(Checkpoints.playRecording(computation, foreign)))
                    .isInstanceOf(JournalReplayException.class)
                    .hasMessageContaining("recorded effect");
        }
    }

    @Nested
    class ExternalPause {

        @Test
        void shouldCaptureBranchStillRunningWhenPauseIsRequested() throws Exception {
            // Given
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger effectRuns = new AtomicInteger();
            Computation<Integer> computation =
                    Computation.threads(
                            0,
                            Computation.of(1)
                                    .or(Computation.of(2))
                                    .or(Computation.of(3))
                                    .flatMap(
                                            x ->
                                                    Computation.<Integer>record(
                                                                    () -> {
                                                                        effectRuns.incrementAndGet();
                                                                        if (x == 3) {
                                                                            started.countDown();
                                                                            release.await();
                                                                        }
                                                                        return x * 10;
                                                                    })
                                                            .flatMap(Computation::of)));

            // When
            RecordedRun<Integer> run = runtime.startRecorded(computation);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            run.requestPause();
            release.countDown();
            RecordedResult<Integer> result = run.await(5, TimeUnit.SECONDS);
            assertThat(run.isDone()).isTrue();

            // Then
            assertThat(result.values()).containsExactly(10, 20);
            assertThat(result.recordings())
                    .containsExactly(Journal.of(JournalEntry.choice(RIGHT), JournalEntry.recorded(30)));

            List<Integer> resumed =
                    runtime.toList(Checkpoints.playRecordings(computation, result.recordings()));
            assertThat(resumed).containsExactly(30);
            assertThat(effectRuns).hasValue(3);
        }
    }
}
