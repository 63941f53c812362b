package io.asyncly.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.journal.Journal;
import io.asyncly.core.journal.JournalEntry;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RunLoopTest {

    @Mock private ExecutionListener listener;

    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private RunLoop runLoop(int threadCredit) {
        return new RunLoop(new ExecutorWorkerDispatcher(workers), listener, threadCredit);
    }

    @Test
    void shouldNotDispatchForEmptySequence() throws Exception {
        List<Integer> results = runLoop(-1).toList(Computation.each(List.<Integer>of()));

        assertThat(results).isEmpty();
        verify(listener, never()).onBranchDispatched(anyInt());
        verify(listener).onRunComplete(0);
    }

    @Test
    void shouldRunEmptySequenceForEffectsWithoutDispatching() throws Exception {
        runLoop(-1).runAsyncly(Computation.each(List.of()));

        verify(listener, never()).onBranchDispatched(anyInt());
        verify(listener, never()).onBranchInlined();
        verify(listener).onRunComplete(0);
    }

    @Test
    void shouldRunEveryAlternativeInlineWithoutCredit() throws Exception {
        List<Integer> results = runLoop(0).toList(Computation.each(List.of(1, 2, 3)));

        assertThat(results).containsExactly(1, 2, 3);
        verify(listener, times(3)).onBranchInlined();
        verify(listener, never()).onBranchDispatched(anyInt());
    }

    @Test
    void shouldDispatchOnlyAsFarAsCreditAllows() throws Exception {
        // Given
        RunLoop runLoop = runLoop(1);

        // When
        List<Integer> results = runLoop.toList(Computation.each(List.of(1, 2, 3)));

        // Then
        assertThat(results).containsExactly(1, 2, 3);
        verify(listener, times(1)).onBranchDispatched(anyInt());
        verify(listener, times(1)).onBranchRetired(anyInt());
        verify(listener, times(2)).onBranchInlined();
    }

    @Test
    void shouldReportCapturedJournals() throws Exception {
        Computation<Integer> computation = Computation.pause().then(Computation.of(1));

        List<Journal> recordings = runLoop(0).runAsynclyRecorded(computation);

        Journal expected = Journal.of(JournalEntry.paused());
        assertThat(recordings).containsExactly(expected);
        verify(listener).onBranchPaused(expected);
        verify(listener).onRunComplete(1);
    }

    @Test
    void shouldCancelPendingWorkerAndReturnCreditOnLocalFailure() throws Exception {
        // Given
        CreditPool pool = CreditPool.of(1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        IllegalStateException failure = new IllegalStateException("boom");
        Computation<Integer> computation =
                Computation.threads(
                        pool,
                        Computation.<Integer>lift(
                                        () -> {
                                            started.await();
                                            throw failure;
                                        })
                                .or(
                                        Computation.lift(
                                                () -> {
                                                    started.countDown();
                                                    try {
                                                        new CountDownLatch(1).await();
                                                    } catch (InterruptedException e) {
                                                        interrupted.countDown();
                                                        throw e;
                                                    }
                                                    return 2;
                                                })));

        // When / Then
        assertThatThrownBy(() -> runLoop(-1).toList(computation)).isSameAs(failure);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(pool.outstanding()).isZero();
        verify(listener).onRunComplete(0);
    }

    @Test
    void shouldReturnCreditWhenDispatcherRejectsWorker() {
        CreditPool pool = CreditPool.of(2);
        WorkerDispatcher rejecting =
                (worker, work, branch) -> {
                    throw new RejectedExecutionException("pool saturated");
                };
        RunLoop runLoop = new RunLoop(rejecting, listener, -1);

        assertThatThrownBy(
                        () ->
                                runLoop.toList(
                                        Computation.threads(
                                                pool, Computation.of(1).or(Computation.of(2)))))
                .isInstanceOf(RejectedExecutionException.class)
                .hasMessage("pool saturated");
        assertThat(pool.outstanding()).isZero();
    }
}
