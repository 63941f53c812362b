package io.asyncly.core.execution;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.journal.Journal;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Shared state of one top-level run.
///
/// Holds the result channel workers write to, the registry of workers not yet
/// retired, the run's root credit pool and, in recording runs, the set of journals
/// captured from stopped branches. Exactly one driver reads the channel.
///
/// ### Lifecycle
/// A context is created by the driver, shared by every branch of the run and closed
/// when the driver exits. Closing cancels any worker still pending and returns its
/// credit, so a run never leaks credit even when it fails early.
///
/// @implNote **Thread-safe**. Workers publish concurrently; the channel is a
/// {@link LinkedBlockingQueue} and the recording sink a {@link ConcurrentLinkedQueue}.
/// Registering a worker and closing the run are mutually exclusive, so no worker is
/// registered after its run has been drained.
///
/// @see RunLoop
public final class ExecutionContext implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ExecutionContext.class.getName());

    private final BlockingQueue<ChannelMessage> channel = new LinkedBlockingQueue<>();
    private final PendingBranches pending = new PendingBranches();
    private final AtomicInteger workerIds = new AtomicInteger();
    private final AtomicBoolean pauseRequested = new AtomicBoolean();
    private final Queue<Journal> recordings;
    private final CreditPool rootCreditPool;
    private final WorkerDispatcher dispatcher;
    private final ExecutionListener listener;
    private volatile boolean closed;

    /// Creates the context of a new run.
    ///
    /// @param rootCreditPool credit pool used outside any `threads` scope, not null
    /// @param recording whether stopped branches contribute journals
    /// @param dispatcher starts workers for dispatched branches, not null
    /// @param listener receives lifecycle callbacks, not null
    public ExecutionContext(
            CreditPool rootCreditPool,
            boolean recording,
            WorkerDispatcher dispatcher,
            ExecutionListener listener) {
        this.rootCreditPool = Objects.requireNonNull(rootCreditPool, "rootCreditPool must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.recordings = recording ? new ConcurrentLinkedQueue<>() : null;
    }

    public CreditPool getRootCreditPool() {
        return rootCreditPool;
    }

    public ExecutionListener listener() {
        return listener;
    }

    public boolean isRecording() {
        return recordings != null;
    }

    /// Asks every branch of the run to stop at its next step boundary.
    ///
    /// In a recording run each stopped branch contributes its journal.
    public void requestPause() {
        if (pauseRequested.compareAndSet(false, true)) {
            logger.info("Pause requested, branches stop at their next step");
        }
    }

    public boolean isPauseRequested() {
        return pauseRequested.get();
    }

    /// Journals captured so far, in capture order. Empty outside recording runs.
    public List<Journal> recordings() {
        return recordings == null ? List.of() : List.copyOf(recordings);
    }

    void addRecording(Journal journal) {
        if (recordings == null) {
            throw new IllegalStateException("Run is not recording");
        }
        recordings.add(journal);
        listener.onBranchPaused(journal);
        logger.fine("Captured journal of " + journal.size() + " entries");
    }

    void dispatch(Computation<?> work, BranchContext branch) {
        CreditPool pool = branch.creditPool();
        WorkerHandle worker = new WorkerHandle(workerIds.incrementAndGet(), pool);
        synchronized (this) {
            if (closed) {
                pool.release();
                logger.fine("Run already closed, dropping dispatched branch");
                return;
            }
            pending.register(worker);
        }
        listener.onBranchDispatched(worker.getId());
        logger.fine("Dispatching " + worker + " (" + pool + ")");
        try {
            dispatcher.dispatch(worker, work, branch);
        } catch (RuntimeException e) {
            if (pending.retire(worker)) {
                pool.release();
            }
            throw e;
        }
    }

    // -- Channel -----------------------------------------------------------

    void publish(WorkerHandle worker, Object value) {
        send(new ChannelMessage.Value(worker, value));
    }

    void publishRetired(WorkerHandle worker) {
        send(new ChannelMessage.Retired(worker));
    }

    void publishFailure(WorkerHandle worker, Throwable cause) {
        send(new ChannelMessage.Failed(worker, cause));
    }

    private void send(ChannelMessage message) {
        if (!closed) {
            channel.add(message);
        }
    }

    /// Blocks for the next channel message.
    ///
    /// @return the next message, or null once no worker is pending and the channel
    ///     is empty
    /// @throws InterruptedException if the driver thread is interrupted
    ChannelMessage awaitMessage() throws InterruptedException {
        ChannelMessage message = channel.poll();
        if (message != null) {
            return message;
        }
        if (pending.isEmpty()) {
            return null;
        }
        return channel.take();
    }

    /// Removes a finished worker from the pending registry and returns its credit.
    void retire(WorkerHandle worker) {
        if (pending.retire(worker)) {
            worker.getCreditPool().release();
            listener.onBranchRetired(worker.getId());
            logger.fine("Retired " + worker);
        }
    }

    /// Cancels every worker still pending and returns its credit.
    @Override
    public void close() {
        List<WorkerHandle> outstanding;
        synchronized (this) {
            closed = true;
            outstanding = pending.drain();
        }
        if (!outstanding.isEmpty()) {
            logger.warning(
                    "Run closed with " + outstanding.size() + " pending workers, cancelling them");
        }
        for (WorkerHandle worker : outstanding) {
            worker.cancel();
            worker.getCreditPool().release();
        }
        channel.clear();
    }
}
