package io.asyncly.core;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.execution.RecordedResult;
import io.asyncly.core.execution.RecordedRun;
import io.asyncly.core.execution.RunLoop;
import io.asyncly.core.journal.Journal;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Entry point for running computations.
///
/// Holds the configured drivers and the thread pools their workers run on. It
/// implements {@link AutoCloseable} so the pools are shut down with the runtime.
///
/// ### Usage
/// {@snippet :
/// try (AsynclyRuntime runtime = AsynclyFactory.createRuntime()) {
///     List<Integer> squares = runtime.toList(
///             Computation.each(List.of(1, 2, 3)).map(x -> x * x));
/// }
/// }
///
/// @implNote **Thread-safe**. Each driver call creates its own execution context;
/// several runs may proceed concurrently on one runtime.
///
/// @apiNote Create instances via {@link AsynclyFactory#createRuntime()} or
/// {@link AsynclyFactory.Builder} rather than direct construction.
public final class AsynclyRuntime implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(AsynclyRuntime.class.getName());

    private final AsynclyConfig config;
    private final RunLoop runLoop;
    private final ExecutorService workerExecutor;
    private final ExecutorService driverExecutor;
    private volatile boolean closed;

    /// Creates a runtime from wired components.
    ///
    /// @param config configuration the runtime was built from, not null
    /// @param runLoop the drivers, not null
    /// @param workerExecutor pool running dispatched workers, shut down on close; may be
    ///     null if workers run elsewhere
    /// @param driverExecutor pool running background recording drivers, shut down on close,
    ///     not null
    public AsynclyRuntime(
            AsynclyConfig config,
            RunLoop runLoop,
            ExecutorService workerExecutor,
            ExecutorService driverExecutor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.runLoop = Objects.requireNonNull(runLoop, "runLoop must not be null");
        this.workerExecutor = workerExecutor;
        this.driverExecutor = Objects.requireNonNull(driverExecutor, "driverExecutor must not be null");
    }

    /// Runs the computation for its effects and discards the results.
    ///
    /// @throws Exception the first failure of any branch, unchanged
    public void runAsyncly(Computation<?> computation) throws Exception {
        runLoop.runAsyncly(checkOpen(computation));
    }

    /// Runs the computation and returns every result.
    ///
    /// With zero credit the results are in declaration order; otherwise local results
    /// come first and dispatched ones follow in arrival order.
    ///
    /// @throws Exception the first failure of any branch, unchanged
    public <A> List<A> toList(Computation<A> computation) throws Exception {
        return runLoop.toList(checkOpen(computation));
    }

    /// Runs the computation with journaling enabled.
    ///
    /// @return journals of the branches that paused and never finished; feed them to
    ///     {@link io.asyncly.core.journal.Checkpoints#playRecordings} to resume
    /// @throws Exception the first failure of any branch, unchanged
    public List<Journal> runAsynclyRecorded(Computation<?> computation) throws Exception {
        return runLoop.runAsynclyRecorded(checkOpen(computation));
    }

    /// Runs the computation with journaling enabled, keeping the completed results.
    public <A> RecordedResult<A> toListRecorded(Computation<A> computation) throws Exception {
        return runLoop.toListRecorded(checkOpen(computation));
    }

    /// Starts a recording run in the background.
    ///
    /// The returned handle can request an external pause; branches still running at
    /// that point end up in the recording set.
    public <A> RecordedRun<A> startRecorded(Computation<A> computation) {
        return runLoop.startRecorded(checkOpen(computation), driverExecutor);
    }

    public AsynclyConfig getConfig() {
        return config;
    }

    private <C> C checkOpen(C computation) {
        Objects.requireNonNull(computation, "computation must not be null");
        if (closed) {
            throw new IllegalStateException("Runtime is closed");
        }
        return computation;
    }

    /// Shuts down the worker and driver pools.
    ///
    /// Runs in progress keep their already started workers; no new run may start.
    @Override
    public void close() {
        closed = true;
        logger.fine("Closing asyncly runtime");
        if (workerExecutor != null) {
            workerExecutor.shutdown();
        }
        driverExecutor.shutdown();
    }
}
