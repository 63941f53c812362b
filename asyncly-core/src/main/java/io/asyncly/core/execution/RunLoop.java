package io.asyncly.core.execution;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.computation.Step;
import io.asyncly.core.journal.Journal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// Drivers that run a computation to exhaustion.
///
/// Each driver creates a fresh {@link ExecutionContext}, advances the computation
/// locally until it is exhausted, then drains the channel until no dispatched
/// worker is pending. The context is always closed on exit, so workers still
/// running after a failure are cancelled and their credit is returned.
///
/// ### Ordering
/// Local results come first, in production order. Results from workers follow in
/// channel arrival order; with zero credit nothing is dispatched and the order is
/// fully deterministic.
///
/// ### Failures
/// The first failure, local or from a worker, is rethrown unchanged: the same
/// exception instance the effect threw.
///
/// @implNote Drivers block the calling thread while draining. Running a driver from
/// inside a worker of a fixed-size pool can starve that pool.
public final class RunLoop {

    private static final Logger logger = Logger.getLogger(RunLoop.class.getName());

    private final WorkerDispatcher dispatcher;
    private final ExecutionListener listener;
    private final int threadCredit;

    /// @param dispatcher starts workers, not null
    /// @param listener lifecycle callbacks, not null
    /// @param threadCredit root credit of every run, negative for unlimited
    public RunLoop(WorkerDispatcher dispatcher, ExecutionListener listener, int threadCredit) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.threadCredit = threadCredit;
    }

    /// Runs the computation for its effects, discarding results.
    public void runAsyncly(Computation<?> computation) throws Exception {
        ExecutionContext context = newContext(false);
        drive(context, () -> {
            discard(computation, context);
            return null;
        });
    }

    /// Runs the computation and collects every result.
    public <A> List<A> toList(Computation<A> computation) throws Exception {
        ExecutionContext context = newContext(false);
        return drive(context, () -> collect(computation, context));
    }

    /// Runs the computation with journaling enabled, discarding results.
    ///
    /// @return journals of the branches that stopped before finishing
    public List<Journal> runAsynclyRecorded(Computation<?> computation) throws Exception {
        ExecutionContext context = newContext(true);
        return drive(context, () -> {
            discard(computation, context);
            return context.recordings();
        });
    }

    /// Runs the computation with journaling enabled, collecting results.
    public <A> RecordedResult<A> toListRecorded(Computation<A> computation) throws Exception {
        ExecutionContext context = newContext(true);
        return drive(context, () -> recorded(computation, context));
    }

    /// Starts a recording run on the given executor and returns its handle.
    ///
    /// @param driverExecutor runs the driver itself; must not be the worker executor
    ///     if that one is bounded
    public <A> RecordedRun<A> startRecorded(Computation<A> computation, ExecutorService driverExecutor) {
        ExecutionContext context = newContext(true);
        Callable<RecordedResult<A>> run = () -> drive(context, () -> recorded(computation, context));
        Future<RecordedResult<A>> outcome = driverExecutor.submit(run);
        return new RecordedRun<>(context, outcome);
    }

    ExecutionContext newContext(boolean recording) {
        CreditPool root = threadCredit < 0 ? CreditPool.unlimited() : CreditPool.of(threadCredit);
        return new ExecutionContext(root, recording, dispatcher, listener);
    }

    private <T> T drive(ExecutionContext context, Callable<T> body) throws Exception {
        logger.fine("Run started (recording=" + context.isRecording() + ")");
        try (context) {
            return body.call();
        } finally {
            int captured = context.recordings().size();
            logger.info("Run finished with " + captured + " captured journals");
            listener.onRunComplete(captured);
        }
    }

    private static <A> RecordedResult<A> recorded(Computation<A> computation, ExecutionContext context)
            throws Exception {
        List<A> values = collect(computation, context);
        return new RecordedResult<>(values, context.recordings());
    }

    private static void discard(Computation<?> computation, ExecutionContext context)
            throws Exception {
        BranchContext root = BranchContext.root(context);
        Computation<?> next = computation;
        while (next != null) {
            next = skip(next, root);
        }
        drain(context, value -> {});
    }

    private static <A> Computation<A> skip(Computation<A> computation, BranchContext root)
            throws Exception {
        return computation.advance(root, () -> null, (value, rest) -> rest.orElse(null));
    }

    private static <A> List<A> collect(Computation<A> computation, ExecutionContext context)
            throws Exception {
        BranchContext root = BranchContext.root(context);
        List<A> results = new ArrayList<>();
        Computation<A> next = computation;
        while (next != null) {
            Step<A> step = next.step(root);
            if (step instanceof Step.More<A> more) {
                results.add(more.value());
                next = more.rest();
            } else if (step instanceof Step.Final<A> last) {
                results.add(last.value());
                next = null;
            } else {
                next = null;
            }
        }
        RunLoop.<A>drain(context, results::add);
        return results;
    }

    private static <A> void drain(ExecutionContext context, Consumer<A> sink) throws Exception {
        ChannelMessage message;
        while ((message = context.awaitMessage()) != null) {
            if (message instanceof ChannelMessage.Value value) {
                // workers of a run only publish results of the run's computation
                @SuppressWarnings("unchecked")
                A result = (A) value.value();
                sink.accept(result);
                continue;
            }
            context.retire(message.worker());
            if (message instanceof ChannelMessage.Failed failed) {
                throw propagate(failed.cause());
            }
        }
    }

    /// Returns the failure to rethrow as is; errors are thrown directly.
    static Exception propagate(Throwable cause) {
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new ExecutionException(cause);
    }
}
