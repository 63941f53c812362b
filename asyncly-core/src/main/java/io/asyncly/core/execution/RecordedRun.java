package io.asyncly.core.execution;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/// Handle of a recording run executing in the background.
///
/// {@link #requestPause()} stops every branch at its next step boundary; the
/// branches that had not finished end up in the recording set returned by
/// {@link #await()}.
public final class RecordedRun<A> {

    private final ExecutionContext context;
    private final Future<RecordedResult<A>> outcome;

    RecordedRun(ExecutionContext context, Future<RecordedResult<A>> outcome) {
        this.context = context;
        this.outcome = outcome;
    }

    public void requestPause() {
        context.requestPause();
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /// Waits for the run to finish.
    ///
    /// @throws Exception the exception the run failed with, unwrapped
    public RecordedResult<A> await() throws Exception {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw RunLoop.propagate(e.getCause());
        }
    }

    /// Waits at most the given time for the run to finish.
    ///
    /// @throws TimeoutException if the run is still going
    public RecordedResult<A> await(long timeout, TimeUnit unit) throws Exception {
        try {
            return outcome.get(timeout, unit);
        } catch (ExecutionException e) {
            throw RunLoop.propagate(e.getCause());
        }
    }
}
