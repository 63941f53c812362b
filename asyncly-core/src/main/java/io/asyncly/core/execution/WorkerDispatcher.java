package io.asyncly.core.execution;

import io.asyncly.core.computation.Computation;

/// Primitive that starts a new worker for a dispatched branch.
///
/// Implementations must run the computation to completion in the given branch,
/// writing every produced value and a final completion signal onto the run's
/// channel; {@link Worker} does exactly that. Values of one worker must be written
/// in production order.
///
/// @see ExecutorWorkerDispatcher
@FunctionalInterface
public interface WorkerDispatcher {

    /// Starts a worker. Must not block on the worker's progress.
    ///
    /// @param worker the registered handle, not null
    /// @param work the branch to run, not null
    /// @param branch the worker's own branch context, not null
    void dispatch(WorkerHandle worker, Computation<?> work, BranchContext branch);
}
