package io.asyncly.core.execution;

import io.asyncly.core.computation.Computation;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/// Dispatches each worker as one task on an {@link ExecutorService}.
///
/// The executor must be able to start a task while others are blocked; a fixed
/// pool smaller than the credit in use delays workers but never loses them.
public final class ExecutorWorkerDispatcher implements WorkerDispatcher {

    private final ExecutorService executorService;

    public ExecutorWorkerDispatcher(ExecutorService executorService) {
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
    }

    @Override
    public void dispatch(WorkerHandle worker, Computation<?> work, BranchContext branch) {
        worker.attach(executorService.submit(new Worker(worker, work, branch)));
    }
}
