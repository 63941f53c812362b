package io.asyncly.core.execution;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.computation.Step;
import java.util.logging.Logger;

/// Runs one dispatched branch to completion, reporting through the run's channel.
public final class Worker implements Runnable {

    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final WorkerHandle handle;
    private final Computation<?> work;
    private final BranchContext branch;

    public Worker(WorkerHandle handle, Computation<?> work, BranchContext branch) {
        this.handle = handle;
        this.work = work;
        this.branch = branch;
    }

    @Override
    public void run() {
        ExecutionContext context = branch.context();
        try {
            Computation<?> next = work;
            while (next != null) {
                Step<?> step = next.step(branch);
                if (step instanceof Step.More<?> more) {
                    context.publish(handle, more.value());
                    next = more.rest();
                } else if (step instanceof Step.Final<?> last) {
                    context.publish(handle, last.value());
                    next = null;
                } else {
                    next = null;
                }
            }
            context.publishRetired(handle);
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.fine("Worker " + handle + " failed: " + e);
            context.publishFailure(handle, e);
        }
    }
}
