package io.asyncly.core.execution;

import java.util.concurrent.Future;

/// Handle of one dispatched worker, registered as pending until the driver retires it.
///
/// Remembers the credit pool the worker's credit was taken from, so the driver can
/// return it to the right pool even when the worker ran inside a nested `threads`
/// scope.
public final class WorkerHandle {

    private final int id;
    private final CreditPool creditPool;
    private volatile Future<?> future;
    private volatile boolean cancelled;

    WorkerHandle(int id, CreditPool creditPool) {
        this.id = id;
        this.creditPool = creditPool;
    }

    public int getId() {
        return id;
    }

    public CreditPool getCreditPool() {
        return creditPool;
    }

    /// Attaches the task running this worker so it can be cancelled.
    public void attach(Future<?> future) {
        this.future = future;
        if (cancelled) {
            future.cancel(true);
        }
    }

    void cancel() {
        cancelled = true;
        Future<?> running = future;
        if (running != null) {
            running.cancel(true);
        }
    }

    @Override
    public String toString() {
        return "worker-" + id;
    }
}
