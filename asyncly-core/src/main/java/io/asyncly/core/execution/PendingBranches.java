package io.asyncly.core.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/// Registry of dispatched workers that the driver has not retired yet.
///
/// Ordered by dispatch. A worker is registered before it is handed to the
/// dispatcher, so the driver never sees an empty registry while a result is still
/// on its way.
///
/// @implNote **Thread-safe**. Backed by a {@link ConcurrentSkipListMap} keyed by
/// worker id.
final class PendingBranches {

    private final Map<Integer, WorkerHandle> workers = new ConcurrentSkipListMap<>();

    void register(WorkerHandle worker) {
        workers.put(worker.getId(), worker);
    }

    /// Removes a worker.
    ///
    /// @return true if the worker was pending
    boolean retire(WorkerHandle worker) {
        return workers.remove(worker.getId()) != null;
    }

    boolean isEmpty() {
        return workers.isEmpty();
    }

    /// Removes and returns every pending worker, in dispatch order.
    List<WorkerHandle> drain() {
        List<WorkerHandle> drained = new ArrayList<>();
        for (Integer id : new ArrayList<>(workers.keySet())) {
            WorkerHandle worker = workers.remove(id);
            if (worker != null) {
                drained.add(worker);
            }
        }
        return drained;
    }
}
