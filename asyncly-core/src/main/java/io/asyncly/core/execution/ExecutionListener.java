package io.asyncly.core.execution;

import io.asyncly.core.journal.Journal;

/// Listener for run lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override
/// only the events they care about.
///
/// @implNote Branch callbacks arrive from worker threads as well as from the driver;
/// implementations must be thread-safe.
public interface ExecutionListener {

    /// No-op listener.
    ExecutionListener NOOP = new ExecutionListener() {};

    /// Called when an alternation point hands its right-hand side to a new worker.
    ///
    /// @param workerId id of the new worker
    default void onBranchDispatched(int workerId) {}

    /// Called when an alternation point runs inline because no credit was available.
    default void onBranchInlined() {}

    /// Called when the driver retires a worker and returns its credit.
    ///
    /// @param workerId id of the retired worker
    default void onBranchRetired(int workerId) {}

    /// Called when a branch stops in a recording run and its journal is captured.
    ///
    /// @param journal the captured journal, not null
    default void onBranchPaused(Journal journal) {}

    /// Called when a driver finishes, successfully or not.
    ///
    /// @param recordings number of journals captured by the run, 0 outside recording runs
    default void onRunComplete(int recordings) {}
}
