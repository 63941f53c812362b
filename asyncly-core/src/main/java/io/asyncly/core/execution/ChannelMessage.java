package io.asyncly.core.execution;

/// Message a worker writes onto the result channel of its run.
///
/// Every worker writes zero or more {@link Value}s followed by exactly one
/// {@link Retired} or {@link Failed}.
public sealed interface ChannelMessage
        permits ChannelMessage.Value, ChannelMessage.Retired, ChannelMessage.Failed {

    WorkerHandle worker();

    /// One result produced by the worker.
    record Value(WorkerHandle worker, Object value) implements ChannelMessage {}

    /// The worker's computation is exhausted.
    record Retired(WorkerHandle worker) implements ChannelMessage {}

    /// The worker's computation threw.
    record Failed(WorkerHandle worker, Throwable cause) implements ChannelMessage {}
}
