package io.asyncly.core.computation;

/// A possibly blocking operation lifted into a computation.
///
/// Failures are ordinary exceptions; the engine propagates them unchanged to the
/// driver that runs the computation.
///
/// @param <T> result type
@FunctionalInterface
public interface Effect<T> {

    T run() throws Exception;
}
