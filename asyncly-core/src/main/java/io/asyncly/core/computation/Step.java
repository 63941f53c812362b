package io.asyncly.core.computation;

import java.util.Objects;

/// Outcome of advancing a computation once.
///
/// - {@link Exhausted}: no (more) results
/// - {@link Final}: one last result, nothing remains
/// - {@link More}: one result and the rest of the computation
///
/// @param <A> result type
public sealed interface Step<A> permits Step.Exhausted, Step.Final, Step.More {

    @SuppressWarnings("unchecked")
    static <A> Step<A> exhausted() {
        return (Step<A>) Exhausted.INSTANCE;
    }

    record Exhausted<A>() implements Step<A> {
        static final Exhausted<?> INSTANCE = new Exhausted<>();
    }

    record Final<A>(A value) implements Step<A> {}

    record More<A>(A value, Computation<A> rest) implements Step<A> {
        public More {
            Objects.requireNonNull(rest, "rest must not be null");
        }
    }
}
