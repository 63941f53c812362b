package io.asyncly.core.computation;

import io.asyncly.core.execution.CreditPool;

/// One pending piece of a branch's success continuation.
sealed interface Frame permits Frame.Bind, Frame.Scope {

    /// Feeds the delivered value into the next part of a sequence.
    record Bind(Computation.Bind<?, ?> node) implements Frame {}

    /// Restores the credit pool that was active before a `threads` scope.
    record Scope(CreditPool previous) implements Frame {}
}
