package io.asyncly.core.computation;

import io.asyncly.core.execution.CreditPool;
import io.asyncly.core.journal.JournalCursor;
import io.asyncly.core.util.Chain;

/// Right-hand side of an alternation point that is run inline once the left side finishes.
///
/// Carries everything needed to resume the sibling as if it had been forked at the
/// alternation point: its continuation, the credit pool in effect and the journal
/// snapshot taken before the left choice was logged.
record Alternative(
        Computation<?> right, Chain<Frame> frames, CreditPool creditPool, JournalCursor snapshot) {

    Alternative below(Chain<Frame> outer) {
        return outer.isEmpty()
                ? this
                : new Alternative(right, frames.prependTo(outer), creditPool, snapshot);
    }
}
