package io.asyncly.core.journal;

import io.asyncly.core.computation.Computation;
import java.util.List;
import java.util.Objects;

/// Resumption of branches captured by a recording run.
///
/// A recording run returns one {@link Journal} per branch that stopped before
/// finishing. Feeding those journals back, together with the same computation,
/// makes each branch retrace its recorded decisions and continue from the point
/// where it stopped:
///
/// ```
/// List<Journal> recordings = runtime.runAsynclyRecorded(search);
/// // ... later, possibly in another process ...
/// List<Result> rest = runtime.toList(Checkpoints.playRecordings(search, recordings));
/// ```
public final class Checkpoints {

    private Checkpoints() {}

    /// Resumes one captured branch of `computation`.
    public static <A> Computation<A> playRecording(Computation<A> computation, Journal journal) {
        Objects.requireNonNull(computation, "computation must not be null");
        return Computation.replay(journal).then(computation);
    }

    /// Resumes every captured branch as an initial alternative of a new run.
    ///
    /// An empty recording set yields an exhausted computation.
    public static <A> Computation<A> playRecordings(
            Computation<A> computation, List<Journal> journals) {
        Objects.requireNonNull(computation, "computation must not be null");
        Objects.requireNonNull(journals, "journals must not be null");
        return Computation.<Journal>each(journals)
                .flatMap(journal -> playRecording(computation, journal));
    }
}
