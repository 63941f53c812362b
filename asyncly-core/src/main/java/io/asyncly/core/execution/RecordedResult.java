package io.asyncly.core.execution;

import io.asyncly.core.journal.Journal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Outcome of a recording run.
///
/// @param values results that completed during the run, in driver order; may contain nulls
/// @param recordings journals of the branches that stopped before finishing, not null
public record RecordedResult<A>(List<A> values, List<Journal> recordings) {

    public RecordedResult {
        values = Collections.unmodifiableList(new ArrayList<>(values));
        recordings = List.copyOf(recordings);
    }

    public boolean isComplete() {
        return recordings.isEmpty();
    }
}
