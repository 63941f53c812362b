package io.asyncly.core.journal;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Ordered decision log of one branch.
///
/// Replaying a journal against a fresh run of the same computation reproduces the
/// branch's choices and recorded effect results without re-running those effects.
/// A branch that never paused owns an empty journal.
///
/// @param entries decisions in the order they were taken, never null
public record Journal(List<JournalEntry> entries) {

    private static final Journal EMPTY = new Journal(List.of());

    public Journal {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
    }

    public static Journal empty() {
        return EMPTY;
    }

    public static Journal of(JournalEntry... entries) {
        return new Journal(Arrays.asList(entries));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
