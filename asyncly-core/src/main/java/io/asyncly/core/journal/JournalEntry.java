package io.asyncly.core.journal;

import java.util.Objects;

/// One decision in a branch's journal.
///
/// Sealed so the replay logic and the JSON codec can handle every entry kind
/// exhaustively. Entry kinds:
/// - {@link Choice}: which side of an alternation point the branch took
/// - {@link Recorded}: the result of an effect run through `Computation.record`
/// - {@link Paused}: the branch stopped at a `Computation.pause()` point
public sealed interface JournalEntry
        permits JournalEntry.Choice, JournalEntry.Recorded, JournalEntry.Paused {

    /// Side of an alternation point.
    enum Side {
        LEFT,
        RIGHT
    }

    static Choice choice(Side side) {
        return new Choice(side);
    }

    static Recorded recorded(Object value) {
        return new Recorded(value);
    }

    static Paused paused() {
        return Paused.INSTANCE;
    }

    record Choice(Side side) implements JournalEntry {
        public Choice {
            Objects.requireNonNull(side, "side must not be null");
        }
    }

    /// Recorded effect result. The value may be null.
    record Recorded(Object value) implements JournalEntry {}

    record Paused() implements JournalEntry {
        static final Paused INSTANCE = new Paused();
    }
}
