package io.asyncly.core.journal;

/// Journal collaborator of a branch.
///
/// The engine calls {@link #replay} before resuming a captured branch and relies on
/// the store to hold the active cursor through every subsequent decision.
public interface JournalStore {

    /// Returns the active cursor. Cursors are immutable, so the result is a snapshot.
    JournalCursor getActive();

    /// Replaces the active cursor, for example with an earlier snapshot.
    ///
    /// @param cursor the new active cursor, not null
    void replaceActive(JournalCursor cursor);

    /// Puts the given journal into replay mode as the active cursor.
    ///
    /// @param journal journal to replay, not null
    void replay(Journal journal);
}
