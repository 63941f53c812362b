package io.asyncly.core.journal;

import io.asyncly.core.util.Chain;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Active journal state of one branch: entries still to replay plus entries logged so far.
///
/// Immutable. Taking a snapshot is just keeping a reference, which is what lets the
/// step machine remember the journal at every inline alternation point for free.
public final class JournalCursor {

    private static final JournalCursor BLANK = new JournalCursor(Chain.empty(), Chain.empty(), 0);

    private final Chain<JournalEntry> pending;
    private final Chain<JournalEntry> logged;
    private final int position;

    private JournalCursor(Chain<JournalEntry> pending, Chain<JournalEntry> logged, int position) {
        this.pending = pending;
        this.logged = logged;
        this.position = position;
    }

    /// Cursor of a branch that has neither replay input nor logged decisions.
    public static JournalCursor blank() {
        return BLANK;
    }

    /// Cursor that replays the given journal from its first entry.
    public static JournalCursor replaying(Journal journal) {
        Objects.requireNonNull(journal, "journal must not be null");
        return new JournalCursor(Chain.fromList(journal.entries()), Chain.empty(), 0);
    }

    public boolean isReplaying() {
        return !pending.isEmpty();
    }

    /// Next entry to replay.
    ///
    /// @throws java.util.NoSuchElementException if the replay input is used up
    public JournalEntry peek() {
        return pending.head();
    }

    /// Number of replay entries consumed so far.
    public int position() {
        return position;
    }

    /// Moves past the replay head, optionally keeping it in the log.
    ///
    /// @param log whether the consumed entry is appended to the log
    public JournalCursor consume(boolean log) {
        JournalEntry entry = pending.head();
        return new JournalCursor(pending.tail(), log ? logged.push(entry) : logged, position + 1);
    }

    public JournalCursor append(JournalEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        return new JournalCursor(pending, logged.push(entry), position);
    }

    /// Logged entries followed by any entries not yet replayed.
    public Journal toJournal() {
        List<JournalEntry> entries = new ArrayList<>(logged.size() + pending.size());
        entries.addAll(logged.reversed());
        entries.addAll(pending.toList());
        return new Journal(entries);
    }

    @Override
    public String toString() {
        return "JournalCursor{logged=" + logged.reversed() + ", pending=" + pending + "}";
    }
}
