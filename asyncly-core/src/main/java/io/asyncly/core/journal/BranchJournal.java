package io.asyncly.core.journal;

import io.asyncly.core.computation.Effect;
import io.asyncly.core.journal.JournalEntry.Side;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Journal held by a single branch.
///
/// Owns the branch's active {@link JournalCursor} and applies the replay rules at
/// each decision point: a replayed entry is consumed when it matches, and anything
/// else is a {@link JournalReplayException}. New decisions are appended only when the
/// run records; outside a recording run the cursor merely tracks replay progress.
///
/// @implNote **Not thread-safe.** A branch journal is confined to the worker running
/// its branch. Forked branches receive a copy via {@link #fork()}.
public final class BranchJournal implements JournalStore {

    private static final Logger logger = Logger.getLogger(BranchJournal.class.getName());

    private final boolean recording;
    private JournalCursor cursor;

    public BranchJournal(JournalCursor cursor, boolean recording) {
        this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
        this.recording = recording;
    }

    public boolean isRecording() {
        return recording;
    }

    @Override
    public JournalCursor getActive() {
        return cursor;
    }

    @Override
    public void replaceActive(JournalCursor cursor) {
        this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
    }

    @Override
    public void replay(Journal journal) {
        logger.fine("Replaying journal of " + journal.size() + " entries");
        this.cursor = JournalCursor.replaying(journal);
    }

    /// Returns a journal for a forked branch starting from the current cursor.
    public BranchJournal fork() {
        return new BranchJournal(cursor, recording);
    }

    /// Consumes a replayed choice at an alternation point.
    ///
    /// @return the side to take, or empty when not replaying
    /// @throws JournalReplayException if the replay head is not a choice
    public Optional<Side> replayChoice() throws JournalReplayException {
        if (!cursor.isReplaying()) {
            return Optional.empty();
        }
        JournalEntry next = cursor.peek();
        if (next instanceof JournalEntry.Choice choice) {
            cursor = cursor.consume(recording);
            return Optional.of(choice.side());
        }
        throw mismatch("an alternation point", next);
    }

    public void logChoice(Side side) {
        if (recording) {
            cursor = cursor.append(JournalEntry.choice(side));
        }
    }

    /// Returns the recorded result at the replay head, or runs the effect and logs its result.
    ///
    /// @throws JournalReplayException if replaying and the head is not a recorded result
    /// @throws Exception whatever the effect throws
    public Object replayOrRun(Effect<?> effect) throws Exception {
        if (cursor.isReplaying()) {
            JournalEntry next = cursor.peek();
            if (next instanceof JournalEntry.Recorded recorded) {
                cursor = cursor.consume(recording);
                return recorded.value();
            }
            throw mismatch("a recorded effect", next);
        }
        Object value = effect.run();
        if (recording) {
            cursor = cursor.append(JournalEntry.recorded(value));
        }
        return value;
    }

    /// Consumes a replayed pause marker.
    ///
    /// @return true if the branch was resumed past this pause point
    /// @throws JournalReplayException if replaying and the head is not a pause marker
    public boolean replayPause() throws JournalReplayException {
        if (!cursor.isReplaying()) {
            return false;
        }
        JournalEntry next = cursor.peek();
        if (next instanceof JournalEntry.Paused) {
            cursor = cursor.consume(recording);
            return true;
        }
        throw mismatch("a pause point", next);
    }

    /// Journal of this branch stopped at a pause point.
    public Journal pausedJournal() {
        return cursor.append(JournalEntry.paused()).toJournal();
    }

    private JournalReplayException mismatch(String reached, JournalEntry expected) {
        return new JournalReplayException(
                "Replay reached "
                        + reached
                        + " but journal entry "
                        + cursor.position()
                        + " is "
                        + expected);
    }
}
