package io.asyncly.core.execution;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.journal.BranchJournal;
import io.asyncly.core.journal.Journal;
import io.asyncly.core.journal.JournalCursor;
import io.asyncly.core.journal.JournalEntry;
import io.asyncly.core.journal.JournalStore;
import java.util.Objects;

/// Per-branch view of a run: the shared {@link ExecutionContext} plus the branch's
/// own credit pool and journal.
///
/// Every {@link Computation#step} receives one. The journal collaborator operations
/// are forwarded explicitly to the branch's {@link BranchJournal}.
///
/// @implNote **Not thread-safe.** A branch context is confined to the thread
/// advancing its branch; dispatching creates a fresh one via {@link #fork()}.
public final class BranchContext implements JournalStore {

    private final ExecutionContext context;
    private final BranchJournal journal;
    private CreditPool creditPool;

    BranchContext(ExecutionContext context, CreditPool creditPool, BranchJournal journal) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.creditPool = Objects.requireNonNull(creditPool, "creditPool must not be null");
        this.journal = Objects.requireNonNull(journal, "journal must not be null");
    }

    /// Root branch of a run: the run's credit pool and a blank journal.
    public static BranchContext root(ExecutionContext context) {
        return new BranchContext(
                context,
                context.getRootCreditPool(),
                new BranchJournal(JournalCursor.blank(), context.isRecording()));
    }

    public ExecutionContext context() {
        return context;
    }

    public BranchJournal journal() {
        return journal;
    }

    public CreditPool creditPool() {
        return creditPool;
    }

    public void setCreditPool(CreditPool creditPool) {
        this.creditPool = Objects.requireNonNull(creditPool, "creditPool must not be null");
    }

    /// Copy for a new branch; the journal cursor is copied, never shared mutably.
    public BranchContext fork() {
        return new BranchContext(context, creditPool, journal.fork());
    }

    /// Hands a branch to a new worker. The caller has already taken credit from
    /// {@link #creditPool()}.
    public void dispatch(Computation<?> work) {
        BranchContext child = fork();
        child.journal.logChoice(JournalEntry.Side.RIGHT);
        context.dispatch(work, child);
    }

    /// Adds a journal of a stopped branch to the run's recording set.
    public void capture(Journal captured) {
        context.addRecording(captured);
    }

    @Override
    public JournalCursor getActive() {
        return journal.getActive();
    }

    @Override
    public void replaceActive(JournalCursor cursor) {
        journal.replaceActive(cursor);
    }

    @Override
    public void replay(Journal replayed) {
        journal.replay(replayed);
    }
}
