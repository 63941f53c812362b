package io.asyncly.core.computation;

import io.asyncly.core.execution.BranchContext;
import io.asyncly.core.execution.CreditPool;
import io.asyncly.core.journal.BranchJournal;
import io.asyncly.core.journal.Journal;
import io.asyncly.core.journal.JournalEntry;
import io.asyncly.core.journal.JournalEntry.Side;
import io.asyncly.core.util.Chain;
import java.util.Optional;
import java.util.logging.Logger;

/// Advances a computation to its next step outcome.
///
/// The machine state is the node being evaluated, the stack of success frames
/// (pending binds and credit scopes) and the stack of inline alternatives still to
/// run. Everything is iterative, so neither deep sequences nor long alternations
/// grow the Java stack.
///
/// When a value reaches the bottom of the frame stack it is a result of the
/// computation: the machine returns it together with a {@link Computation.Suspended}
/// holding the next inline alternative, so the caller can resume later.
final class StepMachine {

    private static final Logger logger = Logger.getLogger(StepMachine.class.getName());

    private final BranchContext branch;
    private Computation<?> current;
    private Chain<Frame> frames = Chain.empty();
    private Chain<Alternative> alternatives = Chain.empty();

    StepMachine(Computation<?> start, BranchContext branch) {
        this.current = start;
        this.branch = branch;
    }

    Step<?> run() throws Exception {
        while (true) {
            if (current instanceof Computation.Suspended<?> suspended) {
                unpack(suspended);
                continue;
            }
            if (branch.context().isPauseRequested()) {
                return suspendAll();
            }

            if (current instanceof Computation.Bind<?, ?> bind) {
                frames = frames.push(new Frame.Bind(bind));
                current = bind.source;
            } else if (current instanceof Computation.Alt<?> alt) {
                alternate(alt);
            } else if (current instanceof Computation.ThreadScope<?> scope) {
                frames = frames.push(new Frame.Scope(branch.creditPool()));
                branch.setCreditPool(scope.enter());
                current = scope.body;
            } else if (current instanceof Computation.Resume<?> resume) {
                switchTo(resume.alternative, frames);
            } else if (current instanceof Computation.Empty<?>) {
                if (!nextAlternative()) {
                    return Step.exhausted();
                }
            } else if (current instanceof Computation.Pause && stopsAtPause()) {
                if (!nextAlternative()) {
                    return Step.exhausted();
                }
            } else {
                Step<?> step = deliver(produce(current));
                if (step != null) {
                    return step;
                }
            }
        }
    }

    private Object produce(Computation<?> node) throws Exception {
        if (node instanceof Computation.Pure<?> pure) {
            return pure.value;
        }
        if (node instanceof Computation.Lift<?> lift) {
            return lift.effect.run();
        }
        if (node instanceof Computation.Record<?> recorded) {
            return branch.journal().replayOrRun(recorded.effect);
        }
        if (node instanceof Computation.Replay replay) {
            branch.replay(replay.journal);
            return null;
        }
        if (node instanceof Computation.Pause) {
            return null;
        }
        throw new IllegalStateException("Unexpected computation node: " + node.getClass().getName());
    }

    /// Passes a value down the frame stack.
    ///
    /// @return the step outcome if the value is a result, null if evaluation continues
    private Step<?> deliver(Object value) {
        while (!frames.isEmpty()) {
            Frame frame = frames.head();
            frames = frames.tail();
            if (frame instanceof Frame.Bind bind) {
                current = bind.node().resume(value);
                return null;
            }
            branch.setCreditPool(((Frame.Scope) frame).previous());
        }
        if (alternatives.isEmpty()) {
            return new Step.Final<>(value);
        }
        Computation<Object> rest =
                new Computation.Suspended<>(
                        new Computation.Resume<>(alternatives.head()),
                        Chain.empty(),
                        alternatives.tail());
        return new Step.More<>(value, rest);
    }

    private void alternate(Computation.Alt<?> alt) throws Exception {
        BranchJournal journal = branch.journal();
        Optional<Side> replayed = journal.replayChoice();
        if (replayed.isPresent()) {
            current = replayed.get() == Side.LEFT ? alt.left : alt.right;
            return;
        }

        CreditPool pool = branch.creditPool();
        if (pool.tryAcquire()) {
            branch.dispatch(new Computation.Suspended<>(alt.right, frames, Chain.empty()));
        } else {
            branch.context().listener().onBranchInlined();
            alternatives =
                    alternatives.push(new Alternative(alt.right, frames, pool, journal.getActive()));
        }
        journal.logChoice(Side.LEFT);
        current = alt.left;
    }

    /// Decides whether the branch stops at a pause point, capturing its journal if so.
    private boolean stopsAtPause() throws Exception {
        BranchJournal journal = branch.journal();
        if (journal.replayPause()) {
            return false;
        }
        if (!journal.isRecording()) {
            logger.fine("Pause point reached outside a recording run, continuing");
            return false;
        }
        branch.capture(journal.pausedJournal());
        return true;
    }

    private boolean nextAlternative() {
        if (alternatives.isEmpty()) {
            current = Computation.empty();
            frames = Chain.empty();
            return false;
        }
        Alternative next = alternatives.head();
        alternatives = alternatives.tail();
        switchTo(next, Chain.empty());
        return true;
    }

    private void switchTo(Alternative alternative, Chain<Frame> outer) {
        BranchJournal journal = branch.journal();
        journal.replaceActive(alternative.snapshot());
        journal.logChoice(Side.RIGHT);
        branch.setCreditPool(alternative.creditPool());
        frames = alternative.frames().prependTo(outer);
        current = alternative.right();
    }

    /// Resumes a suspended state on top of the current one.
    ///
    /// Only the suspended alternatives are copied, and only when there are outer frames
    /// to append to them, so resuming the rest of a long alternation stays constant time.
    private void unpack(Computation.Suspended<?> suspended) {
        Chain<Frame> outer = frames;
        Chain<Alternative> resumed =
                outer.isEmpty()
                        ? suspended.alternatives
                        : suspended.alternatives.map(alt -> alt.below(outer));
        alternatives = alternatives.isEmpty() ? resumed : resumed.prependTo(alternatives);
        frames = outer.isEmpty() ? suspended.frames : suspended.frames.prependTo(outer);
        current = suspended.node;
    }

    /// Stops the branch for an external pause request.
    ///
    /// In a recording run the current branch and every inline alternative not yet
    /// started each contribute a journal.
    private Step<?> suspendAll() {
        if (branch.journal().isRecording()) {
            if (current instanceof Computation.Resume<?> resume) {
                branch.capture(resumedJournal(resume.alternative));
            } else if (!(current instanceof Computation.Empty<?>)) {
                branch.capture(branch.journal().getActive().toJournal());
            }
            for (Alternative alternative : alternatives) {
                branch.capture(resumedJournal(alternative));
            }
        }
        logger.fine("Branch stopped on pause request");
        current = Computation.empty();
        frames = Chain.empty();
        alternatives = Chain.empty();
        return Step.exhausted();
    }

    private static Journal resumedJournal(Alternative alternative) {
        return alternative.snapshot().append(JournalEntry.choice(Side.RIGHT)).toJournal();
    }
}
