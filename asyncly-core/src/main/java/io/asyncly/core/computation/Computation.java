package io.asyncly.core.computation;

import io.asyncly.core.execution.BranchContext;
import io.asyncly.core.execution.CreditPool;
import io.asyncly.core.journal.Journal;
import io.asyncly.core.util.Chain;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// A lazy, resumable producer of zero, one or many results.
///
/// Computations are immutable values built from a handful of constructors and
/// combined by sequencing ({@link #flatMap}) and alternation ({@link #or}). Nothing
/// runs until a driver advances the computation; the same value may be run any
/// number of times.
///
/// ### Advancing
/// A computation is advanced with exactly two continuations:
///
/// ```
/// c.advance(branch,
///     () -> onExhausted,
///     (value, rest) -> rest.isPresent() ? onMore : onLast)
/// ```
///
/// or through the equivalent {@link #step(BranchContext)} returning a {@link Step}.
///
/// ### Alternation
/// At every alternation point the branch's credit pool decides whether the
/// right-hand side is dispatched to a new worker or run inline after the left side.
/// Results of inline runs keep declaration order; dispatched results reach the
/// driver in arrival order.
///
/// ### Failures
/// Exceptions thrown by effects or by user functions propagate unchanged out of
/// {@link #step} and {@link #advance}.
///
/// @param <A> result type
/// @see io.asyncly.core.AsynclyRuntime
public abstract sealed class Computation<A> {

    Computation() {}

    // -- Constructors ------------------------------------------------------

    /// Computation with no results.
    @SuppressWarnings("unchecked")
    public static <A> Computation<A> empty() {
        return (Computation<A>) Empty.INSTANCE;
    }

    /// Computation with exactly one result.
    public static <A> Computation<A> of(A value) {
        return new Pure<>(value);
    }

    /// Runs the effect every time the computation is reached and yields its result.
    public static <A> Computation<A> lift(Effect<? extends A> effect) {
        return new Lift<>(Objects.requireNonNull(effect, "effect must not be null"));
    }

    /// Like {@link #lift}, but the result is journaled in recording runs and returned
    /// from the journal, without running the effect, when the branch is replayed.
    public static <A> Computation<A> record(Effect<? extends A> effect) {
        return new Record<>(Objects.requireNonNull(effect, "effect must not be null"));
    }

    /// Pause point.
    ///
    /// In a recording run the branch stops here and its journal is captured; when
    /// that journal is replayed, execution continues past this point. Outside a
    /// recording run this is a no-op yielding `null`.
    public static Computation<Void> pause() {
        return Pause.INSTANCE;
    }

    /// Makes the given journal the branch's active journal, in replay mode.
    public static Computation<Void> replay(Journal journal) {
        return new Replay(Objects.requireNonNull(journal, "journal must not be null"));
    }

    public static <A, B> Computation<B> sequence(
            Computation<A> source, Function<? super A, ? extends Computation<B>> continuation) {
        return source.flatMap(continuation);
    }

    public static <A> Computation<A> alternation(Computation<A> left, Computation<A> right) {
        return left.or(right);
    }

    /// One branch per element, in declaration order.
    ///
    /// @see Sequences#each(Iterable)
    public static <A> Computation<A> each(Iterable<? extends A> values) {
        return Sequences.each(values);
    }

    /// Runs the body with a fresh credit pool of the given size.
    ///
    /// Every alternation point reachable inside the body, including inside workers it
    /// spawns, draws from the new pool. The previous pool is back in effect once the
    /// body produces a value or is exhausted.
    ///
    /// @param limit maximum number of concurrently dispatched workers, 0 for none
    /// @throws IllegalArgumentException if limit is negative
    public static <A> Computation<A> threads(int limit, Computation<A> body) {
        if (limit < 0) {
            throw new IllegalArgumentException("Thread credit must not be negative: " + limit);
        }
        return new ThreadScope<>(Objects.requireNonNull(body, "body must not be null"), limit, null);
    }

    /// Runs the body drawing dispatch credit from a caller-owned pool.
    ///
    /// The pool is shared by every run of this computation, which makes it possible
    /// to bound concurrency across runs and to observe credit after a run.
    public static <A> Computation<A> threads(CreditPool pool, Computation<A> body) {
        Objects.requireNonNull(pool, "pool must not be null");
        return new ThreadScope<>(Objects.requireNonNull(body, "body must not be null"), 0, pool);
    }

    // -- Combinators -------------------------------------------------------

    public final <B> Computation<B> flatMap(Function<? super A, ? extends Computation<B>> continuation) {
        Objects.requireNonNull(continuation, "continuation must not be null");
        return new Bind<>(this, continuation);
    }

    public final <B> Computation<B> map(Function<? super A, ? extends B> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return flatMap(value -> of(mapper.apply(value)));
    }

    /// Runs `next` once for every result of this computation, discarding the result.
    public final <B> Computation<B> then(Computation<B> next) {
        Objects.requireNonNull(next, "next must not be null");
        return flatMap(ignored -> next);
    }

    /// Alternation: results of this computation, then (or concurrently) results of `other`.
    public final Computation<A> or(Computation<A> other) {
        return new Alt<>(this, Objects.requireNonNull(other, "other must not be null"));
    }

    // -- Advancing ---------------------------------------------------------

    /// Advances to the next result.
    ///
    /// @param branch the branch this computation runs in, not null
    /// @return exactly one step outcome
    /// @throws Exception whatever an effect or user function throws, or a
    ///     {@link io.asyncly.core.journal.JournalReplayException} on journal mismatch
    public final Step<A> step(BranchContext branch) throws Exception {
        Objects.requireNonNull(branch, "branch must not be null");
        // the machine delivers the results of this computation only
        @SuppressWarnings("unchecked")
        Step<A> step = (Step<A>) new StepMachine(this, branch).run();
        return step;
    }

    /// Advances to the next result, handing the outcome to one of two continuations.
    ///
    /// @param branch the branch this computation runs in, not null
    /// @param onStop called when no result remains
    /// @param onValue called with a result and the rest, which is empty for the last result
    public final <R> R advance(BranchContext branch, Stop<R> onStop, Yield<A, R> onValue)
            throws Exception {
        Step<A> step = step(branch);
        if (step instanceof Step.More<A> more) {
            return onValue.accept(more.value(), Optional.of(more.rest()));
        }
        if (step instanceof Step.Final<A> last) {
            return onValue.accept(last.value(), Optional.empty());
        }
        return onStop.stop();
    }

    /// Continuation for an exhausted computation.
    @FunctionalInterface
    public interface Stop<R> {
        R stop() throws Exception;
    }

    /// Continuation for a produced result.
    @FunctionalInterface
    public interface Yield<A, R> {
        R accept(A value, Optional<Computation<A>> rest) throws Exception;
    }

    // -- Nodes -------------------------------------------------------------

    static final class Empty<A> extends Computation<A> {
        static final Empty<?> INSTANCE = new Empty<>();
    }

    static final class Pure<A> extends Computation<A> {
        final A value;

        Pure(A value) {
            this.value = value;
        }
    }

    static final class Lift<A> extends Computation<A> {
        final Effect<? extends A> effect;

        Lift(Effect<? extends A> effect) {
            this.effect = effect;
        }
    }

    static final class Record<A> extends Computation<A> {
        final Effect<? extends A> effect;

        Record(Effect<? extends A> effect) {
            this.effect = effect;
        }
    }

    static final class Pause extends Computation<Void> {
        static final Pause INSTANCE = new Pause();
    }

    static final class Replay extends Computation<Void> {
        final Journal journal;

        Replay(Journal journal) {
            this.journal = journal;
        }
    }

    static final class Bind<S, A> extends Computation<A> {
        final Computation<S> source;
        final Function<? super S, ? extends Computation<A>> continuation;

        Bind(Computation<S> source, Function<? super S, ? extends Computation<A>> continuation) {
            this.source = source;
            this.continuation = continuation;
        }

        /// Continues with a value produced by {@link #source}.
        Computation<A> resume(Object value) {
            // frames only ever receive values of the source they were pushed for
            @SuppressWarnings("unchecked")
            S result = (S) value;
            return Objects.requireNonNull(
                    continuation.apply(result), "flatMap continuation returned null");
        }
    }

    static final class Alt<A> extends Computation<A> {
        final Computation<A> left;
        final Computation<A> right;

        Alt(Computation<A> left, Computation<A> right) {
            this.left = left;
            this.right = right;
        }
    }

    static final class ThreadScope<A> extends Computation<A> {
        final Computation<A> body;
        final int limit;
        final CreditPool shared;

        ThreadScope(Computation<A> body, int limit, CreditPool shared) {
            this.body = body;
            this.limit = limit;
            this.shared = shared;
        }

        CreditPool enter() {
            return shared != null ? shared : CreditPool.of(limit);
        }
    }

    /// Machine state captured as a value: a node with its continuation and the inline
    /// alternatives still to run after it.
    static final class Suspended<A> extends Computation<A> {
        final Computation<?> node;
        final Chain<Frame> frames;
        final Chain<Alternative> alternatives;

        Suspended(Computation<?> node, Chain<Frame> frames, Chain<Alternative> alternatives) {
            this.node = node;
            this.frames = frames;
            this.alternatives = alternatives;
        }
    }

    /// Switches the branch over to an inline alternative.
    static final class Resume<A> extends Computation<A> {
        final Alternative alternative;

        Resume(Alternative alternative) {
            this.alternative = alternative;
        }
    }
}
