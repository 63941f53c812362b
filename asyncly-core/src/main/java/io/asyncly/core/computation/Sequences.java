package io.asyncly.core.computation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Lifts ordinary sequences into branching computations.
public final class Sequences {

    private Sequences() {}

    /// One branch per element: `of(x1).or(of(x2).or(... .or(empty())))`.
    ///
    /// The alternation is right-associated, so under zero credit the elements are
    /// produced in declaration order. An empty input yields {@link Computation#empty()}.
    /// The input is copied; later changes to it do not affect the computation.
    ///
    /// @param values elements to lift, not null
    public static <A> Computation<A> each(Iterable<? extends A> values) {
        Objects.requireNonNull(values, "values must not be null");
        List<A> elements = new ArrayList<>();
        for (A value : values) {
            elements.add(value);
        }

        Computation<A> result = Computation.empty();
        for (int i = elements.size() - 1; i >= 0; i--) {
            result = Computation.<A>of(elements.get(i)).or(result);
        }
        return result;
    }

    @SafeVarargs
    public static <A> Computation<A> each(A... values) {
        return each(Arrays.asList(values));
    }
}
