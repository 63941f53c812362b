package io.asyncly.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/// Immutable singly linked list with O(1) push and structural sharing.
///
/// Used wherever the engine needs cheap snapshots of a stack-like structure: the
/// continuation frames of a branch and the entries of a journal cursor. Two chains
/// that share a tail never observe each other's pushes.
///
/// @param <T> element type
public final class Chain<T> implements Iterable<T> {

    private static final Chain<?> EMPTY = new Chain<>(null, null, 0);

    private final T head;
    private final Chain<T> tail;
    private final int size;

    private Chain(T head, Chain<T> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <T> Chain<T> empty() {
        return (Chain<T>) EMPTY;
    }

    /// Builds a chain whose head is the first element of the list.
    public static <T> Chain<T> fromList(List<? extends T> values) {
        Chain<T> chain = empty();
        for (int i = values.size() - 1; i >= 0; i--) {
            chain = chain.push(values.get(i));
        }
        return chain;
    }

    public Chain<T> push(T value) {
        return new Chain<>(value, this, size + 1);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    public T head() {
        if (isEmpty()) {
            throw new NoSuchElementException("Chain is empty");
        }
        return head;
    }

    public Chain<T> tail() {
        if (isEmpty()) {
            throw new NoSuchElementException("Chain is empty");
        }
        return tail;
    }

    /// Returns a chain with every element of this chain on top of `bottom`.
    ///
    /// The relative order of this chain's elements is preserved.
    public Chain<T> prependTo(Chain<T> bottom) {
        if (bottom.isEmpty()) {
            return this;
        }
        Chain<T> result = bottom;
        for (T value : reversed()) {
            result = result.push(value);
        }
        return result;
    }

    public <R> Chain<R> map(Function<? super T, ? extends R> mapper) {
        Chain<R> result = empty();
        for (T value : reversed()) {
            result = result.push(mapper.apply(value));
        }
        return result;
    }

    /// Elements from head to last.
    public List<T> toList() {
        List<T> list = new ArrayList<>(size);
        for (T value : this) {
            list.add(value);
        }
        return list;
    }

    /// Elements from last to head.
    public List<T> reversed() {
        List<T> list = toList();
        Collections.reverse(list);
        return list;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private Chain<T> cursor = Chain.this;

            @Override
            public boolean hasNext() {
                return !cursor.isEmpty();
            }

            @Override
            public T next() {
                if (cursor.isEmpty()) {
                    throw new NoSuchElementException();
                }
                T value = cursor.head;
                cursor = cursor.tail;
                return value;
            }
        };
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
