package org.dxworks.formframe.analyzer.infopath;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable stack. {@link #push} returns a new chain and leaves the receiver untouched,
 * so a scope entered for a recursive call disappears when the call returns.
 * Iteration runs from the innermost entry outwards.
 */
final class ScopeChain<T> implements Iterable<T> {

    private static final ScopeChain<Object> EMPTY = new ScopeChain<>(null, null, 0);

    private final T head;
    private final ScopeChain<T> tail;
    private final int depth;

    private ScopeChain(T head, ScopeChain<T> tail, int depth) {
        this.head = head;
        this.tail = tail;
        this.depth = depth;
    }

    @SuppressWarnings("unchecked")
    static <T> ScopeChain<T> empty() {
        return (ScopeChain<T>) EMPTY;
    }

    ScopeChain<T> push(T value) {
        return new ScopeChain<>(value, this, depth + 1);
    }

    /**
     * Innermost entry, or null when empty.
     */
    T peek() {
        return head;
    }

    boolean isEmpty() {
        return depth == 0;
    }

    int depth() {
        return depth;
    }

    /**
     * Entries from the outermost to the innermost.
     */
    List<T> outermostFirst() {
        List<T> result = new ArrayList<>();
        for (T value : this) {
            result.add(0, value);
        }
        return result;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private ScopeChain<T> current = ScopeChain.this;

            @Override
            public boolean hasNext() {
                return current.depth > 0;
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                T value = current.head;
                current = current.tail;
                return value;
            }
        };
    }
}
