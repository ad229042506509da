package com.questrail.symbolic.value;

import java.util.AbstractList;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.IntFunction;

/**
 * LazyList
 * =============================================================================
 * Fixed-size, unmodifiable list whose elements are produced on first access.
 *
 * <h2>Realization</h2>
 * <p>Element {@code i} is computed by the supplied realizer the first time it
 * is read and memoized afterwards. Iteration, {@code equals} and
 * {@code hashCode} realize every element, so a fully realized lazy list is
 * equal to an eager list with the same contents.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Concurrent readers may race to realize the same element; the realizer is
 * expected to be pure and the first published value wins.</p>
 *
 * <p>The realizer holds only what it captured at creation. Abandoning the list
 * part way releases nothing because nothing is held open.</p>
 */
public final class LazyList<E> extends AbstractList<E> implements RandomAccess
{
    private static final int UNREALIZED = 0;
    private static final int PUBLISHING = 1;
    private static final int REALIZED = 2;

    private final int size;
    private final IntFunction<? extends E> realizer;
    private final AtomicReferenceArray<E> values;
    private final AtomicIntegerArray states;

    public LazyList(int size, IntFunction<? extends E> realizer) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative");
        }
        this.size = size;
        this.realizer = Objects.requireNonNull(realizer, "realizer");
        this.values = new AtomicReferenceArray<>(size);
        this.states = new AtomicIntegerArray(size);
    }

    @Override
    public E get(int index) {
        Objects.checkIndex(index, size);
        if (states.get(index) == REALIZED) {
            return values.get(index);
        }
        E computed = realizer.apply(index);
        if (states.compareAndSet(index, UNREALIZED, PUBLISHING)) {
            values.set(index, computed);
            states.set(index, REALIZED);
            return computed;
        }
        // Another reader is publishing; its value wins.
        while (states.get(index) != REALIZED) {
            Thread.onSpinWait();
        }
        return values.get(index);
    }

    @Override
    public int size() {
        return size;
    }

    public boolean isRealized(int index) {
        Objects.checkIndex(index, size);
        return states.get(index) == REALIZED;
    }

    public int realizedCount() {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (states.get(i) == REALIZED) {
                count++;
            }
        }
        return count;
    }
}
