/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.optimized;

/**
 * Cursor walking a {@link CircularBuffer} from back to front.
 * It points at the element just before its base cursor, so
 * {@link CircularBuffer#reverseBegin()} wraps {@code end()} and dereferences to the last element.
 *
 * @param <E> type of elements stored in the buffer
 */
public class ReverseBufferCursor<E> implements Comparable<ReverseBufferCursor<E>> {

    private final MutableBufferCursor<E> base;

    ReverseBufferCursor(MutableBufferCursor<E> base) {
        this.base = base;
    }

    /**
     * Forward cursor one position after the element this cursor points at.
     */
    public MutableBufferCursor<E> base() {
        return base.plus(0);
    }

    public E get() {
        return base.get(-1);
    }

    public E get(int n) {
        return base.get(-n - 1);
    }

    public void set(E value) {
        base.set(-1, value);
    }

    public ReverseBufferCursor<E> increment() {
        base.decrement();
        return this;
    }

    public ReverseBufferCursor<E> decrement() {
        base.increment();
        return this;
    }

    public ReverseBufferCursor<E> advance(int n) {
        base.retreat(n);
        return this;
    }

    public ReverseBufferCursor<E> retreat(int n) {
        base.advance(n);
        return this;
    }

    public ReverseBufferCursor<E> plus(int n) {
        return new ReverseBufferCursor<>(base.minus(n));
    }

    public ReverseBufferCursor<E> minus(int n) {
        return new ReverseBufferCursor<>(base.plus(n));
    }

    public int distanceFrom(ReverseBufferCursor<E> other) {
        return other.base.distanceFrom(base);
    }

    @Override
    public int compareTo(ReverseBufferCursor<E> other) {
        return other.base.compareTo(base);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReverseBufferCursor)) {
            return false;
        }
        return base.equals(((ReverseBufferCursor<?>) o).base);
    }

    @Override
    public int hashCode() {
        return ~base.hashCode();
    }

    @Override
    public String toString() {
        return "ReverseBufferCursor[base=" + base.offset() + "]";
    }
}
