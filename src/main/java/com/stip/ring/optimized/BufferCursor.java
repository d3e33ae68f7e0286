/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.optimized;

/**
 * Read-only random-access position in a {@link CircularBuffer}.
 *
 * A cursor is a (buffer, logical offset) pair and never caches a slot: the slot is
 * resolved against the buffer's current head on every access. Growing the buffer therefore
 * keeps the cursor on the same element, while insert, erase and pops shift offsets and
 * leave cursors in the shifted part pointing elsewhere.
 *
 * <p>Dereferencing outside {@code [begin, end)} is not range checked.</p>
 *
 * @param <E> type of elements stored in the buffer
 */
public class BufferCursor<E> implements Comparable<BufferCursor<E>> {

    final CircularBuffer<E> buffer;

    int offset;

    BufferCursor(CircularBuffer<E> buffer, int offset) {
        this.buffer = buffer;
        this.offset = offset;
    }

    /**
     * Logical offset from the first element of the buffer.
     */
    public int offset() {
        return offset;
    }

    public E get() {
        return buffer.slot(offset);
    }

    /**
     * Element {@code n} positions away from this cursor.
     */
    public E get(int n) {
        return buffer.slot(offset + n);
    }

    public BufferCursor<E> increment() {
        offset++;
        return this;
    }

    public BufferCursor<E> decrement() {
        offset--;
        return this;
    }

    public BufferCursor<E> advance(int n) {
        offset += n;
        return this;
    }

    public BufferCursor<E> retreat(int n) {
        offset -= n;
        return this;
    }

    public BufferCursor<E> plus(int n) {
        return new BufferCursor<>(buffer, offset + n);
    }

    public BufferCursor<E> minus(int n) {
        return new BufferCursor<>(buffer, offset - n);
    }

    /**
     * Number of positions from {@code other} to this cursor.
     */
    public int distanceFrom(BufferCursor<E> other) {
        return offset - other.offset;
    }

    /**
     * Detached read-only cursor at the same position.
     */
    public BufferCursor<E> readOnly() {
        return new BufferCursor<>(buffer, offset);
    }

    /**
     * Orders by offset only. Cursors of different buffers have no meaningful order.
     */
    @Override
    public int compareTo(BufferCursor<E> other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BufferCursor)) {
            return false;
        }
        BufferCursor<?> other = (BufferCursor<?>) o;
        return buffer == other.buffer && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(buffer) + offset;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[offset=" + offset + "]";
    }
}
