/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.optimized;

/**
 * {@link BufferCursor} that can also replace the element it points at.
 *
 * @param <E> type of elements stored in the buffer
 */
public class MutableBufferCursor<E> extends BufferCursor<E> {

    MutableBufferCursor(CircularBuffer<E> buffer, int offset) {
        super(buffer, offset);
    }

    public void set(E value) {
        buffer.store(offset, value);
    }

    public void set(int n, E value) {
        buffer.store(offset + n, value);
    }

    @Override
    public MutableBufferCursor<E> increment() {
        offset++;
        return this;
    }

    @Override
    public MutableBufferCursor<E> decrement() {
        offset--;
        return this;
    }

    @Override
    public MutableBufferCursor<E> advance(int n) {
        offset += n;
        return this;
    }

    @Override
    public MutableBufferCursor<E> retreat(int n) {
        offset -= n;
        return this;
    }

    @Override
    public MutableBufferCursor<E> plus(int n) {
        return new MutableBufferCursor<>(buffer, offset + n);
    }

    @Override
    public MutableBufferCursor<E> minus(int n) {
        return new MutableBufferCursor<>(buffer, offset - n);
    }
}
