/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.optimized;

/**
 * Copy operation of an element type, used when a {@link CircularBuffer} is copied
 * (copy constructor, {@link CircularBuffer#assign(CircularBuffer)}, {@link CircularBuffer#clone()}).
 *
 * <p>A copier may throw any {@link RuntimeException}. When that happens part way through a
 * copy, every copy already produced for the aborted operation is handed to
 * {@link #discard(Object)} before the exception reaches the caller.</p>
 *
 * @param <E> type of elements copied
 */
@FunctionalInterface
public interface ElementCopier<E> {

    /**
     * Returns a copy of the given element.
     */
    E copy(E element);

    /**
     * Releases a copy produced by {@link #copy(Object)} that will never be stored.
     */
    default void discard(E copy) {
    }

    /**
     * Copier sharing references, the usual semantics of a Java collection copy.
     */
    @SuppressWarnings("unchecked")
    static <E> ElementCopier<E> identity() {
        ElementCopier<?> identity = Identity.INSTANCE;
        return (ElementCopier<E>) identity;
    }

    enum Identity implements ElementCopier<Object> {
        INSTANCE;

        @Override
        public Object copy(Object element) {
            return element;
        }
    }
}
