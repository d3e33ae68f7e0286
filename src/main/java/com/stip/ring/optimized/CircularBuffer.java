/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.optimized;

import java.util.AbstractList;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.function.Consumer;

/**
 * A growable double-ended ring buffer with O(1) amortized insertion and removal at both ends
 * and O(1) random access.
 *
 * Elements live in a single slot array treated as circular: the element at logical position
 * {@code i} is stored in slot {@code (head + i) % capacity}. Slots outside the logical window
 * are always {@code null}. When full, capacity doubles (starting at 1) and the elements are
 * relaid from slot 0, so cursors obtained from {@link #begin()} / {@link #end()} keep pointing
 * at the same logical element across growth.
 *
 * <p>The native operations ({@link #elementAt(int)}, {@link #front()}, {@link #back()},
 * {@link #popFront()}, {@link #popBack()} and cursor dereference) are not range checked.
 * Misuse only trips an {@code assert}. The {@link java.util.List} and {@link Deque} methods
 * keep their usual contracts.</p>
 *
 * <p>Equality is elementwise, as for any {@link java.util.List}. This class is not thread-safe.</p>
 *
 * @param <E> type of elements stored in the buffer
 */
public class CircularBuffer<E> extends AbstractList<E> implements Deque<E>, RandomAccess, Cloneable {

    /**
     * Shared slot array of every buffer with zero capacity
     */
    private static final Object[] EMPTY_ELEMENTDATA = {};

    /**
     * Largest slot array the VM is reliably able to allocate
     */
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    /**
     * Slot array, its length is the capacity
     */
    private Object[] elements;

    /**
     * Slot holding the logical first element
     */
    private int head;

    /**
     * Number of live elements
     */
    private int size;

    /**
     * Copy operation used by the copy constructor, assign and clone
     */
    private final ElementCopier<E> copier;

    /**
     * Constructs an empty buffer with zero capacity. Nothing is allocated until the first push.
     */
    public CircularBuffer() {
        this(ElementCopier.identity());
    }

    /**
     * Constructs an empty buffer with zero capacity whose copies are made by {@code copier}.
     */
    public CircularBuffer(ElementCopier<E> copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
        this.elements = EMPTY_ELEMENTDATA;
    }

    /**
     * Constructs a copy of {@code other} holding exactly {@code other.size()} slots.
     * The elements are copied in logical order with {@code other}'s copier. If a copy fails,
     * the copies already made are discarded and {@code other} is left untouched.
     */
    public CircularBuffer(CircularBuffer<E> other) {
        this(other, other.size, other.copier, other.copier);
    }

    private CircularBuffer(CircularBuffer<E> source, int capacity, ElementCopier<E> via, ElementCopier<E> copier) {
        this.copier = copier;
        this.elements = capacity == 0 ? EMPTY_ELEMENTDATA : new Object[capacity];
        if (via == ElementCopier.<E>identity()) {
            source.copyInto(elements);
        } else {
            copyElementsOf(source, via);
        }
        this.size = source.size;
    }

    private void copyElementsOf(CircularBuffer<E> source, ElementCopier<E> via) {
        int copied = 0;
        try {
            for (; copied < source.size; copied++) {
                elements[copied] = via.copy(source.elementAt(copied));
            }
        } catch (RuntimeException | Error e) {
            for (int i = 0; i < copied; i++) {
                try {
                    via.discard(elementData(i));
                } catch (RuntimeException suppressed) {
                    e.addSuppressed(suppressed);
                }
                elements[i] = null;
            }
            throw e;
        }
    }

    /**
     * Copies the live elements in logical order into the front of {@code dst}.
     */
    private void copyInto(Object[] dst) {
        int firstPart = Math.min(size, elements.length - head);
        System.arraycopy(elements, head, dst, 0, firstPart);
        System.arraycopy(elements, 0, dst, firstPart, size - firstPart);
    }

    /**
     * Replaces the content of this buffer with a copy of {@code other}.
     * The copy is built aside and adopted only once complete, so a failing copy
     * leaves this buffer unchanged. Afterwards the capacity equals {@code other.size()}.
     */
    public void assign(CircularBuffer<E> other) {
        if (other == this) {
            return;
        }
        CircularBuffer<E> copy = new CircularBuffer<>(other);
        exchangeState(copy);
        modCount++;
    }

    /**
     * Exchanges storage, head and size of two buffers. Never fails and never allocates.
     */
    public static <E> void swap(CircularBuffer<E> a, CircularBuffer<E> b) {
        a.exchangeState(b);
        a.modCount++;
        b.modCount++;
    }

    private void exchangeState(CircularBuffer<E> other) {
        Object[] elements = this.elements;
        this.elements = other.elements;
        other.elements = elements;

        int head = this.head;
        this.head = other.head;
        other.head = head;

        int size = this.size;
        this.size = other.size;
        other.size = size;
    }

    /**
     * Removes every element and releases the slot array, leaving a zero capacity buffer.
     */
    public void dispose() {
        clear();
        elements = EMPTY_ELEMENTDATA;
        head = 0;
    }

    /**
     * Returns the number of slots currently allocated.
     */
    public int capacity() {
        return elements.length;
    }

    /**
     * Grows the buffer to hold at least {@code minCapacity} elements.
     * Does nothing when the capacity already suffices.
     */
    public void reserve(int minCapacity) {
        ensureCapacity(minCapacity);
    }

    private void ensureCapacity(int minCapacity) {
        if (elements.length < minCapacity) {
            CircularBuffer<E> grown = new CircularBuffer<>(this, minCapacity, ElementCopier.identity(), copier);
            exchangeState(grown);
        }
    }

    private void grow() {
        int capacity = elements.length;
        if (capacity == MAX_CAPACITY) {
            throw new OutOfMemoryError("Required buffer capacity exceeds " + MAX_CAPACITY);
        }
        int newCapacity;
        if (capacity == 0) {
            newCapacity = 1;
        } else if (capacity > MAX_CAPACITY / 2) {
            newCapacity = MAX_CAPACITY;
        } else {
            newCapacity = capacity * 2;
        }
        ensureCapacity(newCapacity);
    }

    private int physicalIndex(int offset) {
        return Math.floorMod(head + offset, elements.length);
    }

    @SuppressWarnings("unchecked")
    private E elementData(int slot) {
        return (E) elements[slot];
    }

    /**
     * Returns the element at logical position {@code index} without a range check.
     */
    public E elementAt(int index) {
        assert index >= 0 && index < size : "Index: " + index + ", Size: " + size;
        return elementData(physicalIndex(index));
    }

    /**
     * Returns the first element. The buffer must not be empty.
     */
    public E front() {
        assert size > 0 : "front of empty buffer";
        return elementData(head);
    }

    /**
     * Returns the last element. The buffer must not be empty.
     */
    public E back() {
        assert size > 0 : "back of empty buffer";
        return elementData(physicalIndex(size - 1));
    }

    /**
     * Appends {@code value}, doubling the capacity first if the buffer is full.
     */
    public void pushBack(E value) {
        if (size == elements.length) {
            grow();
        }
        elements[physicalIndex(size)] = value;
        size++;
        modCount++;
    }

    /**
     * Prepends {@code value}, doubling the capacity first if the buffer is full.
     */
    public void pushFront(E value) {
        if (size == elements.length) {
            grow();
        }
        head = head == 0 ? elements.length - 1 : head - 1;
        elements[head] = value;
        size++;
        modCount++;
    }

    /**
     * Removes and returns the last element. The buffer must not be empty.
     */
    public E popBack() {
        assert size > 0 : "popBack on empty buffer";
        int slot = physicalIndex(size - 1);
        E value = elementData(slot);
        elements[slot] = null;
        size--;
        modCount++;
        return value;
    }

    /**
     * Removes and returns the first element. The buffer must not be empty.
     */
    public E popFront() {
        assert size > 0 : "popFront on empty buffer";
        E value = elementData(head);
        elements[head] = null;
        head = head + 1 == elements.length ? 0 : head + 1;
        size--;
        modCount++;
        return value;
    }

    // Cursor support, offsets are relative to the current head.

    E slot(int offset) {
        assert offset >= 0 && offset < size : "Offset: " + offset + ", Size: " + size;
        return elementData(physicalIndex(offset));
    }

    void store(int offset, E value) {
        assert offset >= 0 && offset < size : "Offset: " + offset + ", Size: " + size;
        elements[physicalIndex(offset)] = value;
    }

    private void swapSlots(int a, int b) {
        int slotA = physicalIndex(a);
        int slotB = physicalIndex(b);
        Object tmp = elements[slotA];
        elements[slotA] = elements[slotB];
        elements[slotB] = tmp;
    }

    /**
     * Cursor at the first element.
     */
    public MutableBufferCursor<E> begin() {
        return new MutableBufferCursor<>(this, 0);
    }

    /**
     * Cursor one past the last element.
     */
    public MutableBufferCursor<E> end() {
        return new MutableBufferCursor<>(this, size);
    }

    /**
     * Reverse cursor at the last element.
     */
    public ReverseBufferCursor<E> reverseBegin() {
        return new ReverseBufferCursor<>(end());
    }

    /**
     * Reverse cursor one before the first element.
     */
    public ReverseBufferCursor<E> reverseEnd() {
        return new ReverseBufferCursor<>(begin());
    }

    /**
     * Inserts {@code value} before {@code pos} and returns a cursor to it.
     *
     * The value is pushed at whichever end is closer to {@code pos} and then swapped
     * into place, so at most half of the elements move. Cursors into the shifted part
     * no longer point at their former element.
     */
    public MutableBufferCursor<E> insert(BufferCursor<E> pos, E value) {
        assert pos.buffer == this : "cursor of another buffer";
        int delta = pos.offset;
        if (delta < size / 2) {
            pushFront(value);
            for (int i = 0; i < delta; i++) {
                swapSlots(i, i + 1);
            }
        } else {
            pushBack(value);
            for (int i = size - 1; i > delta; i--) {
                swapSlots(i, i - 1);
            }
        }
        return new MutableBufferCursor<>(this, delta);
    }

    /**
     * Removes the element at {@code pos} and returns a cursor to the element that followed it.
     */
    public MutableBufferCursor<E> erase(BufferCursor<E> pos) {
        return erase(pos, pos.plus(1));
    }

    /**
     * Removes the elements in {@code [first, last)} and returns a cursor to the element that
     * followed the range. The smaller of the regions before and after the range is slid over
     * the gap and the vacated end is popped.
     */
    public MutableBufferCursor<E> erase(BufferCursor<E> first, BufferCursor<E> last) {
        assert first.buffer == this && last.buffer == this : "cursor of another buffer";
        int from = first.offset;
        int to = last.offset;
        int delta = to - from;
        if (size - to < from) {
            for (int i = from; i + delta < size; i++) {
                swapSlots(i, i + delta);
            }
            for (int i = 0; i < delta; i++) {
                popBack();
            }
        } else if (delta != 0) {
            for (int i = to - 1; i >= delta; i--) {
                swapSlots(i, i - delta);
            }
            for (int i = 0; i < delta; i++) {
                popFront();
            }
        }
        return new MutableBufferCursor<>(this, from);
    }

    /**
     * Removes all elements. The capacity is unchanged.
     */
    @Override
    public void clear() {
        while (size > 0) {
            popBack();
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Gets the element at the specified position in this list
     */
    @Override
    public E get(int index) {
        rangeCheck(index);
        return elementAt(index);
    }

    /**
     * Replaces the element at the specified position in this list with the specified element
     */
    @Override
    public E set(int index, E element) {
        rangeCheck(index);
        int slot = physicalIndex(index);
        E oldValue = elementData(slot);
        elements[slot] = element;
        return oldValue;
    }

    @Override
    public boolean add(E e) {
        pushBack(e);
        return true;
    }

    /**
     * Inserts an element at the specified position in this list
     */
    @Override
    public void add(int index, E element) {
        rangeCheckForAdd(index);
        insert(new BufferCursor<>(this, index), element);
    }

    /**
     * Removes the element at the specified position in this list
     */
    @Override
    public E remove(int index) {
        rangeCheck(index);
        E oldValue = elementAt(index);
        erase(new BufferCursor<>(this, index));
        return oldValue;
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        erase(new BufferCursor<>(this, fromIndex), new BufferCursor<>(this, toIndex));
    }

    @Override
    public Object[] toArray() {
        Object[] result = new Object[size];
        copyInto(result);
        return result;
    }

    @Override
    public void addFirst(E e) {
        pushFront(e);
    }

    @Override
    public void addLast(E e) {
        pushBack(e);
    }

    @Override
    public boolean offerFirst(E e) {
        pushFront(e);
        return true;
    }

    @Override
    public boolean offerLast(E e) {
        pushBack(e);
        return true;
    }

    @Override
    public E removeFirst() {
        checkNotEmpty();
        return popFront();
    }

    @Override
    public E removeLast() {
        checkNotEmpty();
        return popBack();
    }

    @Override
    public E pollFirst() {
        return size == 0 ? null : popFront();
    }

    @Override
    public E pollLast() {
        return size == 0 ? null : popBack();
    }

    @Override
    public E getFirst() {
        checkNotEmpty();
        return front();
    }

    @Override
    public E getLast() {
        checkNotEmpty();
        return back();
    }

    @Override
    public E peekFirst() {
        return size == 0 ? null : front();
    }

    @Override
    public E peekLast() {
        return size == 0 ? null : back();
    }

    @Override
    public boolean removeFirstOccurrence(Object o) {
        for (int i = 0; i < size; i++) {
            if (Objects.equals(o, elementAt(i))) {
                erase(new BufferCursor<>(this, i));
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean removeLastOccurrence(Object o) {
        for (int i = size - 1; i >= 0; i--) {
            if (Objects.equals(o, elementAt(i))) {
                erase(new BufferCursor<>(this, i));
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean remove(Object o) {
        return removeFirstOccurrence(o);
    }

    @Override
    public boolean offer(E e) {
        return offerLast(e);
    }

    @Override
    public E remove() {
        return removeFirst();
    }

    @Override
    public E poll() {
        return pollFirst();
    }

    @Override
    public E element() {
        return getFirst();
    }

    @Override
    public E peek() {
        return peekFirst();
    }

    @Override
    public void push(E e) {
        addFirst(e);
    }

    @Override
    public E pop() {
        return removeFirst();
    }

    @Override
    public void forEach(Consumer<? super E> action) {
        Objects.requireNonNull(action);
        final int expectedModCount = modCount;
        for (int i = 0; i < size; i++) {
            action.accept(elementAt(i));
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }

    /**
     * Returns a copy of this buffer, see {@link #CircularBuffer(CircularBuffer)}.
     */
    @Override
    public CircularBuffer<E> clone() {
        try {
            @SuppressWarnings("unchecked")
            CircularBuffer<E> clone = (CircularBuffer<E>) super.clone();
            clone.exchangeState(new CircularBuffer<>(this));
            clone.modCount = 0;
            return clone;
        } catch (CloneNotSupportedException e) {
            throw new InternalError(e);
        }
    }

    @Override
    public Iterator<E> iterator() {
        return new Itr();
    }

    @Override
    public ListIterator<E> listIterator() {
        return new ListItr(0);
    }

    @Override
    public ListIterator<E> listIterator(int index) {
        rangeCheckForAdd(index);
        return new ListItr(index);
    }

    @Override
    public Iterator<E> descendingIterator() {
        return new DescendingItr();
    }

    private class Itr implements Iterator<E> {
        int cursor = 0;
        int lastRet = -1;
        int expectedModCount = modCount;

        Itr() {}

        @Override
        public boolean hasNext() {
            return cursor < size;
        }

        @Override
        public E next() {
            checkForComodification();
            int i = cursor;
            if (i >= size)
                throw new NoSuchElementException();
            E next = elementAt(i);
            lastRet = i;
            cursor = i + 1;
            return next;
        }

        @Override
        public void remove() {
            if (lastRet < 0)
                throw new IllegalStateException();
            checkForComodification();

            CircularBuffer.this.remove(lastRet);
            if (lastRet < cursor)
                cursor--;
            lastRet = -1;
            expectedModCount = modCount;
        }

        final void checkForComodification() {
            if (modCount != expectedModCount)
                throw new ConcurrentModificationException();
        }
    }

    private class ListItr extends Itr implements ListIterator<E> {
        ListItr(int index) {
            cursor = index;
        }

        @Override
        public boolean hasPrevious() {
            return cursor > 0;
        }

        @Override
        public E previous() {
            checkForComodification();
            int i = cursor - 1;
            if (i < 0)
                throw new NoSuchElementException();
            E previous = elementAt(i);
            lastRet = cursor = i;
            return previous;
        }

        @Override
        public int nextIndex() {
            return cursor;
        }

        @Override
        public int previousIndex() {
            return cursor - 1;
        }

        @Override
        public void set(E e) {
            if (lastRet < 0)
                throw new IllegalStateException();
            checkForComodification();
            CircularBuffer.this.set(lastRet, e);
        }

        @Override
        public void add(E e) {
            checkForComodification();
            int i = cursor;
            CircularBuffer.this.add(i, e);
            cursor = i + 1;
            lastRet = -1;
            expectedModCount = modCount;
        }
    }

    private class DescendingItr extends Itr {
        DescendingItr() {
            cursor = size - 1;
        }

        @Override
        public boolean hasNext() {
            return cursor >= 0;
        }

        @Override
        public E next() {
            checkForComodification();
            int i = cursor;
            if (i < 0)
                throw new NoSuchElementException();
            E next = elementAt(i);
            lastRet = i;
            cursor = i - 1;
            return next;
        }

        @Override
        public void remove() {
            if (lastRet < 0)
                throw new IllegalStateException();
            checkForComodification();

            CircularBuffer.this.remove(lastRet);
            lastRet = -1;
            expectedModCount = modCount;
        }
    }

    private void checkNotEmpty() {
        if (size == 0)
            throw new NoSuchElementException("Buffer is empty");
    }

    private void rangeCheckForAdd(int index) {
        if (index < 0 || index > size)
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
    }

    private void rangeCheck(int index) {
        if (index < 0 || index >= size)
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
    }
}
