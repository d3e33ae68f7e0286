package com.stip.ring.optimized;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BufferCursorTest {

    @Test
    void shouldWalkForwardFromBeginToEnd() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        List<Integer> seen = new ArrayList<>();
        for (MutableBufferCursor<Integer> it = buffer.begin(); !it.equals(buffer.end()); it.increment()) {
            seen.add(it.get());
        }
        assertEquals(List.of(3, 4, 5, 6), seen);
        assertEquals(4, buffer.end().distanceFrom(buffer.begin()));
    }

    @Test
    void shouldSupportRandomAccessArithmetic() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        MutableBufferCursor<Integer> it = buffer.begin();

        assertSame(it, it.advance(3));
        assertEquals(6, it.get());
        assertSame(it, it.retreat(2));
        assertEquals(4, it.get());
        assertSame(it, it.decrement());
        assertEquals(3, it.get());

        assertEquals(5, it.get(2));
        assertEquals(6, buffer.end().get(-1));
        assertEquals(4, buffer.end().minus(3).get());
    }

    @Test
    void shouldLeaveCursorUntouchedByPlusAndMinus() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        MutableBufferCursor<Integer> it = buffer.begin().plus(1);
        MutableBufferCursor<Integer> later = it.plus(2);
        MutableBufferCursor<Integer> earlier = it.minus(1);

        assertEquals(1, it.offset());
        assertEquals(3, later.offset());
        assertEquals(0, earlier.offset());
        assertEquals(2, later.distanceFrom(it));
        assertEquals(-1, earlier.distanceFrom(it));
    }

    @Test
    void shouldOrderByOffset() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        BufferCursor<Integer> first = buffer.begin();
        BufferCursor<Integer> third = buffer.begin().plus(2);

        assertTrue(first.compareTo(third) < 0);
        assertTrue(third.compareTo(first) > 0);
        assertEquals(0, third.compareTo(buffer.end().minus(2)));
    }

    @Test
    void shouldCompareEqualOnlyWithinSameBuffer() {
        CircularBuffer<Integer> a = CircularBufferTest.wrappedBuffer();
        CircularBuffer<Integer> b = CircularBufferTest.wrappedBuffer();

        assertEquals(a.begin(), a.begin());
        assertEquals(a.begin().hashCode(), a.begin().hashCode());
        assertNotEquals(a.begin(), b.begin());
        assertNotEquals(a.begin(), a.begin().plus(1));
    }

    @Test
    void shouldTreatMutableAndReadOnlyCursorsAlike() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        MutableBufferCursor<Integer> mutable = buffer.begin().plus(2);
        BufferCursor<Integer> readOnly = mutable.readOnly();

        assertEquals(mutable, readOnly);
        assertEquals(readOnly, mutable);
        assertEquals(5, readOnly.get());

        mutable.increment();
        assertEquals(2, readOnly.offset());
    }

    @Test
    void shouldWriteThroughMutableCursor() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        MutableBufferCursor<Integer> it = buffer.begin();
        it.set(30);
        it.set(3, 60);
        assertEquals(List.of(30, 4, 5, 60), buffer);
    }

    @Test
    void shouldKeepPointingAtSameElementAcrossGrowth() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        MutableBufferCursor<Integer> second = buffer.begin().plus(1);
        BufferCursor<Integer> last = buffer.end().minus(1).readOnly();
        assertEquals(4, buffer.capacity());

        buffer.pushBack(7);

        assertEquals(8, buffer.capacity());
        assertEquals(4, second.get());
        assertEquals(6, last.get());

        buffer.reserve(100);
        assertEquals(4, second.get());
        assertEquals(6, last.get());
    }

    @Test
    void shouldResolveAgainstCurrentHeadAfterPop() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        MutableBufferCursor<Integer> it = buffer.begin().plus(1);
        assertEquals(4, it.get());

        buffer.popFront();
        assertEquals(5, it.get());
    }

    @Test
    void shouldWalkBackwardWithReverseCursors() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        List<Integer> seen = new ArrayList<>();
        for (ReverseBufferCursor<Integer> it = buffer.reverseBegin(); !it.equals(buffer.reverseEnd()); it.increment()) {
            seen.add(it.get());
        }
        assertEquals(List.of(6, 5, 4, 3), seen);
        assertEquals(4, buffer.reverseEnd().distanceFrom(buffer.reverseBegin()));
    }

    @Test
    void shouldMirrorArithmeticOnReverseCursors() {
        CircularBuffer<Integer> buffer = CircularBufferTest.wrappedBuffer();
        ReverseBufferCursor<Integer> it = buffer.reverseBegin();

        assertEquals(6, it.get());
        assertEquals(4, it.get(2));
        assertEquals(5, it.plus(1).get());
        assertEquals(buffer.end(), it.base());
        assertTrue(it.compareTo(it.plus(1)) < 0);

        it.advance(3).decrement();
        assertEquals(4, it.get());
        it.set(40);
        assertEquals(List.of(3, 40, 5, 6), buffer);
        assertEquals(buffer.reverseBegin(), it.minus(2));
    }
}
