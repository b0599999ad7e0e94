package com.automata.fsa.graph;

import org.junit.Test;

import java.util.PrimitiveIterator;

import static org.junit.Assert.*;

public class StateSetTest {

    @Test
    public void testEmptySet() {
        StateSet empty = StateSet.empty(10);
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertEquals(10, empty.capacity());
        assertEquals(-1, empty.nextState(0));
        assertEquals("{}", empty.toString());
    }

    @Test
    public void testZeroCapacity() {
        StateSet empty = StateSet.empty(0);
        assertTrue(empty.isEmpty());
        assertFalse(empty.contains(0));
        assertArrayEquals(new int[0], empty.toArray());
    }

    @Test
    public void testMembershipAcrossWordBoundary() {
        // 130 states span three 64-bit words
        StateSet s = StateSet.of(130, 0, 63, 64, 129);
        assertEquals(4, s.size());
        assertTrue(s.contains(63));
        assertTrue(s.contains(64));
        assertTrue(s.contains(129));
        assertFalse(s.contains(65));
        assertFalse(s.contains(-1));
        assertFalse(s.contains(130));
        assertArrayEquals(new int[] { 0, 63, 64, 129 }, s.toArray());
    }

    @Test
    public void testDuplicatesCollapse() {
        StateSet s = StateSet.of(8, 3, 3, 5, 3);
        assertEquals(2, s.size());
        assertEquals(StateSet.of(8, 5, 3), s);
        assertEquals(StateSet.of(8, 5, 3).hashCode(), s.hashCode());
    }

    @Test
    public void testUnionAndIntersects() {
        StateSet a = StateSet.of(100, 1, 70);
        StateSet b = StateSet.of(100, 2, 70);
        StateSet c = StateSet.of(100, 3);

        assertEquals(StateSet.of(100, 1, 2, 70), a.union(b));
        assertTrue(a.intersects(b));
        assertFalse(a.intersects(c));
        // union never modifies its operands
        assertEquals(2, a.size());
        assertEquals(2, b.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMixingAutomataRejected() {
        StateSet.of(4, 1).union(StateSet.of(5, 1));
    }

    @Test
    public void testIteratorOrder() {
        PrimitiveIterator.OfInt it = StateSet.of(200, 150, 2, 64).iterator();
        assertEquals(2, it.nextInt());
        assertEquals(64, it.nextInt());
        assertEquals(150, it.nextInt());
        assertFalse(it.hasNext());
    }

    @Test
    public void testBuilderReportsNewMembers() {
        StateSet.Builder b = StateSet.builder(5);
        assertTrue(b.add(1));
        assertFalse(b.add(1));
        assertTrue(b.contains(1));
        StateSet first = b.build();
        b.add(4);
        // built sets are snapshots
        assertEquals(StateSet.of(5, 1), first);
        assertEquals(StateSet.of(5, 1, 4), b.build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBuilderRejectsOutOfRange() {
        StateSet.builder(3).add(3);
    }

    @Test
    public void testToString() {
        assertEquals("{0, 7}", StateSet.of(8, 7, 0).toString());
    }
}
