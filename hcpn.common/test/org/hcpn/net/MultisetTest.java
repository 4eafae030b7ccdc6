package org.hcpn.net;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

/**
 * JUnit test for the token multiset.
 */
public class MultisetTest {

    @Test
    public void testCountsAndNotation() {
        Multiset ms = new Multiset();
        ms.add(5, 2);
        ms.add(7);
        assertEquals(3, ms.size());
        assertEquals(2, ms.count(5));
        assertEquals("2`5 ++ 1`7", ms.toNotation());
    }

    @Test
    public void testEmptyNotation() {
        assertEquals("empty", new Multiset().toNotation());
    }

    @Test
    public void testStringsAreQuoted() {
        Multiset ms = new Multiset(Arrays.asList("a", "b", "a"));
        assertEquals("2`\"a\" ++ 1`\"b\"", ms.toNotation());
    }

    @Test
    public void testContainsAllRespectsMultiplicity() {
        Multiset ms = new Multiset(Arrays.asList(1, 1, 2));
        assertTrue(ms.containsAll(Arrays.asList(1, 1)));
        assertFalse(ms.containsAll(Arrays.asList(2, 2)));
    }

    @Test
    public void testRemoveAllIsAtomic() {
        Multiset ms = new Multiset(Arrays.asList(1, 2));
        assertThrows(IllegalStateException.class, () -> ms.removeAll(Arrays.asList(1, 3)));
        assertEquals(2, ms.size());
    }

    @Test
    public void testRemoveFirstWithdrawsOldest() {
        Multiset ms = new Multiset(Arrays.asList(9, 4, 9));
        assertEquals(9, ms.removeFirst());
        assertEquals(4, ms.removeFirst());
        assertEquals(Arrays.asList(9), ms.getTokens());
    }

    @Test
    public void testEqualityIgnoresOrder() {
        assertEquals(new Multiset(Arrays.asList(1, 2, 2)), new Multiset(Arrays.asList(2, 1, 2)));
        assertFalse(new Multiset(Arrays.asList(1, 2)).equals(new Multiset(Arrays.asList(1, 1))));
    }

    @Test
    public void testReplaceKeepsInstance() {
        Marking marking = new Marking();
        Multiset shared = new Multiset(Arrays.asList(1));
        marking.attach("p", shared);
        marking.setTokens("p", Arrays.asList(3, 4));
        assertEquals(Arrays.asList(3, 4), shared.getTokens());
        assertTrue(marking.isAttached("p"));
    }
}
