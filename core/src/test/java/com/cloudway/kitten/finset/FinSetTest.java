/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.finset;

import com.google.common.collect.ImmutableList;

import org.junit.Test;
import static org.junit.Assert.*;

public class FinSetTest {
    @Test
    public void test_extensional_equality() {
        assertEquals(FinSet.of(1, 2, 3), FinSet.of(3, 1, 2));
        assertEquals(FinSet.of(1, 2, 3).hashCode(), FinSet.of(3, 2, 1).hashCode());
        assertEquals(FinSet.of(1, 2), FinSet.of(1, 2, 2, 1));
        assertNotEquals(FinSet.of(1, 2), FinSet.of(1, 2, 3));
    }

    @Test
    public void test_iteration_order() {
        assertEquals(ImmutableList.of(3, 1, 2), FinSet.of(3, 1, 2, 1).asList());
    }

    @Test
    public void test_contains() {
        FinSet<String> s = FinSet.of("a", "b");
        assertTrue(s.contains("a"));
        assertFalse(s.contains("c"));
        assertFalse(s.contains(null));
        assertTrue(s.containsAll(FinSet.of("b")));
        assertFalse(s.containsAll(FinSet.of("b", "c")));
    }

    @Test
    public void test_range() {
        assertEquals(FinSet.of(1, 2, 3), FinSet.range(1, 3));
        assertTrue(FinSet.range(1, 0).isEmpty());
        assertEquals(FinSet.empty(), FinSet.range(1, 0));
    }

    @Test
    public void test_range_at_integer_bounds() {
        FinSet<Integer> top = FinSet.range(Integer.MAX_VALUE, Integer.MAX_VALUE);
        assertEquals(1, top.size());
        assertTrue(top.contains(Integer.MAX_VALUE));
        assertEquals(FinSet.of(Integer.MIN_VALUE), FinSet.range(Integer.MIN_VALUE, Integer.MIN_VALUE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_invalid_range_at_max_value() {
        FinSet.range(Integer.MAX_VALUE, Integer.MIN_VALUE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_invalid_range() {
        FinSet.range(3, 1);
    }

    @Test(expected = NullPointerException.class)
    public void test_null_element() {
        FinSet.of(1, null);
    }

    @Test
    public void test_toString() {
        assertEquals("{1, 2}", FinSet.of(1, 2).toString());
        assertEquals("{}", FinSet.empty().toString());
    }
}
