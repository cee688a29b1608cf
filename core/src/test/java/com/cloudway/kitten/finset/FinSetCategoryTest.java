/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.finset;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.kitten.category.DomainMismatchException;
import com.cloudway.kitten.laws.CategoryLaws;
import com.cloudway.kitten.laws.LawReport;

public class FinSetCategoryTest {
    private final FinSetCategory<Integer> cat = FinSetCategory.instance();

    private final FinSet<Integer> A = FinSet.of(1, 2);
    private final FinSet<Integer> B = FinSet.of(3, 4);
    private final FinSet<Integer> C = FinSet.of(5, 6);

    private final FinFunction<Integer, Integer> f =
        FinFunction.<Integer, Integer>builder(A, B).put(1, 3).put(2, 4).build();
    private final FinFunction<Integer, Integer> g =
        FinFunction.<Integer, Integer>builder(B, C).put(3, 5).put(4, 6).build();

    @Test
    public void test_singleton() {
        assertSame(FinSetCategory.<Integer>instance(), FinSetCategory.<String>instance());
    }

    @Test
    public void test_dom_codom() {
        assertEquals(A, cat.dom(f));
        assertEquals(B, cat.codom(f));
    }

    @Test
    public void test_compose() {
        FinFunction<Integer, Integer> fg = cat.compose(f, g);
        assertEquals(A, fg.dom());
        assertEquals(C, fg.codom());
        assertEquals(Integer.valueOf(5), fg.apply(1));
        assertEquals(Integer.valueOf(6), fg.apply(2));
    }

    @Test
    public void test_identity() {
        FinFunction<Integer, Integer> id = cat.id(A);
        assertEquals(A, id.dom());
        assertEquals(A, id.codom());
        assertEquals(Integer.valueOf(1), id.apply(1));
        assertEquals(Integer.valueOf(2), id.apply(2));
    }

    @Test
    public void test_identity_laws() {
        assertEquals(f, cat.compose(cat.id(A), f));
        assertEquals(f, cat.compose(f, cat.id(B)));
    }

    @Test
    public void test_associativity() {
        FinFunction<Integer, Integer> h = FinFunction.of(C, A, x -> x - 4);
        assertEquals(cat.compose(cat.compose(f, g), h), cat.compose(f, cat.compose(g, h)));
        assertEquals(cat.compose(f, g, h), cat.compose(f, cat.compose(g, h)));
    }

    @Test
    public void test_domain_mismatch() {
        try {
            cat.compose(f, f);
            fail("composed morphisms with mismatched domain");
        } catch (DomainMismatchException ex) {
            assertEquals(B, ex.getCodomain());
            assertEquals(A, ex.getDomain());
        }
    }

    @Test
    public void test_composable_by_extensional_equality() {
        FinFunction<Integer, Integer> g2 = FinFunction.of(FinSet.of(4, 3), C, x -> x + 2);
        assertTrue(cat.composable(f, g2));
        assertEquals(cat.compose(f, g), cat.compose(f, g2));
    }

    @Test
    public void test_hom() {
        assertEquals(4, cat.hom(A, B).size());
        assertEquals(9, cat.hom(FinSet.of(1, 2), FinSet.of(1, 2, 3)).size());
        assertEquals(1, cat.hom(FinSet.empty(), B).size());
        assertTrue(cat.hom(A, FinSet.empty()).isEmpty());
        assertTrue(cat.hom(A, B).contains(f));
    }

    @Test
    public void test_laws() {
        FinSet<Integer> X = FinSet.of(1, 2);
        FinSet<Integer> Y = FinSet.of(1, 2, 3);
        List<FinSet<Integer>> objects = ImmutableList.of(FinSet.empty(), X, Y);

        ImmutableList.Builder<FinFunction<Integer, Integer>> morphisms = ImmutableList.builder();
        for (FinSet<Integer> s : objects) {
            for (FinSet<Integer> t : objects) {
                morphisms.addAll(cat.hom(s, t));
            }
        }

        LawReport report = CategoryLaws.check(cat, objects, morphisms.build(), true);
        assertTrue(report.toString(), report.isLawful());
        assertTrue(report.checks() > 0);
    }
}
