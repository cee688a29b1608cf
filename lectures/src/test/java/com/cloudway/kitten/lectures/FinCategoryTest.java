/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import com.google.common.collect.ImmutableList;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.kitten.category.DomainMismatchException;
import com.cloudway.kitten.finset.KeyNotFoundException;
import com.cloudway.kitten.laws.CategoryLaws;

public class FinCategoryTest {
    private static final FinCategory fin = FinCategory.INSTANCE;

    @Test
    public void test_apply() {
        FinMap f = FinMap.of(3, 2, 3);
        assertEquals(2, f.dom());
        assertEquals(3, f.codom());
        assertEquals(2, f.apply(1));
        assertEquals(3, f.apply(2));
    }

    @Test(expected = KeyNotFoundException.class)
    public void test_apply_outside_domain() {
        FinMap.of(3, 2, 3).apply(3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_image_outside_codomain() {
        FinMap.of(2, 1, 3);
    }

    @Test
    public void test_compose() {
        FinMap f = FinMap.of(3, 2, 3);
        FinMap g = FinMap.of(2, 2, 1, 1);
        assertEquals(FinMap.of(2, 1, 1), fin.compose(f, g));
    }

    @Test(expected = DomainMismatchException.class)
    public void test_domain_mismatch() {
        fin.compose(FinMap.of(3, 2, 3), FinMap.of(3, 1, 2));
    }

    @Test
    public void test_laws() {
        assertTrue(CategoryLaws.check(fin, ImmutableList.of(0, 1, 2, 3),
                                      ImmutableList.of(FinMap.of(3, 2, 3), FinMap.of(2, 2, 1, 1),
                                                       FinMap.of(1, 1, 1), FinMap.of(2, 2),
                                                       FinMap.of(3)),
                                      true).isLawful());
    }

    @Test
    public void test_toString() {
        assertEquals("{1↦2, 2↦3}: 2 -> 3", FinMap.of(3, 2, 3).toString());
    }
}
