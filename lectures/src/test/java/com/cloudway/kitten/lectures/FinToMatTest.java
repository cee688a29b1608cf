/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.kitten.category.Functor;
import com.cloudway.kitten.category.KittenCategory;
import com.cloudway.kitten.laws.FunctorLaws;
import com.cloudway.kitten.laws.LawReport;

public class FinToMatTest {
    private static final FinToMat F = FinToMat.INSTANCE;

    @Test
    public void test_source_target() {
        assertSame(FinCategory.INSTANCE, F.source());
        assertSame(MatCategory.INSTANCE, F.target());
        assertSame(FinCategory.INSTANCE, KittenCategory.INSTANCE.dom(F));
        assertSame(MatCategory.INSTANCE, KittenCategory.INSTANCE.codom(F));
    }

    @Test
    public void test_obMap() {
        assertEquals(Integer.valueOf(3), F.obMap(3));
    }

    @Test
    public void test_indicator_matrix() {
        FinMap f = FinMap.of(3, 2, 3);
        assertEquals(Matrix.of(new long[]{0, 1, 0}, new long[]{0, 0, 1}), F.homMap(f));
    }

    @Test
    public void test_identity() {
        assertEquals(Matrix.of(new long[]{1, 0}, new long[]{0, 1}), F.homMap(FinCategory.INSTANCE.id(2)));
    }

    @Test
    public void test_identity_preservation() {
        for (int n = 0; n <= 4; n++) {
            assertEquals(MatCategory.INSTANCE.id(F.obMap(n)), F.homMap(FinCategory.INSTANCE.id(n)));
        }
    }

    @Test
    public void test_composition_preservation() {
        FinMap r = FinMap.of(3, 2, 3);      // 2 -> 3
        FinMap s = FinMap.of(2, 1, 1, 2);   // 3 -> 2
        Matrix expected = MatCategory.INSTANCE.compose(F.homMap(r), F.homMap(s));
        assertEquals(expected, F.homMap(FinCategory.INSTANCE.compose(r, s)));
        assertEquals(Matrix.of(new long[]{1, 0}, new long[]{0, 1}), expected);
    }

    @Test
    public void test_laws() {
        List<FinMap> morphisms = ImmutableList.of(
            FinMap.of(3, 2, 3),
            FinMap.of(2, 1, 1, 2),
            FinMap.of(3, 3, 1, 2),
            FinMap.of(2, 2, 2),
            FinMap.of(2),
            FinMap.identity(3));

        LawReport report = FunctorLaws.check(F, ImmutableList.of(0, 1, 2, 3), morphisms, true);
        assertTrue(report.toString(), report.isLawful());
    }

    @Test
    public void test_composed_with_identity() {
        Functor<?,?,?,?> G = KittenCategory.INSTANCE.compose(F, KittenCategory.INSTANCE.id(MatCategory.INSTANCE));
        assertSame(F, G);
    }

    @Test
    public void test_composed_with_transpose() {
        Functor<Integer, FinMap, Integer, Matrix> G = F.then(Lecture.transpose());
        assertSame(FinCategory.INSTANCE, G.source());
        assertSame(Lecture.COLUMN_MAT, G.target());
        assertEquals(Matrix.of(new long[]{0, 0}, new long[]{1, 0}, new long[]{0, 1}),
                     G.homMap(FinMap.of(3, 2, 3)));

        LawReport report = FunctorLaws.check(G, ImmutableList.of(1, 2, 3),
                                             ImmutableList.of(FinMap.of(3, 2, 3), FinMap.of(2, 1, 1, 2)),
                                             true);
        assertTrue(report.toString(), report.isLawful());
    }
}
