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
import com.cloudway.kitten.laws.CategoryLaws;

public class MatCategoryTest {
    private static final MatCategory mat = MatCategory.INSTANCE;

    private final Matrix A = Matrix.of(new long[]{1, 2, 3}, new long[]{4, 5, 6});      // 2 -> 3
    private final Matrix B = Matrix.of(new long[]{1, 0}, new long[]{0, 1}, new long[]{1, 1}); // 3 -> 2

    @Test
    public void test_dom_codom() {
        assertEquals(Integer.valueOf(2), mat.dom(A));
        assertEquals(Integer.valueOf(3), mat.codom(A));
    }

    @Test
    public void test_compose_is_multiplication() {
        assertEquals(Matrix.of(new long[]{4, 5}, new long[]{10, 11}), mat.compose(A, B));
    }

    @Test
    public void test_identity() {
        assertEquals(Matrix.of(new long[]{1, 0, 0}, new long[]{0, 1, 0}, new long[]{0, 0, 1}), mat.id(3));
        assertEquals(A, mat.compose(mat.id(2), A));
        assertEquals(A, mat.compose(A, mat.id(3)));
    }

    @Test(expected = DomainMismatchException.class)
    public void test_domain_mismatch() {
        mat.compose(A, A);
    }

    @Test
    public void test_laws() {
        Matrix C = Matrix.of(new long[]{2, -1}, new long[]{0, 3});
        assertTrue(CategoryLaws.check(mat, ImmutableList.of(0, 2, 3),
                                      ImmutableList.of(A, B, C, Matrix.zero(2, 0), Matrix.zero(0, 3)),
                                      true).isLawful());
    }

    @Test
    public void test_matrix() {
        assertEquals(6, A.get(1, 2));
        assertArrayEquals(new long[]{4, 5, 6}, A.toArray()[1]);
        assertEquals("[[1,2,3],[4,5,6]]", A.toString());
        assertEquals(Matrix.zero(2, 3), Matrix.tabulate(2, 3, (i, j) -> 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_ragged_matrix() {
        Matrix.of(new long[]{1, 2}, new long[]{3});
    }

    @Test
    public void test_dimension_overflow() {
        try {
            Matrix.zero(Integer.MAX_VALUE, 2);
            fail("matrix size overflow not detected");
        } catch (IllegalArgumentException ex) {
            assertEquals("matrix too large: " + Integer.MAX_VALUE + "x2", ex.getMessage());
        }
    }

    @Test
    public void test_empty_dimension() {
        Matrix m = Matrix.zero(0, Integer.MAX_VALUE);
        assertEquals(0, m.rows());
        assertEquals(Integer.MAX_VALUE, m.cols());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void test_index_out_of_bounds() {
        A.get(2, 0);
    }
}
