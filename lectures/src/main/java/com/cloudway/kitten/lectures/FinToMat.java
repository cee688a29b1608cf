/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import com.cloudway.kitten.category.Category;
import com.cloudway.kitten.category.Functor;

/**
 * The functor from finite sets to matrices. A function
 * {@code f: {1..n} -> {1..m}} is mapped to its {@code n x m} indicator
 * matrix, which has a 1 in row {@code i}, column {@code f(i)} and 0
 * everywhere else.
 */
public enum FinToMat implements Functor<Integer, FinMap, Integer, Matrix> {
    INSTANCE;

    @Override
    public Category<Integer, FinMap> source() {
        return FinCategory.INSTANCE;
    }

    @Override
    public Category<Integer, Matrix> target() {
        return MatCategory.INSTANCE;
    }

    @Override
    public Integer obMap(Integer n) {
        return n;
    }

    @Override
    public Matrix homMap(FinMap f) {
        return Matrix.tabulate(f.dom(), f.codom(), (i, j) -> f.apply(i + 1) == j + 1 ? 1 : 0);
    }

    @Override
    public String toString() {
        return "Fin->Mat";
    }
}
