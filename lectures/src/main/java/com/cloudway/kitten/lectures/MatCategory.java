/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import com.cloudway.kitten.category.Category;

/**
 * The category of matrices. Objects are natural numbers and a morphism from
 * {@code n} to {@code m} is an {@code n x m} matrix. Composition is matrix
 * multiplication and identities are identity matrices.
 */
public enum MatCategory implements Category<Integer, Matrix> {
    INSTANCE;

    @Override
    public Integer dom(Matrix a) {
        return a.rows();
    }

    @Override
    public Integer codom(Matrix a) {
        return a.cols();
    }

    @Override
    public Matrix compose(Matrix a, Matrix b) {
        checkComposable(a, b);
        return a.multiply(b);
    }

    @Override
    public Matrix id(Integer n) {
        return Matrix.identity(n);
    }

    @Override
    public String toString() {
        return "Mat";
    }
}
