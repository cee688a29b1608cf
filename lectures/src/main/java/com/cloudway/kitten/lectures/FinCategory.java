/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import com.cloudway.kitten.category.Category;

/**
 * The skeleton of the category of finite sets. Objects are natural numbers
 * and a morphism from {@code n} to {@code m} is a total function
 * {@code {1..n} -> {1..m}}.
 */
public enum FinCategory implements Category<Integer, FinMap> {
    INSTANCE;

    @Override
    public Integer dom(FinMap f) {
        return f.dom();
    }

    @Override
    public Integer codom(FinMap f) {
        return f.codom();
    }

    @Override
    public FinMap compose(FinMap f, FinMap g) {
        checkComposable(f, g);
        return f.then(g);
    }

    @Override
    public FinMap id(Integer n) {
        return FinMap.identity(n);
    }

    @Override
    public String toString() {
        return "Fin";
    }
}
