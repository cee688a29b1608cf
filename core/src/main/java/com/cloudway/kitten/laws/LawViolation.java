/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.laws;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A witnessed violation of a category or functor law.
 */
public final class LawViolation {
    private final String law;
    private final ImmutableList<Object> witnesses;
    private final Object expected;
    private final Object actual;

    public LawViolation(String law, ImmutableList<Object> witnesses, Object expected, Object actual) {
        this.law = Objects.requireNonNull(law);
        this.witnesses = Objects.requireNonNull(witnesses);
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Returns the name of the violated law.
     */
    public String law() {
        return law;
    }

    /**
     * Returns the objects or morphisms the law was checked on.
     */
    public ImmutableList<Object> witnesses() {
        return witnesses;
    }

    public Object expected() {
        return expected;
    }

    public Object actual() {
        return actual;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("law", law)
            .add("witnesses", witnesses)
            .add("expected", expected)
            .add("actual", actual)
            .toString();
    }
}
