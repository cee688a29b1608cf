/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * The functor that maps every object and morphism of a category to itself.
 *
 * @param <O> the type of objects
 * @param <M> the type of morphisms
 */
public final class IdentityFunctor<O, M> implements Functor<O, M, O, M> {
    private final Category<O, M> category;

    IdentityFunctor(Category<O, M> category) {
        this.category = category;
    }

    @Override
    public Category<O, M> source() {
        return category;
    }

    @Override
    public Category<O, M> target() {
        return category;
    }

    @Override
    public O obMap(O x) {
        return x;
    }

    @Override
    public M homMap(M f) {
        return f;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this ||
            obj instanceof IdentityFunctor && category.equals(((IdentityFunctor<?,?>)obj).category);
    }

    @Override
    public int hashCode() {
        return category.hashCode();
    }

    @Override
    public String toString() {
        return "Id(" + category + ")";
    }
}
