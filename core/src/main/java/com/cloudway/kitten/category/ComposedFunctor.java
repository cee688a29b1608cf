/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

import java.util.Objects;

/**
 * The functor obtained by applying two functors in sequence. The constituent
 * functors are shared, not copied, and every mapping is evaluated on demand.
 *
 * @param <SO> the type of objects in the source category
 * @param <SM> the type of morphisms in the source category
 * @param <MO> the type of objects in the intermediate category
 * @param <MM> the type of morphisms in the intermediate category
 * @param <TO> the type of objects in the target category
 * @param <TM> the type of morphisms in the target category
 */
public final class ComposedFunctor<SO, SM, MO, MM, TO, TM> implements Functor<SO, SM, TO, TM> {
    private final Functor<SO, SM, MO, MM> first;
    private final Functor<MO, MM, TO, TM> second;

    ComposedFunctor(Functor<SO, SM, MO, MM> first, Functor<MO, MM, TO, TM> second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Returns the functor applied first.
     */
    public Functor<SO, SM, MO, MM> first() {
        return first;
    }

    /**
     * Returns the functor applied second.
     */
    public Functor<MO, MM, TO, TM> second() {
        return second;
    }

    @Override
    public Category<SO, SM> source() {
        return first.source();
    }

    @Override
    public Category<TO, TM> target() {
        return second.target();
    }

    @Override
    public TO obMap(SO x) {
        return second.obMap(first.obMap(x));
    }

    @Override
    public TM homMap(SM f) {
        return second.homMap(first.homMap(f));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof ComposedFunctor))
            return false;
        ComposedFunctor<?,?,?,?,?,?> other = (ComposedFunctor<?,?,?,?,?,?>)obj;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + " ; " + second;
    }
}
