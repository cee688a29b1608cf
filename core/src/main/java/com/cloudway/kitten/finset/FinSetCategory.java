/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.finset;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import com.cloudway.kitten.category.Category;

/**
 * The category of finite sets and total functions between them.
 *
 * <p>This is a stateless singleton shared by every element type.
 *
 * @param <E> the type of set elements
 */
public final class FinSetCategory<E> implements Category<FinSet<E>, FinFunction<E, E>> {
    private static final FinSetCategory<Object> INSTANCE = new FinSetCategory<>();

    private FinSetCategory() {}

    /**
     * Returns the category of finite sets.
     */
    @SuppressWarnings("unchecked")
    public static <E> FinSetCategory<E> instance() {
        return (FinSetCategory<E>)INSTANCE;
    }

    @Override
    public FinSet<E> dom(FinFunction<E, E> f) {
        return f.dom();
    }

    @Override
    public FinSet<E> codom(FinFunction<E, E> f) {
        return f.codom();
    }

    /**
     * Compose two functions, the first function is applied first. The
     * resulting mapping is computed eagerly.
     *
     * @throws com.cloudway.kitten.category.DomainMismatchException
     *         if the codomain of {@code f} is not the domain of {@code g}
     */
    @Override
    public FinFunction<E, E> compose(FinFunction<E, E> f, FinFunction<E, E> g) {
        checkComposable(f, g);
        return FinFunction.of(f.dom(), g.codom(), x -> g.apply(f.apply(x)));
    }

    @Override
    public FinFunction<E, E> id(FinSet<E> x) {
        return FinFunction.of(x, x, e -> e);
    }

    /**
     * Returns every function from {@code x} to {@code y}.
     *
     * @throws IllegalArgumentException if the hom-set is too large to
     *         enumerate
     */
    public ImmutableList<FinFunction<E, E>> hom(FinSet<E> x, FinSet<E> y) {
        List<E> dom = x.asList();
        List<List<E>> images = Lists.cartesianProduct(Collections.nCopies(dom.size(), y.asList()));

        ImmutableList.Builder<FinFunction<E, E>> result = ImmutableList.builder();
        for (List<E> image : images) {
            ImmutableMap.Builder<E, E> mapping = ImmutableMap.builder();
            for (int i = 0; i < dom.size(); i++) {
                mapping.put(dom.get(i), image.get(i));
            }
            result.add(FinFunction.fromMap(x, y, mapping.build()));
        }
        return result.build();
    }

    @Override
    public String toString() {
        return "FinSet";
    }
}
