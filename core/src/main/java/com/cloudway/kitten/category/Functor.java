/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * A structure preserving mapping between two categories.
 *
 * <p>A functor maps the objects of its source category to objects of its
 * target category, and morphisms to morphisms. Instances of Functor should
 * satisfy the following laws:
 *
 * <pre>{@code
 * homMap(id(x)) == id(obMap(x))
 * homMap(compose(f, g)) == compose(homMap(f), homMap(g))
 * }</pre>
 *
 * <p>The laws are not enforced by the type system. The type parameters only
 * name the types of the source and target categories, while {@link #source}
 * and {@link #target} recover the actual category values, since some
 * categories carry runtime state beyond their type.
 *
 * @param <SO> the type of objects in the source category
 * @param <SM> the type of morphisms in the source category
 * @param <TO> the type of objects in the target category
 * @param <TM> the type of morphisms in the target category
 */
public interface Functor<SO, SM, TO, TM> {
    /**
     * Returns the source category of this functor.
     */
    Category<SO, SM> source();

    /**
     * Returns the target category of this functor.
     */
    Category<TO, TM> target();

    /**
     * Maps an object of the source category to an object of the target
     * category.
     *
     * <pre>{@code obMap :: a -> F a}</pre>
     */
    TO obMap(SO x);

    /**
     * Maps a morphism of the source category to a morphism of the target
     * category.
     *
     * <pre>{@code homMap :: (a -> b) -> (F a -> F b)}</pre>
     */
    TM homMap(SM f);

    /**
     * Returns the functor that applies this functor first and then the
     * given functor.
     *
     * @throws CompositionMismatchException if the target of this functor is
     *         not the source of the given functor
     */
    default <UO, UM> Functor<SO, SM, UO, UM> then(Functor<TO, TM, UO, UM> next) {
        return Functors.compose(this, next);
    }
}
