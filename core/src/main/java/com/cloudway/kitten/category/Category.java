/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * A class for categories. {@link #id} and {@link #compose} must form a monoid
 * on every hom-set:
 *
 * <pre>{@code
 * compose(id(dom(f)), f) == f
 * compose(f, id(codom(f))) == f
 * compose(compose(f, g), h) == compose(f, compose(g, h))
 * }</pre>
 *
 * <p>The object type {@code O} and the morphism type {@code M} are upper
 * bounds only. A category may treat a subset of the values of these types as
 * its objects and morphisms, and the membership {@code f ∈ Hom(x, y)} is not
 * expressed in the type system. It is a documented precondition, checked by
 * {@link com.cloudway.kitten.laws.CategoryLaws}.
 *
 * <p>Composition is written in diagrammatic order: {@code compose(f, g)}
 * applies {@code f} first and then {@code g}.
 *
 * @param <O> the type of objects
 * @param <M> the type of morphisms
 */
public interface Category<O, M> {
    /**
     * Returns the domain of the given morphism.
     *
     * <pre>{@code dom :: (a -> b) -> a}</pre>
     */
    O dom(M f);

    /**
     * Returns the codomain of the given morphism.
     *
     * <pre>{@code codom :: (a -> b) -> b}</pre>
     */
    O codom(M f);

    /**
     * Morphism composition.
     *
     * <pre>{@code compose :: (a -> b) -> (b -> c) -> (a -> c)}</pre>
     *
     * @throws DomainMismatchException if the codomain of {@code f} is not
     *         the domain of {@code g}
     */
    M compose(M f, M g);

    /**
     * The identity morphism.
     *
     * <pre>{@code id :: a -> (a -> a)}</pre>
     */
    M id(O x);

    /**
     * Chained left to right composition.
     *
     * <pre>{@code compose(f, g, h) = compose(compose(f, g), h)}</pre>
     */
    default M compose(M f, M g, M h) {
        return compose(compose(f, g), h);
    }

    /**
     * Returns {@code true} if the given morphisms can be composed, that is,
     * the codomain of {@code f} equals the domain of {@code g}.
     */
    default boolean composable(M f, M g) {
        return codom(f).equals(dom(g));
    }

    /**
     * Check the composition precondition, used by implementations before
     * composing two morphisms.
     *
     * @throws DomainMismatchException if the morphisms are not composable
     */
    default void checkComposable(M f, M g) {
        if (!composable(f, g)) {
            throw new DomainMismatchException(codom(f), dom(g));
        }
    }
}
