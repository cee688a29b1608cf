/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * The category of categories. Objects are categories and morphisms are
 * functors between them.
 *
 * <p>Categories and functors are handled as dynamically dispatched values
 * of any object and morphism type, so heterogeneous categories can live in
 * the same hom-set. This models the categories expressible as {@link Category}
 * values, not the category of all small categories.
 *
 * <p>Composition drops identity functors and associates to the right, so
 * the identity and associativity laws hold with {@code equals}.
 */
public enum KittenCategory implements Category<Category<?,?>, Functor<?,?,?,?>> {
    INSTANCE;

    @Override
    public Category<?,?> dom(Functor<?,?,?,?> f) {
        return f.source();
    }

    @Override
    public Category<?,?> codom(Functor<?,?,?,?> f) {
        return f.target();
    }

    /**
     * Compose two functors, the first functor is applied first.
     *
     * @throws CompositionMismatchException if the target of {@code f} is not
     *         the source of {@code g}
     */
    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Functor<?,?,?,?> compose(Functor<?,?,?,?> f, Functor<?,?,?,?> g) {
        if (!composable(f, g)) {
            throw new CompositionMismatchException(f.target(), g.source());
        }
        return Functors.compose((Functor)f, (Functor)g);
    }

    @Override
    public Functor<?,?,?,?> id(Category<?,?> c) {
        return Functors.identity(c);
    }

    @Override
    public String toString() {
        return "Kitten";
    }
}
