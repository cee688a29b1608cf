/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

import java.util.function.Function;
import static java.util.Objects.requireNonNull;

/**
 * Static methods to construct functors.
 */
public final class Functors {
    private Functors() {}

    /**
     * Returns the identity functor on the given category.
     */
    public static <O, M> IdentityFunctor<O, M> identity(Category<O, M> c) {
        return new IdentityFunctor<>(requireNonNull(c));
    }

    /**
     * Returns the functor that applies {@code f} first and then {@code g}.
     * Identity functors are absorbed and nested compositions are associated
     * to the right.
     *
     * @throws CompositionMismatchException if the target of {@code f} is not
     *         the source of {@code g}
     */
    @SuppressWarnings("unchecked")
    public static <SO, SM, MO, MM, TO, TM> Functor<SO, SM, TO, TM>
    compose(Functor<SO, SM, MO, MM> f, Functor<MO, MM, TO, TM> g) {
        requireNonNull(f);
        requireNonNull(g);

        if (!f.target().equals(g.source())) {
            throw new CompositionMismatchException(f.target(), g.source());
        }

        if (f instanceof IdentityFunctor) {
            return (Functor<SO, SM, TO, TM>)(Functor<?,?,?,?>)g;
        }
        if (g instanceof IdentityFunctor) {
            return (Functor<SO, SM, TO, TM>)(Functor<?,?,?,?>)f;
        }
        if (f instanceof ComposedFunctor) {
            return reassociate((ComposedFunctor<SO, SM, ?, ?, MO, MM>)f, g);
        }
        return new ComposedFunctor<>(f, g);
    }

    // (f ; g) ; h = f ; (g ; h)
    private static <SO, SM, XO, XM, MO, MM, TO, TM> Functor<SO, SM, TO, TM>
    reassociate(ComposedFunctor<SO, SM, XO, XM, MO, MM> fg, Functor<MO, MM, TO, TM> h) {
        return compose(fg.first(), compose(fg.second(), h));
    }

    /**
     * Returns a builder of functors between the given categories.
     */
    public static <SO, SM, TO, TM> Builder<SO, SM, TO, TM>
    builder(Category<SO, SM> source, Category<TO, TM> target) {
        return new Builder<>(requireNonNull(source), requireNonNull(target));
    }

    /**
     * Assembles a functor from its object and morphism mappings. A mapping
     * that is not given fails with {@link NotImplementedException} when the
     * built functor is asked for it.
     */
    public static final class Builder<SO, SM, TO, TM> {
        private final Category<SO, SM> source;
        private final Category<TO, TM> target;
        private Function<? super SO, ? extends TO> obMap;
        private Function<? super SM, ? extends TM> homMap;
        private String name = "Functor";

        Builder(Category<SO, SM> source, Category<TO, TM> target) {
            this.source = source;
            this.target = target;
        }

        public Builder<SO, SM, TO, TM> obMap(Function<? super SO, ? extends TO> obMap) {
            this.obMap = requireNonNull(obMap);
            return this;
        }

        public Builder<SO, SM, TO, TM> homMap(Function<? super SM, ? extends TM> homMap) {
            this.homMap = requireNonNull(homMap);
            return this;
        }

        public Builder<SO, SM, TO, TM> named(String name) {
            this.name = requireNonNull(name);
            return this;
        }

        public Functor<SO, SM, TO, TM> build() {
            return new DefinedFunctor<>(this);
        }
    }

    private static final class DefinedFunctor<SO, SM, TO, TM> implements Functor<SO, SM, TO, TM> {
        private final Category<SO, SM> source;
        private final Category<TO, TM> target;
        private final Function<? super SO, ? extends TO> obMap;
        private final Function<? super SM, ? extends TM> homMap;
        private final String name;

        DefinedFunctor(Builder<SO, SM, TO, TM> b) {
            this.source = b.source;
            this.target = b.target;
            this.obMap = b.obMap;
            this.homMap = b.homMap;
            this.name = b.name;
        }

        @Override
        public Category<SO, SM> source() {
            return source;
        }

        @Override
        public Category<TO, TM> target() {
            return target;
        }

        @Override
        public TO obMap(SO x) {
            if (obMap == null)
                throw new NotImplementedException("obMap", this);
            return obMap.apply(x);
        }

        @Override
        public TM homMap(SM f) {
            if (homMap == null)
                throw new NotImplementedException("homMap", this);
            return homMap.apply(f);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
