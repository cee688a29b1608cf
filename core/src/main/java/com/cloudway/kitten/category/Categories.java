/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

import java.util.function.BinaryOperator;
import java.util.function.Function;
import static java.util.Objects.requireNonNull;

/**
 * Static methods to construct categories from their operations.
 */
public final class Categories {
    private Categories() {}

    /**
     * Returns a builder of categories.
     */
    public static <O, M> Builder<O, M> builder() {
        return new Builder<>();
    }

    /**
     * Assembles a category from its four operations. An operation that is
     * not given fails with {@link NotImplementedException} when the built
     * category is asked for it. The built category compares by identity.
     */
    public static final class Builder<O, M> {
        private Function<? super M, ? extends O> dom;
        private Function<? super M, ? extends O> codom;
        private BinaryOperator<M> compose;
        private Function<? super O, ? extends M> id;
        private String name = "Category";

        Builder() {}

        public Builder<O, M> dom(Function<? super M, ? extends O> dom) {
            this.dom = requireNonNull(dom);
            return this;
        }

        public Builder<O, M> codom(Function<? super M, ? extends O> codom) {
            this.codom = requireNonNull(codom);
            return this;
        }

        /**
         * Sets the composition operation. The operation is only called on
         * composable morphisms.
         */
        public Builder<O, M> compose(BinaryOperator<M> compose) {
            this.compose = requireNonNull(compose);
            return this;
        }

        public Builder<O, M> id(Function<? super O, ? extends M> id) {
            this.id = requireNonNull(id);
            return this;
        }

        public Builder<O, M> named(String name) {
            this.name = requireNonNull(name);
            return this;
        }

        public Category<O, M> build() {
            return new DefinedCategory<>(this);
        }
    }

    private static final class DefinedCategory<O, M> implements Category<O, M> {
        private final Function<? super M, ? extends O> dom;
        private final Function<? super M, ? extends O> codom;
        private final BinaryOperator<M> compose;
        private final Function<? super O, ? extends M> id;
        private final String name;

        DefinedCategory(Builder<O, M> b) {
            this.dom = b.dom;
            this.codom = b.codom;
            this.compose = b.compose;
            this.id = b.id;
            this.name = b.name;
        }

        @Override
        public O dom(M f) {
            if (dom == null)
                throw new NotImplementedException("dom", this);
            return dom.apply(f);
        }

        @Override
        public O codom(M f) {
            if (codom == null)
                throw new NotImplementedException("codom", this);
            return codom.apply(f);
        }

        @Override
        public M compose(M f, M g) {
            if (compose == null)
                throw new NotImplementedException("compose", this);
            checkComposable(f, g);
            return compose.apply(f, g);
        }

        @Override
        public M id(O x) {
            if (id == null)
                throw new NotImplementedException("id", this);
            return id.apply(x);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
