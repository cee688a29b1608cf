/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.finset;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * A total function between two finite sets, the morphism of the
 * {@link FinSetCategory}.
 *
 * <p>The mapping is tabulated: its keys are exactly the elements of the
 * domain and its values are elements of the codomain. Two finite functions
 * are equal when they have equal domains, equal codomains and the same
 * mapping.
 *
 * @param <A> the type of domain elements
 * @param <B> the type of codomain elements
 */
public final class FinFunction<A, B> implements Function<A, B> {
    private final FinSet<A> dom;
    private final FinSet<B> codom;
    private final ImmutableMap<A, B> mapping;

    private FinFunction(FinSet<A> dom, FinSet<B> codom, ImmutableMap<A, B> mapping) {
        checkArgument(mapping.size() == dom.size() && dom.asSet().equals(mapping.keySet()),
                      "mapping %s does not cover exactly the domain %s", mapping, dom);
        for (B b : mapping.values()) {
            checkArgument(codom.contains(b), "%s is not an element of the codomain %s", b, codom);
        }

        this.dom = dom;
        this.codom = codom;
        this.mapping = mapping;
    }

    /**
     * Construct a finite function from an explicit mapping.
     *
     * @throws IllegalArgumentException if the keys of the mapping are not
     *         exactly the domain, or a value is outside of the codomain
     */
    public static <A, B> FinFunction<A, B> fromMap(FinSet<A> dom, FinSet<B> codom, Map<? extends A, ? extends B> mapping) {
        return new FinFunction<>(requireNonNull(dom), requireNonNull(codom), ImmutableMap.<A, B>copyOf(mapping));
    }

    /**
     * Construct a finite function by eagerly tabulating the given function
     * over every element of the domain.
     *
     * @throws IllegalArgumentException if the function maps an element
     *         outside of the codomain
     */
    public static <A, B> FinFunction<A, B> of(FinSet<A> dom, FinSet<B> codom, Function<? super A, ? extends B> f) {
        requireNonNull(f);
        ImmutableMap.Builder<A, B> mapping = ImmutableMap.builder();
        for (A a : dom) {
            mapping.put(a, f.apply(a));
        }
        return new FinFunction<>(dom, requireNonNull(codom), mapping.build());
    }

    /**
     * Returns a builder of a finite function between the given sets.
     */
    public static <A, B> Builder<A, B> builder(FinSet<A> dom, FinSet<B> codom) {
        return new Builder<>(requireNonNull(dom), requireNonNull(codom));
    }

    /**
     * Returns the domain of this function.
     */
    public FinSet<A> dom() {
        return dom;
    }

    /**
     * Returns the codomain of this function.
     */
    public FinSet<B> codom() {
        return codom;
    }

    /**
     * Returns the tabulated mapping of this function.
     */
    public ImmutableMap<A, B> mapping() {
        return mapping;
    }

    /**
     * Evaluate this function at the given element.
     *
     * @throws KeyNotFoundException if the element is not in the domain
     */
    @Override
    public B apply(A a) {
        B b = a == null ? null : mapping.get(a);
        if (b == null) {
            throw new KeyNotFoundException(a, dom);
        }
        return b;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof FinFunction))
            return false;
        FinFunction<?,?> other = (FinFunction<?,?>)obj;
        return dom.equals(other.dom) && codom.equals(other.codom) && mapping.equals(other.mapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dom, codom, mapping);
    }

    @Override
    public String toString() {
        return mapping.entrySet().stream()
            .map(e -> e.getKey() + "↦" + e.getValue())
            .collect(Collectors.joining(", ", "{", "}")) + ": " + dom + " -> " + codom;
    }

    /**
     * A builder of finite functions, one mapping at a time.
     */
    public static final class Builder<A, B> {
        private final FinSet<A> dom;
        private final FinSet<B> codom;
        private final ImmutableMap.Builder<A, B> mapping = ImmutableMap.builder();

        Builder(FinSet<A> dom, FinSet<B> codom) {
            this.dom = dom;
            this.codom = codom;
        }

        public Builder<A, B> put(A a, B b) {
            mapping.put(a, b);
            return this;
        }

        /**
         * Builds the function.
         *
         * @throws IllegalArgumentException if an element was mapped twice,
         *         the mapping does not cover exactly the domain, or a value
         *         is outside of the codomain
         */
        public FinFunction<A, B> build() {
            return new FinFunction<>(dom, codom, mapping.build());
        }
    }
}
