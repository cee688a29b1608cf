/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.finset;

import java.util.Iterator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * A finite set, the object of the {@link FinSetCategory}.
 *
 * <p>Finite sets are immutable values compared by extensional equality:
 * two sets are equal when they have the same elements, regardless of the
 * order in which the elements were given. Iteration follows the order in
 * which the elements were first given. Null elements are not permitted.
 *
 * @param <E> the type of set elements
 */
public final class FinSet<E> implements Iterable<E> {
    private static final FinSet<Object> EMPTY = new FinSet<>(ImmutableSet.of());

    private final ImmutableSet<E> elements;

    private FinSet(ImmutableSet<E> elements) {
        this.elements = elements;
    }

    /**
     * Returns the empty set.
     */
    @SuppressWarnings("unchecked")
    public static <E> FinSet<E> empty() {
        return (FinSet<E>)EMPTY;
    }

    /**
     * Construct a set with given elements. Duplicate elements are ignored.
     */
    @SafeVarargs
    public static <E> FinSet<E> of(E... elements) {
        return new FinSet<>(ImmutableSet.copyOf(elements));
    }

    /**
     * Construct a set from the elements of the given iterable.
     */
    public static <E> FinSet<E> copyOf(Iterable<? extends E> elements) {
        if (elements instanceof FinSet) {
            @SuppressWarnings("unchecked")
            FinSet<E> s = (FinSet<E>)elements;
            return s;
        }
        return new FinSet<>(ImmutableSet.copyOf(elements));
    }

    /**
     * Construct the set of integers {@code from..to} inclusive.
     */
    public static FinSet<Integer> range(int from, int to) {
        checkArgument(from <= (long)to + 1, "invalid range: %s..%s", from, to);
        return new FinSet<>(IntStream.rangeClosed(from, to).boxed()
                                     .collect(ImmutableSet.toImmutableSet()));
    }

    /**
     * Returns the number of elements in this set.
     */
    public int size() {
        return elements.size();
    }

    /**
     * Returns {@code true} if this set contains no elements.
     */
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns {@code true} if this set contains the specified element.
     */
    public boolean contains(Object e) {
        return e != null && elements.contains(e);
    }

    /**
     * Returns {@code true} if every element of the given set is also an
     * element of this set.
     */
    public boolean containsAll(FinSet<?> s) {
        return elements.containsAll(s.elements);
    }

    /**
     * Returns the elements of this set as an immutable set.
     */
    public ImmutableSet<E> asSet() {
        return elements;
    }

    /**
     * Returns the elements of this set as an immutable list in iteration order.
     */
    public ImmutableList<E> asList() {
        return elements.asList();
    }

    @Override
    public Iterator<E> iterator() {
        return elements.iterator();
    }

    /**
     * Returns a sequential {@code Stream} with this set as its source.
     */
    public Stream<E> stream() {
        return elements.stream();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || obj instanceof FinSet && elements.equals(((FinSet<?>)obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
    }
}
