/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.cloudway.kitten.finset.FinSet;
import com.cloudway.kitten.finset.KeyNotFoundException;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * A total function {@code {1..n} -> {1..m}}, the morphism of the
 * {@link FinCategory}.
 */
public final class FinMap {
    private final int n, m;
    private final int[] image;

    private FinMap(int n, int m, int[] image) {
        this.n = n;
        this.m = m;
        this.image = image;
    }

    /**
     * Construct a function {@code {1..n} -> {1..m}} where {@code n} is the
     * number of given images and {@code image[i-1]} is the image of {@code i}.
     *
     * @throws IllegalArgumentException if an image is outside of {@code 1..m}
     */
    public static FinMap of(int m, int... image) {
        checkArgument(m >= 0, "negative codomain: %s", m);
        for (int i = 0; i < image.length; i++) {
            checkArgument(image[i] >= 1 && image[i] <= m,
                          "image of %s is %s, not in 1..%s", i + 1, image[i], m);
        }
        return new FinMap(image.length, m, image.clone());
    }

    /**
     * Returns the identity function on {@code {1..n}}.
     */
    public static FinMap identity(int n) {
        checkArgument(n >= 0, "negative domain: %s", n);
        return new FinMap(n, n, IntStream.rangeClosed(1, n).toArray());
    }

    /**
     * Returns the size of the domain.
     */
    public int dom() {
        return n;
    }

    /**
     * Returns the size of the codomain.
     */
    public int codom() {
        return m;
    }

    /**
     * Evaluate this function at {@code i}, counting from 1.
     *
     * @throws KeyNotFoundException if {@code i} is not in {@code 1..n}
     */
    public int apply(int i) {
        if (i < 1 || i > n) {
            throw new KeyNotFoundException(i, FinSet.range(1, n));
        }
        return image[i - 1];
    }

    /**
     * Returns the function that applies this function first and then
     * the given function.
     */
    FinMap then(FinMap g) {
        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = g.apply(image[i]);
        }
        return new FinMap(n, g.m, result);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof FinMap))
            return false;
        FinMap other = (FinMap)obj;
        return n == other.n && m == other.m && Arrays.equals(image, other.image);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * n + m) + Arrays.hashCode(image);
    }

    @Override
    public String toString() {
        return IntStream.rangeClosed(1, n)
            .mapToObj(i -> i + "↦" + image[i - 1])
            .collect(Collectors.joining(", ", "{", "}")) + ": " + n + " -> " + m;
    }
}
