/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.laws;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.cloudway.kitten.category.Category;
import com.cloudway.kitten.category.DomainMismatchException;

/**
 * Checks the category laws on a sample of objects and morphisms:
 *
 * <pre>{@code
 * dom(id(x)) == x,  codom(id(x)) == x
 * compose(id(dom(f)), f) == f
 * compose(f, id(codom(f))) == f
 * compose(compose(f, g), h) == compose(f, compose(g, h))
 * }</pre>
 *
 * <p>A composition that fails with a domain mismatch while checking a law
 * is reported as a violation of that law.
 *
 * <p>Associativity is checked on every composable triple drawn from the
 * sample, so the number of checks grows with the cube of the sample size.
 */
public final class CategoryLaws {
    private CategoryLaws() {}

    /**
     * Check the laws of the given category. Whether the check stops at the
     * first violation is taken from the {@code kitten.laws.failFast}
     * configuration property.
     */
    public static <O, M> LawReport check(Category<O, M> c, Iterable<? extends O> objects, Iterable<? extends M> morphisms) {
        return check(c, objects, morphisms, LawChecker.defaultFailFast());
    }

    /**
     * Check the laws of the given category.
     *
     * @param failFast throw {@link LawViolationException} on the first
     *        violation instead of reporting it
     */
    public static <O, M> LawReport check(Category<O, M> c, Iterable<? extends O> objects,
                                         Iterable<? extends M> morphisms, boolean failFast) {
        LawChecker checker = new LawChecker(c, failFast);
        List<M> fs = ImmutableList.copyOf(morphisms);

        for (O x : objects) {
            M idx = c.id(x);
            checker.expectEqual("identity domain", x, c.dom(idx), x);
            checker.expectEqual("identity codomain", x, c.codom(idx), x);
        }

        for (M f : fs) {
            checker.expectComposite("left identity", () -> f, () -> c.compose(c.id(c.dom(f)), f), f);
            checker.expectComposite("right identity", () -> f, () -> c.compose(f, c.id(c.codom(f))), f);
        }

        for (M f : fs) {
            for (M g : fs) {
                if (!c.composable(f, g))
                    continue;
                M fg;
                try {
                    fg = c.compose(f, g);
                } catch (DomainMismatchException ex) {
                    checker.reject("composition", ex.getMessage(), f, g);
                    continue;
                }
                checker.expectEqual("composite domain", c.dom(f), c.dom(fg), f, g);
                checker.expectEqual("composite codomain", c.codom(g), c.codom(fg), f, g);

                for (M h : fs) {
                    if (c.composable(g, h)) {
                        checker.expectComposite("associativity",
                                                () -> c.compose(fg, h),
                                                () -> c.compose(f, c.compose(g, h)),
                                                f, g, h);
                    }
                }
            }
        }

        return checker.report();
    }
}
