/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.laws;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.cloudway.kitten.category.Category;
import com.cloudway.kitten.category.Functor;

/**
 * Checks the functor laws on a sample of source objects and morphisms:
 *
 * <pre>{@code
 * homMap(id(x)) == id(obMap(x))
 * homMap(compose(f, g)) == compose(homMap(f), homMap(g))
 * dom(homMap(f)) == obMap(dom(f)),  codom(homMap(f)) == obMap(codom(f))
 * }</pre>
 */
public final class FunctorLaws {
    private FunctorLaws() {}

    /**
     * Check the laws of the given functor. Whether the check stops at the
     * first violation is taken from the {@code kitten.laws.failFast}
     * configuration property.
     */
    public static <SO, SM, TO, TM> LawReport check(Functor<SO, SM, TO, TM> functor,
                                                   Iterable<? extends SO> objects,
                                                   Iterable<? extends SM> morphisms) {
        return check(functor, objects, morphisms, LawChecker.defaultFailFast());
    }

    /**
     * Check the laws of the given functor.
     *
     * @param failFast throw {@link LawViolationException} on the first
     *        violation instead of reporting it
     */
    public static <SO, SM, TO, TM> LawReport check(Functor<SO, SM, TO, TM> functor,
                                                   Iterable<? extends SO> objects,
                                                   Iterable<? extends SM> morphisms,
                                                   boolean failFast) {
        Category<SO, SM> src = functor.source();
        Category<TO, TM> tgt = functor.target();
        LawChecker checker = new LawChecker(functor, failFast);
        List<SM> fs = ImmutableList.copyOf(morphisms);

        for (SO x : objects) {
            checker.expectEqual("identity preservation", tgt.id(functor.obMap(x)), functor.homMap(src.id(x)), x);
        }

        for (SM f : fs) {
            TM image = functor.homMap(f);
            checker.expectEqual("domain preservation", functor.obMap(src.dom(f)), tgt.dom(image), f);
            checker.expectEqual("codomain preservation", functor.obMap(src.codom(f)), tgt.codom(image), f);
        }

        for (SM f : fs) {
            for (SM g : fs) {
                if (!src.composable(f, g))
                    continue;
                checker.expectComposite("composition preservation",
                                        () -> tgt.compose(functor.homMap(f), functor.homMap(g)),
                                        () -> functor.homMap(src.compose(f, g)),
                                        f, g);
            }
        }

        return checker.report();
    }
}
