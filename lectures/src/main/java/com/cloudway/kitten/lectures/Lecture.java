/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import java.util.List;

import com.cloudway.kitten.category.Categories;
import com.cloudway.kitten.category.Category;
import com.cloudway.kitten.category.Functor;
import com.cloudway.kitten.category.Functors;
import com.cloudway.kitten.category.KittenCategory;
import com.cloudway.kitten.finset.FinFunction;
import com.cloudway.kitten.finset.FinSet;
import com.cloudway.kitten.finset.FinSetCategory;
import com.cloudway.kitten.laws.CategoryLaws;
import com.cloudway.kitten.laws.FunctorLaws;

/**
 * The worked examples of the lecture on categories and functors.
 */
public final class Lecture {
    private Lecture() {}

    /**
     * Returns the notebook of worked examples.
     */
    public static Notebook notebook() {
        FinSetCategory<Integer> finSet = FinSetCategory.instance();

        return Notebook.builder("Categories and functors")
            // finite sets and functions
            .cell("A", b -> FinSet.of(1, 2))
            .cell("B", b -> FinSet.of(3, 4))
            .cell("C", b -> FinSet.of(5, 6))
            .cell("f", b -> FinFunction.<Integer, Integer>builder(b.get("A"), b.get("B"))
                                       .put(1, 3).put(2, 4).build())
            .cell("g", b -> FinFunction.<Integer, Integer>builder(b.get("B"), b.get("C"))
                                       .put(3, 5).put(4, 6).build())
            .cell("f;g", b -> finSet.compose(b.get("f"), b.get("g")))
            .cell("id_A", b -> finSet.id(b.get("A")))
            .cell("FinSet laws", b -> {
                FinSet<Integer> A = b.get("A"), B = b.get("B");
                List<FinFunction<Integer, Integer>> fs = finSet.hom(A, B);
                return CategoryLaws.check(finSet, List.of(A, B), fs);
            })

            // the functor from Fin to Mat
            .cell("h", b -> FinMap.of(3, 2, 3))
            .cell("F(h)", b -> FinToMat.INSTANCE.homMap(b.get("h")))
            .cell("F(id_2)", b -> FinToMat.INSTANCE.homMap(FinCategory.INSTANCE.id(2)))
            .cell("Fin->Mat laws", b -> FunctorLaws.check(FinToMat.INSTANCE,
                List.of(0, 1, 2, 3),
                List.of(FinMap.of(3, 2, 3), FinMap.of(2, 2, 1, 1), FinMap.of(2, 1, 2), FinMap.identity(2))))

            // the category of categories
            .cell("Id(Mat)", b -> KittenCategory.INSTANCE.id(MatCategory.INSTANCE))
            .cell("F;Id(Mat)", b -> KittenCategory.INSTANCE.compose(FinToMat.INSTANCE, b.get("Id(Mat)")))
            .cell("transpose", b -> transpose())
            .cell("F;transpose", b -> {
                Functor<Integer, FinMap, Integer, Matrix> t = FinToMat.INSTANCE.then(transpose());
                return t.homMap(b.get("h"));
            })
            .build();
    }

    /**
     * Matrices written in the column convention: a morphism from {@code n}
     * to {@code m} is an {@code m x n} matrix, and {@code compose(a, b)} is
     * the product {@code b * a}.
     */
    static final Category<Integer, Matrix> COLUMN_MAT = Categories.<Integer, Matrix>builder()
        .dom(Matrix::cols)
        .codom(Matrix::rows)
        .compose((a, b) -> b.multiply(a))
        .id(Matrix::identity)
        .named("ColMat")
        .build();

    /**
     * The isomorphism from Mat to the column convention, sending a matrix
     * to its transpose.
     */
    static Functor<Integer, Matrix, Integer, Matrix> transpose() {
        return Functors.builder(MatCategory.INSTANCE, COLUMN_MAT)
            .obMap(n -> n)
            .homMap(a -> Matrix.tabulate(a.cols(), a.rows(), (i, j) -> a.get(j, i)))
            .named("transpose")
            .build();
    }

    public static void main(String[] args) {
        notebook().run().throwIfFailed();
    }
}
