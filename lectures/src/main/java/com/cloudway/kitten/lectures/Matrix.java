/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * An immutable {@code rows x cols} matrix of integers, the morphism of
 * the {@link MatCategory}. Row and column indices count from 0.
 */
public final class Matrix {
    /**
     * Computes a matrix entry from its position.
     */
    @FunctionalInterface
    public interface Entries {
        long at(int row, int col);
    }

    private final int rows, cols;
    private final long[] data; // row major

    private Matrix(int rows, int cols, long[] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * Construct a matrix whose entries are computed from their positions.
     */
    public static Matrix tabulate(int rows, int cols, Entries entries) {
        checkArgument(rows >= 0 && cols >= 0, "invalid dimension: %sx%s", rows, cols);
        checkArgument((long)rows * cols <= Integer.MAX_VALUE, "matrix too large: %sx%s", rows, cols);
        long[] data = new long[rows * cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                data[i * cols + j] = entries.at(i, j);
            }
        }
        return new Matrix(rows, cols, data);
    }

    /**
     * Construct a matrix from its rows.
     *
     * @throws IllegalArgumentException if the rows have different lengths
     */
    public static Matrix of(long[]... rows) {
        int cols = rows.length == 0 ? 0 : rows[0].length;
        for (long[] row : rows) {
            checkArgument(row.length == cols, "ragged matrix rows");
        }
        return tabulate(rows.length, cols, (i, j) -> rows[i][j]);
    }

    /**
     * Returns the {@code rows x cols} zero matrix.
     */
    public static Matrix zero(int rows, int cols) {
        return tabulate(rows, cols, (i, j) -> 0);
    }

    /**
     * Returns the {@code n x n} identity matrix.
     */
    public static Matrix identity(int n) {
        return tabulate(n, n, (i, j) -> i == j ? 1 : 0);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public long get(int row, int col) {
        checkElementIndex(row, rows, "row");
        checkElementIndex(col, cols, "column");
        return data[row * cols + col];
    }

    /**
     * Returns the matrix product {@code this * that}.
     *
     * @throws IllegalArgumentException if the number of columns of this
     *         matrix is not the number of rows of the given matrix
     */
    public Matrix multiply(Matrix that) {
        checkArgument(cols == that.rows, "cannot multiply %sx%s by %sx%s", rows, cols, that.rows, that.cols);
        return tabulate(rows, that.cols, (i, j) -> {
            long sum = 0;
            for (int k = 0; k < cols; k++) {
                sum += data[i * cols + k] * that.data[k * that.cols + j];
            }
            return sum;
        });
    }

    /**
     * Returns a copy of the entries of this matrix as an array of rows.
     */
    public long[][] toArray() {
        long[][] result = new long[rows][];
        for (int i = 0; i < rows; i++) {
            result[i] = Arrays.copyOfRange(data, i * cols, (i + 1) * cols);
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Matrix))
            return false;
        Matrix other = (Matrix)obj;
        return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return IntStream.range(0, rows)
            .mapToObj(i -> Arrays.stream(data, i * cols, (i + 1) * cols)
                                 .mapToObj(Long::toString)
                                 .collect(Collectors.joining(",", "[", "]")))
            .collect(Collectors.joining(",", "[", "]"));
    }
}
