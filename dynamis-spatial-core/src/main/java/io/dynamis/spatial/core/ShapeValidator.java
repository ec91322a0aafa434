package io.dynamis.spatial.core;

import io.dynamis.spatial.api.DimensionMismatchException;
import io.dynamis.spatial.api.ShapedArray;
import io.dynamis.spatial.api.SpatialShapeException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Stateless guard that normalises array-like input into a flat sequence.
 *
 * RULES:
 *   1. Squeeze every singleton dimension.
 *   2. Rank 0 after squeezing (a bare scalar, or 1x1...) -> length-1 sequence.
 *   3. Rank 1 after squeezing -> that sequence.
 *   4. Rank > 1 after squeezing -> SpatialShapeException.
 *
 * Every returned array is a fresh copy; callers may mutate it.
 */
public final class ShapeValidator {

    static final String NOT_ONE_DIMENSIONAL = "array must be one-dimensional";

    private ShapeValidator() {}

    /**
     * Reduces any shaped input to one dimension.
     *
     * @throws SpatialShapeException if the squeezed input has more than one dimension
     */
    public static double[] asVector(ShapedArray array) {
        Objects.requireNonNull(array, "array");
        ShapedArray squeezed = array.squeeze();
        if (squeezed.ndim() > 1) {
            throw new SpatialShapeException(NOT_ONE_DIMENSIONAL + "; squeezed shape "
                + Arrays.toString(squeezed.shape()));
        }
        return squeezed.toFlatArray();
    }

    /** Promotes a scalar to a length-1 sequence. */
    public static double[] asVector(double value) {
        return new double[] {value};
    }

    /** Copies a sequence. Already one-dimensional by construction. */
    public static double[] asVector(double... values) {
        Objects.requireNonNull(values, "values");
        return values.clone();
    }

    /**
     * Reduces a matrix to one dimension. Accepts 1xN, Nx1 and 1x1 input.
     *
     * @throws SpatialShapeException if both dimensions exceed one, or rows are ragged
     */
    public static double[] asVector(double[][] rows) {
        return asVector(ShapedArray.matrix(rows));
    }

    /**
     * Promotes input to at least two dimensions.
     *   rank 0 -> 1x1, rank 1 (n) -> 1xn, rank 2 unchanged.
     *
     * @throws SpatialShapeException if the input has more than two dimensions
     */
    public static ShapedArray atLeast2d(ShapedArray array) {
        Objects.requireNonNull(array, "array");
        return switch (array.ndim()) {
            case 0 -> array.reshape(1, 1);
            case 1 -> array.reshape(1, array.size());
            case 2 -> array;
            default -> throw new SpatialShapeException("array must be at most two-dimensional; shape "
                + Arrays.toString(array.shape()));
        };
    }

    /**
     * Requires a sequence of an exact length.
     *
     * @throws DimensionMismatchException if the length differs
     */
    static double[] requireLength(String name, double[] values, int length) {
        Objects.requireNonNull(values, name);
        if (values.length != length) {
            throw new DimensionMismatchException(
                name + " must have " + length + " components",
                new int[] {values.length}, new int[] {length});
        }
        return values;
    }
}
