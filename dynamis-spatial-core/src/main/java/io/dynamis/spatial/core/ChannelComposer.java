package io.dynamis.spatial.core;

import io.dynamis.spatial.api.ChannelLayout;
import io.dynamis.spatial.api.DimensionMismatchException;
import io.dynamis.spatial.api.FormatConstraintException;
import io.dynamis.spatial.api.ShapedArray;

import java.util.Arrays;
import java.util.Objects;

/**
 * Stateless composition of vectors and channel matrices (channels x samples).
 *
 * STACK RULE (v1 is M1 x N1, v2 is M2 x N2 after promotion to 2-d):
 *   1. M1 == M2 and (M1 < N1 or M2 < N2)  -> vertical (rows appended)
 *   2. N1 == N2 and (N1 < M1 or N2 < M2)  -> horizontal (columns appended)
 *   3. both square and equal              -> vertical (rule 1 takes priority)
 *   4. otherwise                           -> DimensionMismatchException
 * The shared dimension must be the smaller one: two 1x5 rows stack to 2x5,
 * two 5x1 columns stack to 5x2. The result is squeezed.
 *
 * INTERLEAVE:
 *   out[2i] = left[i], out[2i + 1] = right[i]; 2 * channels output rows.
 */
public final class ChannelComposer {

    private ChannelComposer() {}

    // -- Stack ----------------------------------------------------------------

    public static ShapedArray stack(double[] v1, double[] v2) {
        return stack(ShapedArray.vector(v1), ShapedArray.vector(v2));
    }

    public static ShapedArray stack(double[][] v1, double[][] v2) {
        return stack(ShapedArray.matrix(v1), ShapedArray.matrix(v2));
    }

    /**
     * Stacks two vectors or matrices along their shared, smaller dimension.
     *
     * @throws DimensionMismatchException if no dimension qualifies, or the other
     *         dimension differs so the arrays cannot be concatenated
     * @throws io.dynamis.spatial.api.SpatialShapeException if an input has more than two dimensions
     */
    public static ShapedArray stack(ShapedArray v1, ShapedArray v2) {
        ShapedArray a = ShapeValidator.atLeast2d(v1);
        ShapedArray b = ShapeValidator.atLeast2d(v2);
        int m1 = a.dim(0);
        int n1 = a.dim(1);
        int m2 = b.dim(0);
        int n2 = b.dim(1);

        ShapedArray out;
        if (m1 == m2 && (m1 < n1 || m2 < n2)) {
            out = vstack(a, b);
        } else if (n1 == n2 && (n1 < m1 || n2 < m2)) {
            out = hstack(a, b);
        } else if (m1 == n1 && m2 == n2 && m1 == m2) {
            out = vstack(a, b);
        } else {
            throw new DimensionMismatchException("v1 and v2 do not have a common dimension",
                a.shape(), b.shape());
        }
        return out.squeeze();
    }

    private static ShapedArray vstack(ShapedArray a, ShapedArray b) {
        if (a.dim(1) != b.dim(1)) {
            throw new DimensionMismatchException("vertical stack needs equal column counts",
                a.shape(), b.shape());
        }
        double[] top = a.toFlatArray();
        double[] bottom = b.toFlatArray();
        double[] data = Arrays.copyOf(top, top.length + bottom.length);
        System.arraycopy(bottom, 0, data, top.length, bottom.length);
        return ShapedArray.of(new int[] {a.dim(0) + b.dim(0), a.dim(1)}, data);
    }

    private static ShapedArray hstack(ShapedArray a, ShapedArray b) {
        if (a.dim(0) != b.dim(0)) {
            throw new DimensionMismatchException("horizontal stack needs equal row counts",
                a.shape(), b.shape());
        }
        int rows = a.dim(0);
        int n1 = a.dim(1);
        int n2 = b.dim(1);
        double[] left = a.toFlatArray();
        double[] right = b.toFlatArray();
        double[] data = new double[rows * (n1 + n2)];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(left, r * n1, data, r * (n1 + n2), n1);
            System.arraycopy(right, r * n2, data, r * (n1 + n2) + n1, n2);
        }
        return ShapedArray.of(new int[] {rows, n1 + n2}, data);
    }

    // -- Interleave -----------------------------------------------------------

    /** Interleaves left/right channel matrices without a layout check. */
    public static double[][] interleaveChannels(double[][] left, double[][] right) {
        return interleaveChannels(left, right, null);
    }

    /**
     * Interleaves left and right channel matrices row by row.
     *
     * @param layout optional layout whose channel count both inputs must have; null for none
     * @return fresh (2 * channels) x samples matrix: left row, right row, left row, ...
     * @throws DimensionMismatchException if left and right differ in shape
     * @throws FormatConstraintException if a layout is given and the channel count differs
     * @throws io.dynamis.spatial.api.SpatialShapeException if either matrix is ragged
     */
    public static double[][] interleaveChannels(double[][] left, double[][] right, ChannelLayout layout) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        int[] leftShape = ShapedArray.matrix(left).shape();
        int[] rightShape = ShapedArray.matrix(right).shape();
        if (!Arrays.equals(leftShape, rightShape)) {
            throw new DimensionMismatchException("left and right channels have to be of same dimensions",
                leftShape, rightShape);
        }
        if (layout != null && left.length != layout.channelCount()) {
            throw new FormatConstraintException(layout, left.length);
        }

        double[][] out = new double[left.length * 2][];
        for (int ch = 0; ch < left.length; ch++) {
            out[2 * ch] = left[ch].clone();
            out[2 * ch + 1] = right[ch].clone();
        }
        return out;
    }
}
