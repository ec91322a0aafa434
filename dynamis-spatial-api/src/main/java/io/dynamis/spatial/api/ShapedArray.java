package io.dynamis.spatial.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable n-dimensional array of doubles, stored row-major.
 *
 * The common currency for "array-like" input: a bare scalar (rank 0), a sequence
 * (rank 1), a channel matrix (rank 2, channels x samples) or anything higher.
 * Routines that need a flat sequence reduce a ShapedArray through ShapeValidator.
 *
 * All factories and accessors copy; instances never alias caller arrays.
 */
public final class ShapedArray {

    private final int[] shape;
    private final double[] data;

    private ShapedArray(int[] shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    // -- Factories ------------------------------------------------------------

    /**
     * Creates an array of the given shape over a copy of row-major data.
     *
     * @throws SpatialShapeException if a dimension is negative or the element
     *         count does not match data.length
     */
    public static ShapedArray of(int[] shape, double[] data) {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(data, "data");
        long count = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new SpatialShapeException("negative dimension in shape " + Arrays.toString(shape));
            }
            count *= dim;
        }
        if (count != data.length) {
            throw new SpatialShapeException("shape " + Arrays.toString(shape)
                + " holds " + count + " elements; data has " + data.length);
        }
        return new ShapedArray(shape.clone(), data.clone());
    }

    /** Rank-0 array holding one value. */
    public static ShapedArray scalar(double value) {
        return new ShapedArray(new int[0], new double[] {value});
    }

    /** Rank-1 array. */
    public static ShapedArray vector(double... values) {
        Objects.requireNonNull(values, "values");
        return new ShapedArray(new int[] {values.length}, values.clone());
    }

    /**
     * Rank-2 array, rows x columns.
     *
     * @throws SpatialShapeException if rows differ in length
     */
    public static ShapedArray matrix(double[][] rows) {
        Objects.requireNonNull(rows, "rows");
        int columns = rows.length == 0 ? 0 : rows[0].length;
        double[] flat = new double[rows.length * columns];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != columns) {
                throw new SpatialShapeException("ragged matrix: row " + r + " has "
                    + rows[r].length + " columns, expected " + columns);
            }
            System.arraycopy(rows[r], 0, flat, r * columns, columns);
        }
        return new ShapedArray(new int[] {rows.length, columns}, flat);
    }

    /**
     * Rank-3 array.
     *
     * @throws SpatialShapeException if any nested level is ragged
     */
    public static ShapedArray tensor(double[][][] planes) {
        Objects.requireNonNull(planes, "planes");
        int rows = planes.length == 0 ? 0 : planes[0].length;
        int columns = rows == 0 ? 0 : planes[0][0].length;
        double[] flat = new double[planes.length * rows * columns];
        int offset = 0;
        for (int p = 0; p < planes.length; p++) {
            if (planes[p].length != rows) {
                throw new SpatialShapeException("ragged tensor at plane " + p);
            }
            for (int r = 0; r < rows; r++) {
                if (planes[p][r].length != columns) {
                    throw new SpatialShapeException("ragged tensor at plane " + p + ", row " + r);
                }
                System.arraycopy(planes[p][r], 0, flat, offset, columns);
                offset += columns;
            }
        }
        return new ShapedArray(new int[] {planes.length, rows, columns}, flat);
    }

    // -- Shape ----------------------------------------------------------------

    /** Dimensions of this array. Defensive copy; empty for a scalar. */
    public int[] shape() { return shape.clone(); }

    /** Number of dimensions. */
    public int ndim() { return shape.length; }

    /** Total element count. */
    public int size() { return data.length; }

    /**
     * Length of one axis. Negative axes count from the end (-1 = last).
     *
     * @throws SpatialShapeException if the axis does not exist
     */
    public int dim(int axis) {
        return shape[normalizeAxis(axis)];
    }

    /**
     * Resolves a possibly negative axis against this array's rank.
     *
     * @throws SpatialShapeException if the axis is out of range
     */
    public int normalizeAxis(int axis) {
        int resolved = axis < 0 ? axis + shape.length : axis;
        if (resolved < 0 || resolved >= shape.length) {
            throw new SpatialShapeException("axis " + axis
                + " is out of bounds for array of dimension " + shape.length);
        }
        return resolved;
    }

    /** Copy with every size-1 axis removed. A 1x1 array squeezes to rank 0. */
    public ShapedArray squeeze() {
        int kept = 0;
        for (int dim : shape) {
            if (dim != 1) kept++;
        }
        if (kept == shape.length) {
            return this;
        }
        int[] squeezed = new int[kept];
        int i = 0;
        for (int dim : shape) {
            if (dim != 1) squeezed[i++] = dim;
        }
        return new ShapedArray(squeezed, data);
    }

    /**
     * Same data viewed under a new shape with an equal element count.
     *
     * @throws SpatialShapeException if the element counts differ
     */
    public ShapedArray reshape(int... newShape) {
        return of(newShape, data);
    }

    // -- Element access -------------------------------------------------------

    /** Element at the given index, one coordinate per axis. */
    public double get(int... index) {
        if (index.length != shape.length) {
            throw new SpatialShapeException("index of rank " + index.length
                + " for array of dimension " + shape.length);
        }
        int flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("index " + index[axis]
                    + " out of bounds for axis " + axis + " with size " + shape[axis]);
            }
            flat = flat * shape[axis] + index[axis];
        }
        return data[flat];
    }

    /** Row-major copy of all elements, i.e. the flattened array. */
    public double[] toFlatArray() {
        return data.clone();
    }

    /**
     * Copy as a rows x columns Java matrix.
     *
     * @throws SpatialShapeException if this array is not rank 2
     */
    public double[][] toMatrix() {
        if (shape.length != 2) {
            throw new SpatialShapeException("array must be two-dimensional; shape "
                + Arrays.toString(shape));
        }
        double[][] rows = new double[shape[0]][shape[1]];
        for (int r = 0; r < shape[0]; r++) {
            System.arraycopy(data, r * shape[1], rows[r], 0, shape[1]);
        }
        return rows;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ShapedArray)) return false;
        ShapedArray other = (ShapedArray) obj;
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ShapedArray" + Arrays.toString(shape) + Arrays.toString(data);
    }
}
