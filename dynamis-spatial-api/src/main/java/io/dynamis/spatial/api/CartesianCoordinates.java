package io.dynamis.spatial.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Batch of points in Cartesian form, one entry per point.
 *
 * The component arrays are owned by this record; accessors return them directly.
 * Equality compares component contents, not array identity.
 */
public record CartesianCoordinates(double[] x, double[] y, double[] z) {

    public CartesianCoordinates {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(z, "z");
        if (x.length != y.length || x.length != z.length) {
            throw new DimensionMismatchException("cartesian components differ in length",
                new int[] {x.length, y.length}, new int[] {z.length});
        }
    }

    /** Number of points. */
    public int size() {
        return x.length;
    }

    /** Point i as a fresh {x, y, z} array. */
    public double[] point(int i) {
        return new double[] {x[i], y[i], z[i]};
    }

    /** All points as an N x 3 matrix. */
    public double[][] toVectors() {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = point(i);
        }
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CartesianCoordinates)) return false;
        CartesianCoordinates other = (CartesianCoordinates) obj;
        return Arrays.equals(x, other.x)
            && Arrays.equals(y, other.y)
            && Arrays.equals(z, other.z);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(x);
        h = 31 * h + Arrays.hashCode(y);
        return 31 * h + Arrays.hashCode(z);
    }

    @Override
    public String toString() {
        return "CartesianCoordinates[x=" + Arrays.toString(x)
            + ", y=" + Arrays.toString(y)
            + ", z=" + Arrays.toString(z) + "]";
    }
}
