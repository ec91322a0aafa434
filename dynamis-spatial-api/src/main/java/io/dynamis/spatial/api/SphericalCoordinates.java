package io.dynamis.spatial.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Batch of directions in spherical form, one entry per point.
 *
 * Azimuth is the angle around the +z pole measured from +x towards +y.
 * As produced by cartesian-to-spherical conversion it lies in (-pi, pi];
 * callers wanting [0, 2pi) wrap it themselves or use vectorsToDirections.
 * Colatitude lies in [0, pi] (NaN at the origin unless steady mode was used).
 * Radius is >= 0.
 *
 * The component arrays are owned by this record; accessors return them directly.
 * Equality compares component contents, not array identity.
 */
public record SphericalCoordinates(double[] azimuth, double[] colatitude, double[] radius) {

    public SphericalCoordinates {
        Objects.requireNonNull(azimuth, "azimuth");
        Objects.requireNonNull(colatitude, "colatitude");
        Objects.requireNonNull(radius, "radius");
        if (azimuth.length != colatitude.length || azimuth.length != radius.length) {
            throw new DimensionMismatchException("spherical components differ in length",
                new int[] {azimuth.length, colatitude.length}, new int[] {radius.length});
        }
    }

    /** Number of points. */
    public int size() {
        return azimuth.length;
    }

    /** Elevation (pi/2 - colatitude) of every point. Fresh array. */
    public double[] elevation() {
        double[] out = new double[colatitude.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.PI / 2.0 - colatitude[i];
        }
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SphericalCoordinates)) return false;
        SphericalCoordinates other = (SphericalCoordinates) obj;
        return Arrays.equals(azimuth, other.azimuth)
            && Arrays.equals(colatitude, other.colatitude)
            && Arrays.equals(radius, other.radius);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(azimuth);
        h = 31 * h + Arrays.hashCode(colatitude);
        return 31 * h + Arrays.hashCode(radius);
    }

    @Override
    public String toString() {
        return "SphericalCoordinates[azimuth=" + Arrays.toString(azimuth)
            + ", colatitude=" + Arrays.toString(colatitude)
            + ", radius=" + Arrays.toString(radius) + "]";
    }
}
