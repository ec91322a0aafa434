package io.dynamis.spatial.core;

import io.dynamis.spatial.api.DimensionMismatchException;

import java.util.Objects;

/**
 * Stateless angular and geometric measures between directions and points.
 *
 * ANGLE BETWEEN:
 *   angle = acos(clip(dot(v1, v2) / (|v1| * |v2|), -1, 1))
 *   The clip keeps rounding overshoot (e.g. 1.0000000000000002) inside acos's domain.
 *   A zero-length vector yields NaN.
 *
 * HAVERSINE (great-circle distance, colatitude input):
 *   lat = pi/2 - colat
 *   a   = sin^2(dlat / 2) + cos(lat1) * cos(lat2) * sin^2(dlon / 2)
 *   d   = 2 * r * asin(sqrt(min(a, 1)))
 *
 * TRIANGLE AREA:
 *   area = 0.5 * |(p2 - p1) x (p3 - p1)|. Collinear points give 0.
 */
public final class AngularMetrics {

    private AngularMetrics() {}

    // -- Angle between vectors ------------------------------------------------

    /** Angle in radians between two vectors from the origin. */
    public static double angleBetween(double[] v1, double[] v2) {
        return angleBetween(v1, new double[][] {v2}, null)[0];
    }

    /** Angle in radians between two points as seen from {@code vertex}. */
    public static double angleBetween(double[] v1, double[] v2, double[] vertex) {
        Objects.requireNonNull(vertex, "vertex");
        return angleBetween(v1, new double[][] {v2}, vertex)[0];
    }

    /** One angle per row of {@code v2}, each measured against {@code v1}. */
    public static double[] angleBetween(double[] v1, double[][] v2) {
        return angleBetween(v1, v2, null);
    }

    /**
     * One angle per row of {@code v2}, each measured against {@code v1}.
     *
     * @param vertex shared initial point subtracted from v1 and every row of v2; null for the origin
     * @throws DimensionMismatchException if a row of v2 or the vertex differs in width from v1
     */
    public static double[] angleBetween(double[] v1, double[][] v2, double[] vertex) {
        double[] a = ShapeValidator.asVector(v1);
        Objects.requireNonNull(v2, "v2");
        int width = a.length;
        if (vertex != null) {
            ShapeValidator.requireLength("vertex", vertex, width);
            a = subtract(a, vertex);
        }
        a = scaleByLargest(a);
        double sqA = dot(a, a);

        double[] angles = new double[v2.length];
        for (int i = 0; i < v2.length; i++) {
            double[] b = ShapeValidator.requireLength("v2[" + i + "]", v2[i], width);
            if (vertex != null) {
                b = subtract(b, vertex);
            }
            b = scaleByLargest(b);
            // components now lie in [-1, 1], so |a|^2 |b|^2 cannot overflow or underflow;
            // sqrt of the product makes angleBetween(v, v) exactly 0
            double cos = dot(a, b) / Math.sqrt(sqA * dot(b, b));
            angles[i] = Math.acos(clip(cos, -1.0, 1.0));
        }
        return angles;
    }

    // -- Great-circle distance ------------------------------------------------

    /** Unit-sphere haversine distance (central angle) between two points. */
    public static double haversine(double azimuth1, double colatitude1,
                                   double azimuth2, double colatitude2) {
        return haversine(azimuth1, colatitude1, azimuth2, colatitude2, 1.0);
    }

    /** Haversine distance between two points on a sphere of the given radius. */
    public static double haversine(double azimuth1, double colatitude1,
                                   double azimuth2, double colatitude2, double radius) {
        double lat1 = Math.PI / 2.0 - colatitude1;
        double lat2 = Math.PI / 2.0 - colatitude2;
        double halfDLat = Math.sin((lat2 - lat1) / 2.0);
        double halfDLon = Math.sin((azimuth2 - azimuth1) / 2.0);
        double alpha = halfDLat * halfDLat
            + Math.cos(lat1) * Math.cos(lat2) * halfDLon * halfDLon;
        // antipodal rounding can push alpha just past 1
        return 2.0 * radius * Math.asin(Math.sqrt(Math.min(1.0, alpha)));
    }

    /** Unit-sphere haversine distances between paired points. */
    public static double[] haversine(double[] azimuth1, double[] colatitude1,
                                     double[] azimuth2, double[] colatitude2) {
        return haversine(azimuth1, colatitude1, azimuth2, colatitude2, 1.0);
    }

    /**
     * Haversine distances between paired points, elementwise with broadcasting.
     *
     * @throws DimensionMismatchException if the four lengths do not broadcast
     */
    public static double[] haversine(double[] azimuth1, double[] colatitude1,
                                     double[] azimuth2, double[] colatitude2, double radius) {
        Objects.requireNonNull(azimuth1, "azimuth1");
        Objects.requireNonNull(colatitude1, "colatitude1");
        Objects.requireNonNull(azimuth2, "azimuth2");
        Objects.requireNonNull(colatitude2, "colatitude2");
        int n = Broadcast.length("haversine", azimuth1, colatitude1, azimuth2, colatitude2);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = haversine(
                Broadcast.at(azimuth1, i), Broadcast.at(colatitude1, i),
                Broadcast.at(azimuth2, i), Broadcast.at(colatitude2, i), radius);
        }
        return out;
    }

    // -- Triangle area --------------------------------------------------------

    /**
     * Area of the triangle with the given corners.
     *
     * Corners are 3-d points; 2-d points are taken to lie in the z = 0 plane.
     *
     * @throws DimensionMismatchException if a corner has another width, or widths differ
     */
    public static double triangleArea(double[] p1, double[] p2, double[] p3) {
        double[] a = toPoint3("p1", p1);
        double[] b = toPoint3("p2", p2);
        double[] c = toPoint3("p3", p3);
        if (p1.length != p2.length || p1.length != p3.length) {
            throw new DimensionMismatchException("triangle corners differ in width",
                new int[] {p1.length, p2.length}, new int[] {p3.length});
        }
        double abX = b[0] - a[0];
        double abY = b[1] - a[1];
        double abZ = b[2] - a[2];
        double acX = c[0] - a[0];
        double acY = c[1] - a[1];
        double acZ = c[2] - a[2];

        double crossX = abY * acZ - abZ * acY;
        double crossY = abZ * acX - abX * acZ;
        double crossZ = abX * acY - abY * acX;
        return 0.5 * Math.sqrt(crossX * crossX + crossY * crossY + crossZ * crossZ);
    }

    // -- Helpers --------------------------------------------------------------

    private static double[] toPoint3(String name, double[] p) {
        Objects.requireNonNull(p, name);
        if (p.length == 3) {
            return p;
        }
        if (p.length == 2) {
            return new double[] {p[0], p[1], 0.0};
        }
        throw new DimensionMismatchException(name + " must be a 2-d or 3-d point",
            new int[] {p.length}, new int[] {3});
    }

    static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /**
     * Divides a vector by its largest absolute component. The direction is unchanged.
     * Zero and non-finite vectors are returned as they are.
     */
    private static double[] scaleByLargest(double[] v) {
        double largest = 0.0;
        for (double c : v) {
            largest = Math.max(largest, Math.abs(c));
        }
        if (largest == 0.0 || !Double.isFinite(largest)) {
            return v;
        }
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] / largest;
        }
        return out;
    }

    private static double[] subtract(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] - b[i];
        }
        return out;
    }

    private static double clip(double value, double min, double max) {
        // NaN falls through both comparisons and is returned unchanged
        if (value < min) return min;
        if (value > max) return max;
        return value;
    }
}
