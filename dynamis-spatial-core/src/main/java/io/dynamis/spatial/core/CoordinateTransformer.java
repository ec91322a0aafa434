package io.dynamis.spatial.core;

import io.dynamis.spatial.api.CartesianCoordinates;
import io.dynamis.spatial.api.ShapedArray;
import io.dynamis.spatial.api.SpatialConstants;
import io.dynamis.spatial.api.SphericalConvention;
import io.dynamis.spatial.api.SphericalCoordinates;

import java.util.Objects;

/**
 * Stateless, vectorised conversion between Cartesian and spherical coordinates.
 *
 * PRIMARY CONVENTION (azimuth, colatitude, radius):
 *   x = r * cos(azi) * sin(colat)
 *   y = r * sin(azi) * sin(colat)
 *   z = r * cos(colat)
 *   azi = atan2(y, x) in (-pi, pi], colat = acos(z / r) in [0, pi]
 *
 * LEGACY CONVENTION (azimuth, elevation, radius):
 *   z = r * sin(elev), x = r * cos(elev) * cos(azi), y = r * cos(elev) * sin(azi)
 *
 * The conventions are exposed as separately named operations. The tagged
 * toCartesian() entry point dispatches exhaustively on SphericalConvention.
 *
 * Every component passes through ShapeValidator independently and is then
 * broadcast (equal lengths, or length 1). Results are fresh arrays.
 */
public final class CoordinateTransformer {

    private CoordinateTransformer() {}

    // -- Cartesian -> spherical -----------------------------------------------

    public static SphericalCoordinates cartesianToSpherical(double[] x, double[] y, double[] z) {
        return cartesianToSpherical(x, y, z, false);
    }

    public static SphericalCoordinates cartesianToSpherical(double x, double y, double z) {
        return cartesianToSpherical(ShapeValidator.asVector(x), ShapeValidator.asVector(y),
            ShapeValidator.asVector(z), false);
    }

    public static SphericalCoordinates cartesianToSpherical(ShapedArray x, ShapedArray y,
                                                            ShapedArray z, boolean steadyColatitude) {
        return cartesianToSpherical(ShapeValidator.asVector(x), ShapeValidator.asVector(y),
            ShapeValidator.asVector(z), steadyColatitude);
    }

    /**
     * Converts Cartesian points to (azimuth, colatitude, radius).
     *
     * With steadyColatitude the radius is floored at STEADY_RADIUS_FLOOR before the
     * division, so the origin maps to colatitude pi/2 instead of NaN. The returned
     * radius is never floored.
     *
     * @throws io.dynamis.spatial.api.DimensionMismatchException if the lengths do not broadcast
     */
    public static SphericalCoordinates cartesianToSpherical(double[] x, double[] y, double[] z,
                                                            boolean steadyColatitude) {
        x = ShapeValidator.asVector(x);
        y = ShapeValidator.asVector(y);
        z = ShapeValidator.asVector(z);
        int n = Broadcast.length("cartesianToSpherical", x, y, z);

        double[] azimuth = new double[n];
        double[] colatitude = new double[n];
        double[] radius = new double[n];
        for (int i = 0; i < n; i++) {
            double xi = Broadcast.at(x, i);
            double yi = Broadcast.at(y, i);
            double zi = Broadcast.at(z, i);
            double r = Math.sqrt(xi * xi + yi * yi + zi * zi);
            double divisor = steadyColatitude ? Math.max(r, SpatialConstants.STEADY_RADIUS_FLOOR) : r;
            azimuth[i] = Math.atan2(yi, xi);
            colatitude[i] = Math.acos(zi / divisor);
            radius[i] = r;
        }
        return new SphericalCoordinates(azimuth, colatitude, radius);
    }

    // -- Spherical (colatitude) -> Cartesian ----------------------------------

    /** Unit-radius conversion. */
    public static CartesianCoordinates sphericalToCartesian(double[] azimuth, double[] colatitude) {
        return sphericalToCartesian(azimuth, colatitude, ShapeValidator.asVector(1.0));
    }

    public static CartesianCoordinates sphericalToCartesian(double azimuth, double colatitude, double radius) {
        return sphericalToCartesian(ShapeValidator.asVector(azimuth),
            ShapeValidator.asVector(colatitude), ShapeValidator.asVector(radius));
    }

    public static CartesianCoordinates sphericalToCartesian(ShapedArray azimuth, ShapedArray colatitude,
                                                            ShapedArray radius) {
        return sphericalToCartesian(ShapeValidator.asVector(azimuth),
            ShapeValidator.asVector(colatitude), ShapeValidator.asVector(radius));
    }

    /**
     * Converts (azimuth, colatitude, radius) to Cartesian points.
     *
     * @throws io.dynamis.spatial.api.DimensionMismatchException if the lengths do not broadcast
     */
    public static CartesianCoordinates sphericalToCartesian(double[] azimuth, double[] colatitude,
                                                            double[] radius) {
        azimuth = ShapeValidator.asVector(azimuth);
        colatitude = ShapeValidator.asVector(colatitude);
        radius = ShapeValidator.asVector(radius);
        int n = Broadcast.length("sphericalToCartesian", azimuth, colatitude, radius);

        double[] x = new double[n];
        double[] y = new double[n];
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            double azi = Broadcast.at(azimuth, i);
            double colat = Broadcast.at(colatitude, i);
            double r = Broadcast.at(radius, i);
            double sinColat = Math.sin(colat);
            x[i] = r * Math.cos(azi) * sinColat;
            y[i] = r * Math.sin(azi) * sinColat;
            z[i] = r * Math.cos(colat);
        }
        return new CartesianCoordinates(x, y, z);
    }

    // -- Spherical (elevation) -> Cartesian -----------------------------------

    public static CartesianCoordinates legacySphericalToCartesian(double azimuth, double elevation,
                                                                  double radius) {
        return legacySphericalToCartesian(ShapeValidator.asVector(azimuth),
            ShapeValidator.asVector(elevation), ShapeValidator.asVector(radius));
    }

    /**
     * Converts (azimuth, elevation, radius) to Cartesian points.
     * Elevation is measured up from the horizontal plane, NOT down from the pole.
     *
     * @throws io.dynamis.spatial.api.DimensionMismatchException if the lengths do not broadcast
     */
    public static CartesianCoordinates legacySphericalToCartesian(double[] azimuth, double[] elevation,
                                                                  double[] radius) {
        Objects.requireNonNull(azimuth, "azimuth");
        Objects.requireNonNull(elevation, "elevation");
        Objects.requireNonNull(radius, "radius");
        int n = Broadcast.length("legacySphericalToCartesian", azimuth, elevation, radius);

        double[] x = new double[n];
        double[] y = new double[n];
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            double azi = Broadcast.at(azimuth, i);
            double elev = Broadcast.at(elevation, i);
            double r = Broadcast.at(radius, i);
            double rCosElev = r * Math.cos(elev);
            x[i] = rCosElev * Math.cos(azi);
            y[i] = rCosElev * Math.sin(azi);
            z[i] = r * Math.sin(elev);
        }
        return new CartesianCoordinates(x, y, z);
    }

    // -- Tagged dispatch ------------------------------------------------------

    /**
     * Converts spherical points to Cartesian under an explicitly named convention.
     *
     * @param convention meaning of {@code angle}; must not be null
     * @param angle      colatitude or elevation, per {@code convention}
     */
    public static CartesianCoordinates toCartesian(SphericalConvention convention, double[] azimuth,
                                                   double[] angle, double[] radius) {
        Objects.requireNonNull(convention, "convention");
        return switch (convention) {
            case COLATITUDE -> sphericalToCartesian(azimuth, angle, radius);
            case ELEVATION  -> legacySphericalToCartesian(azimuth, angle, radius);
        };
    }

    // -- Batch helpers --------------------------------------------------------

    /** N x 3 points to N x 2 (azimuth, colatitude) with azimuth in [0, 2pi). */
    public static double[][] vectorsToDirections(double[][] vectors) {
        return vectorsToDirections(vectors, true);
    }

    /**
     * Converts N x 3 Cartesian points to N x 2 (azimuth, colatitude) rows.
     *
     * @param positiveAzimuth wrap azimuth from (-pi, pi] into [0, 2pi)
     * @throws io.dynamis.spatial.api.DimensionMismatchException if a row is not 3 wide
     */
    public static double[][] vectorsToDirections(double[][] vectors, boolean positiveAzimuth) {
        Objects.requireNonNull(vectors, "vectors");
        int n = vectors.length;
        double[] x = new double[n];
        double[] y = new double[n];
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            ShapeValidator.requireLength("vectors[" + i + "]", vectors[i], 3);
            x[i] = vectors[i][0];
            y[i] = vectors[i][1];
            z[i] = vectors[i][2];
        }
        double[][] directions = new double[n][2];
        SphericalCoordinates sph = cartesianToSpherical(x, y, z);
        for (int i = 0; i < n; i++) {
            double azi = sph.azimuth()[i];
            directions[i][0] = positiveAzimuth ? AngleConverter.wrapAzimuth(azi) : azi;
            directions[i][1] = sph.colatitude()[i];
        }
        return directions;
    }

    /**
     * Converts N x 2 (azimuth, colatitude) rows to N x 3 unit vectors.
     *
     * @throws io.dynamis.spatial.api.DimensionMismatchException if a row is not 2 wide
     */
    public static double[][] directionsToVectors(double[][] directions) {
        Objects.requireNonNull(directions, "directions");
        int n = directions.length;
        double[] azimuth = new double[n];
        double[] colatitude = new double[n];
        for (int i = 0; i < n; i++) {
            ShapeValidator.requireLength("directions[" + i + "]", directions[i], 2);
            azimuth[i] = directions[i][0];
            colatitude[i] = directions[i][1];
        }
        return sphericalToCartesian(azimuth, colatitude).toVectors();
    }
}
