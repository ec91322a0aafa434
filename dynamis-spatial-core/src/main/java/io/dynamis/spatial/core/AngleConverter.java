package io.dynamis.spatial.core;

import io.dynamis.spatial.api.SpatialConstants;

import java.util.Objects;

/**
 * Stateless degree/radian conversion with range normalisation.
 *
 *   deg2rad: degrees, any real -> radians in [0, 2pi)
 *   rad2deg: radians, any real -> degrees in [0, 360)
 *
 * Reduction is a floored modulo, so negative angles wrap (-10 deg -> 350 deg).
 * Elementwise and shape-agnostic; array overloads return fresh arrays of the same shape.
 * NaN and infinite input produce NaN.
 */
public final class AngleConverter {

    private AngleConverter() {}

    // -- Degrees -> radians ---------------------------------------------------

    public static double deg2rad(double degrees) {
        double wrapped = floorMod(degrees, SpatialConstants.FULL_TURN_DEGREES);
        double radians = wrapped / 180.0 * Math.PI;
        // 359.99999999999994 deg scales to exactly 2pi
        return radians >= SpatialConstants.TWO_PI ? 0.0 : radians;
    }

    public static double[] deg2rad(double[] degrees) {
        Objects.requireNonNull(degrees, "degrees");
        double[] out = new double[degrees.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = deg2rad(degrees[i]);
        }
        return out;
    }

    public static double[][] deg2rad(double[][] degrees) {
        Objects.requireNonNull(degrees, "degrees");
        double[][] out = new double[degrees.length][];
        for (int i = 0; i < out.length; i++) {
            out[i] = deg2rad(degrees[i]);
        }
        return out;
    }

    // -- Radians -> degrees ---------------------------------------------------

    public static double rad2deg(double radians) {
        return floorMod(radians / Math.PI * 180.0, SpatialConstants.FULL_TURN_DEGREES);
    }

    public static double[] rad2deg(double[] radians) {
        Objects.requireNonNull(radians, "radians");
        double[] out = new double[radians.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = rad2deg(radians[i]);
        }
        return out;
    }

    public static double[][] rad2deg(double[][] radians) {
        Objects.requireNonNull(radians, "radians");
        double[][] out = new double[radians.length][];
        for (int i = 0; i < out.length; i++) {
            out[i] = rad2deg(radians[i]);
        }
        return out;
    }

    // -- Wrapping -------------------------------------------------------------

    /**
     * Wraps an azimuth from atan2's (-pi, pi] into [0, 2pi).
     */
    public static double wrapAzimuth(double radians) {
        return floorMod(radians, SpatialConstants.TWO_PI);
    }

    /**
     * Floored modulo for doubles: result in [0, modulus) for finite value.
     * A tiny negative value whose shifted remainder rounds up to modulus yields 0.
     */
    static double floorMod(double value, double modulus) {
        double r = value % modulus;
        if (r < 0.0) {
            r += modulus;
        }
        if (r >= modulus) {
            return 0.0;
        }
        return r + 0.0; // -0.0 -> 0.0
    }
}
