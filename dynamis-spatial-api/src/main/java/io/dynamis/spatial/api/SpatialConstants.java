package io.dynamis.spatial.api;

/**
 * Global constants for the Dynamis spatial primitives.
 *
 * These values are locked. Changing any of them alters numeric results
 * of every coordinate transform and comparison built on top of them.
 */
public final class SpatialConstants {

    private SpatialConstants() {}

    // -- Angles ---------------------------------------------------------------

    /** Full turn in radians. Upper (exclusive) bound of a normalised azimuth. */
    public static final double TWO_PI = 2.0 * Math.PI;

    /** Full turn in degrees. Upper (exclusive) bound of a normalised degree angle. */
    public static final double FULL_TURN_DEGREES = 360.0;

    // -- Coordinate transform -------------------------------------------------

    /**
     * Radius floor applied in steady-colatitude mode before dividing z by r.
     * Keeps acos(z / r) finite at the origin; the origin then maps to colatitude pi/2.
     */
    public static final double STEADY_RADIUS_FLOOR = 1e-14;

    // -- Diagnostics ----------------------------------------------------------

    /** Default cumulative-difference tolerance of the diagnostic comparator. */
    public static final double DEFAULT_COMPARE_TOLERANCE = 1e-6;

    // -- Channel layouts ------------------------------------------------------

    /** Channel count required by the SSR 360-channel surround layout. */
    public static final int SSR_CHANNEL_COUNT = 360;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (!(STEADY_RADIUS_FLOOR > 0.0) || STEADY_RADIUS_FLOOR > 1e-6) {
            throw new IllegalStateException(
                "STEADY_RADIUS_FLOOR must be a small positive value; actual = " + STEADY_RADIUS_FLOOR);
        }
        if (!(DEFAULT_COMPARE_TOLERANCE > 0.0)) {
            throw new IllegalStateException(
                "DEFAULT_COMPARE_TOLERANCE must be positive; actual = " + DEFAULT_COMPARE_TOLERANCE);
        }
        if (SSR_CHANNEL_COUNT != (int) FULL_TURN_DEGREES) {
            throw new IllegalStateException(
                "SSR_CHANNEL_COUNT must be one channel per degree; actual = " + SSR_CHANNEL_COUNT);
        }
        if (ChannelLayout.SSR.channelCount() != SSR_CHANNEL_COUNT) {
            throw new IllegalStateException(
                "ChannelLayout.SSR disagrees with SSR_CHANNEL_COUNT");
        }
    }

    static {
        validate();
    }
}
