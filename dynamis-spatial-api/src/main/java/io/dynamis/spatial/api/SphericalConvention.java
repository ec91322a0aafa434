package io.dynamis.spatial.api;

/**
 * Meaning of the second angle of a spherical triple.
 *
 * COLATITUDE: polar angle measured down from the +z pole, range [0, pi].
 *             z = r * cos(colatitude).
 * ELEVATION:  angle measured up from the horizontal plane, range [-pi/2, pi/2].
 *             z = r * sin(elevation). Legacy convention.
 *
 * elevation = pi/2 - colatitude. The two are never interchangeable without that
 * conversion, so callers always name the convention explicitly.
 */
public enum SphericalConvention {
    COLATITUDE,
    ELEVATION;

    /**
     * Converts an angle in this convention to colatitude.
     *
     * @param angle colatitude or elevation in radians, per this convention
     * @return colatitude in radians
     */
    public double toColatitude(double angle) {
        return switch (this) {
            case COLATITUDE -> angle;
            case ELEVATION  -> Math.PI / 2.0 - angle;
        };
    }
}
