package io.dynamis.spatial.api;

/**
 * Thrown when an input array cannot take the shape a routine requires.
 *
 * Thrown directly when an input is not reducible to one dimension or names an
 * axis it does not have. Subclasses cover mismatches between two inputs and
 * violations of a named channel layout.
 */
public class SpatialShapeException extends IllegalArgumentException {

    public SpatialShapeException(String message) {
        super(message);
    }
}
