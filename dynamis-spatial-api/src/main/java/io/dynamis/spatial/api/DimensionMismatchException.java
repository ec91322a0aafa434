package io.dynamis.spatial.api;

import java.util.Arrays;

/**
 * Thrown when two arrays that must share a dimension do not.
 *
 * Carries both offending shapes for diagnostic purposes.
 */
public final class DimensionMismatchException extends SpatialShapeException {

    private final int[] firstShape;
    private final int[] secondShape;

    public DimensionMismatchException(String message, int[] firstShape, int[] secondShape) {
        super(message + " (shapes " + Arrays.toString(firstShape)
            + " and " + Arrays.toString(secondShape) + ")");
        this.firstShape = firstShape.clone();
        this.secondShape = secondShape.clone();
    }

    /** Shape of the first operand. Defensive copy. */
    public int[] firstShape() { return firstShape.clone(); }

    /** Shape of the second operand. Defensive copy. */
    public int[] secondShape() { return secondShape.clone(); }
}
