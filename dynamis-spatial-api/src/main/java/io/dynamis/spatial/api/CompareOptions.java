package io.dynamis.spatial.api;

/**
 * Options for the diagnostic array comparator.
 *
 * @param label     optional message prefix; null for none
 * @param axis      axis of the flattened difference to sum over; null sums everything
 * @param tolerance difference above which the comparison is reported as a failure
 * @param verbose   whether to log the pass/fail message
 */
public record CompareOptions(String label, Integer axis, double tolerance, boolean verbose) {

    public static CompareOptions defaults() {
        return new CompareOptions(null, null, SpatialConstants.DEFAULT_COMPARE_TOLERANCE, true);
    }

    public CompareOptions withLabel(String newLabel) {
        return new CompareOptions(newLabel, axis, tolerance, verbose);
    }

    public CompareOptions withAxis(Integer newAxis) {
        return new CompareOptions(label, newAxis, tolerance, verbose);
    }

    public CompareOptions withTolerance(double newTolerance) {
        return new CompareOptions(label, axis, newTolerance, verbose);
    }

    public CompareOptions quiet() {
        return new CompareOptions(label, axis, tolerance, false);
    }
}
