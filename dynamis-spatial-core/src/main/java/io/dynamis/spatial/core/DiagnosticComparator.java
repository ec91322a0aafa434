package io.dynamis.spatial.core;

import io.dynamis.spatial.api.CompareOptions;
import io.dynamis.spatial.api.DimensionMismatchException;
import io.dynamis.spatial.api.ShapedArray;
import io.dynamis.spatial.api.SpatialShapeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Advisory element-wise comparison of two arrays, for validation and debugging.
 *
 * Both inputs are flattened; the cumulative absolute difference
 *   d = sum(|v1[i] - v2[i]|)
 * is returned whatever the verbosity. When verbose, a message is logged:
 * "Close enough." at INFO if d <= tolerance, "Diff: d" at WARN otherwise.
 * Never throws on a large difference - the caller decides what to do with d.
 */
public final class DiagnosticComparator {

    private static final Logger logger = LogManager.getLogger(DiagnosticComparator.class);

    private DiagnosticComparator() {}

    public static double compare(double[] v1, double[] v2) {
        return compare(ShapedArray.vector(v1), ShapedArray.vector(v2), CompareOptions.defaults());
    }

    public static double compare(double[] v1, double[] v2, CompareOptions options) {
        return compare(ShapedArray.vector(v1), ShapedArray.vector(v2), options);
    }

    public static double compare(double[][] v1, double[][] v2, CompareOptions options) {
        return compare(ShapedArray.matrix(v1), ShapedArray.matrix(v2), options);
    }

    /**
     * Sums the absolute element-wise difference of the flattened inputs.
     *
     * A length-1 input is compared against every element of the other.
     *
     * @throws DimensionMismatchException if the flattened lengths differ and neither is 1
     * @throws SpatialShapeException if options.axis() is set to anything but 0 or -1
     */
    public static double compare(ShapedArray v1, ShapedArray v2, CompareOptions options) {
        Objects.requireNonNull(v1, "v1");
        Objects.requireNonNull(v2, "v2");
        Objects.requireNonNull(options, "options");
        Integer axis = options.axis();
        if (axis != null && axis != 0 && axis != -1) {
            // the flattened difference has exactly one axis
            throw new SpatialShapeException("axis " + axis
                + " is out of bounds for array of dimension 1");
        }

        double[] a = v1.toFlatArray();
        double[] b = v2.toFlatArray();
        int n;
        try {
            n = Broadcast.length("compare", a, b);
        } catch (DimensionMismatchException e) {
            throw new DimensionMismatchException("compared arrays differ in size",
                v1.shape(), v2.shape());
        }
        double diff = 0.0;
        for (int i = 0; i < n; i++) {
            diff += Math.abs(Broadcast.at(a, i) - Broadcast.at(b, i));
        }

        if (options.verbose()) {
            report(options, diff);
        }
        return diff;
    }

    private static void report(CompareOptions options, double diff) {
        String prefix = options.label() == null ? "" : options.label() + " -- ";
        if (diff > options.tolerance()) {
            logger.warn("{}Diff: {}", prefix, diff);
        } else {
            logger.info("{}Close enough.", prefix);
        }
    }
}
