package io.dynamis.spatial.core;

import io.dynamis.spatial.api.DimensionMismatchException;

/**
 * One-dimensional broadcasting for elementwise routines.
 *
 * Sequences combine when their lengths are equal, or when one of them has
 * length 1 (that value repeats). The result length is the common non-1 length,
 * or 1 if every operand has length 1. Empty operands broadcast to empty output
 * as long as all other operands have length 0 or 1.
 */
public final class Broadcast {

    private Broadcast() {}

    /**
     * Common length of the given sequences.
     *
     * @param operation name used in the failure message
     * @throws DimensionMismatchException if two lengths differ and neither is 1
     */
    public static int length(String operation, double[]... operands) {
        int result = 1;
        int[] first = null;
        for (double[] operand : operands) {
            int n = operand.length;
            if (n == 1) continue;
            if (first == null) {
                first = new int[] {n};
                result = n;
            } else if (n != result) {
                throw new DimensionMismatchException(
                    operation + ": operands could not be broadcast together",
                    first, new int[] {n});
            }
        }
        return result;
    }

    /** Element i of a broadcast operand. */
    public static double at(double[] operand, int i) {
        return operand.length == 1 ? operand[0] : operand[i];
    }
}
