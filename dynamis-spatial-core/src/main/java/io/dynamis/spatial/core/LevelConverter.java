package io.dynamis.spatial.core;

import io.dynamis.spatial.api.Complex;
import io.dynamis.spatial.api.ShapedArray;
import io.dynamis.spatial.api.SpatialShapeException;

import java.util.Objects;

/**
 * Stateless level conversions: linear ratio <-> decibel, and RMS energy.
 *
 * DECIBEL:
 *   amplitude: dB = 20 * log10(|x|),   x = 10^(dB / 20)
 *   power:     dB = 10 * log10(|x|),   x = 10^(dB / 10)
 *   x = 0 gives -Infinity. That is a result, not an error; nothing is thrown or logged.
 *
 * RMS:
 *   rms = sqrt(mean(x * conj(x))) along one axis, other axes preserved.
 *   An empty reduction is 0/0 = NaN, as the mean itself would be.
 */
public final class LevelConverter {

    private LevelConverter() {}

    // -- Ratio -> decibel -----------------------------------------------------

    /** Amplitude ratio to dB. */
    public static double toDecibel(double x) {
        return toDecibel(x, false);
    }

    /**
     * Ratio to dB.
     *
     * @param power true if x is a power ratio (10 log10), false for amplitude (20 log10)
     */
    public static double toDecibel(double x, boolean power) {
        return factor(power) * Math.log10(Math.abs(x));
    }

    public static double[] toDecibel(double[] x) {
        return toDecibel(x, false);
    }

    public static double[] toDecibel(double[] x, boolean power) {
        Objects.requireNonNull(x, "x");
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = toDecibel(x[i], power);
        }
        return out;
    }

    /** dB of complex ratios, using their magnitude. */
    public static double[] toDecibel(Complex[] x, boolean power) {
        Objects.requireNonNull(x, "x");
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = toDecibel(x[i].abs(), power);
        }
        return out;
    }

    // -- Decibel -> ratio -----------------------------------------------------

    /** dB to amplitude ratio. */
    public static double fromDecibel(double db) {
        return fromDecibel(db, false);
    }

    public static double fromDecibel(double db, boolean power) {
        return Math.pow(10.0, db / factor(power));
    }

    public static double[] fromDecibel(double[] db) {
        return fromDecibel(db, false);
    }

    public static double[] fromDecibel(double[] db, boolean power) {
        Objects.requireNonNull(db, "db");
        double[] out = new double[db.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = fromDecibel(db[i], power);
        }
        return out;
    }

    private static double factor(boolean power) {
        return power ? 10.0 : 20.0;
    }

    // -- RMS ------------------------------------------------------------------

    /** RMS of a real sequence. */
    public static double rms(double[] x) {
        Objects.requireNonNull(x, "x");
        double sum = 0.0;
        for (double v : x) {
            sum += v * v;
        }
        return Math.sqrt(sum / x.length);
    }

    /** RMS of a complex sequence: sqrt(mean(x * conj(x))). */
    public static double rms(Complex[] x) {
        Objects.requireNonNull(x, "x");
        double sum = 0.0;
        for (Complex v : x) {
            sum += v.absSquared();
        }
        return Math.sqrt(sum / x.length);
    }

    /** RMS along the last axis. */
    public static ShapedArray rms(ShapedArray x) {
        return rms(x, -1);
    }

    /**
     * RMS along one axis of a real array. The result has that axis removed;
     * reducing a rank-1 array yields a rank-0 array.
     *
     * @param axis axis to reduce; negative counts from the end
     * @throws SpatialShapeException if the axis does not exist
     */
    public static ShapedArray rms(ShapedArray x, int axis) {
        Objects.requireNonNull(x, "x");
        int[] shape = x.shape();
        int resolved = x.normalizeAxis(axis);
        int outer = 1;
        for (int a = 0; a < resolved; a++) outer *= shape[a];
        int length = shape[resolved];
        int inner = 1;
        for (int a = resolved + 1; a < shape.length; a++) inner *= shape[a];

        double[] data = x.toFlatArray();
        double[] out = new double[outer * inner];
        for (int o = 0; o < outer; o++) {
            for (int i = 0; i < inner; i++) {
                double sum = 0.0;
                for (int k = 0; k < length; k++) {
                    double v = data[(o * length + k) * inner + i];
                    sum += v * v;
                }
                out[o * inner + i] = Math.sqrt(sum / length);
            }
        }
        return ShapedArray.of(removeAxis(shape, resolved), out);
    }

    /**
     * RMS along one axis of a complex channel matrix (channels x samples).
     *
     * @param axis 0 (or -2) for one value per column, 1 (or -1) for one value per row
     * @throws SpatialShapeException if the axis is out of range, or rows are ragged
     */
    public static double[] rms(Complex[][] x, int axis) {
        Objects.requireNonNull(x, "x");
        int rows = x.length;
        int columns = rows == 0 ? 0 : x[0].length;
        for (int r = 0; r < rows; r++) {
            if (x[r].length != columns) {
                throw new SpatialShapeException("ragged matrix: row " + r + " has "
                    + x[r].length + " columns, expected " + columns);
            }
        }
        return switch (axis) {
            case 1, -1 -> {
                double[] out = new double[rows];
                for (int r = 0; r < rows; r++) {
                    out[r] = rms(x[r]);
                }
                yield out;
            }
            case 0, -2 -> {
                double[] out = new double[columns];
                for (int c = 0; c < columns; c++) {
                    double sum = 0.0;
                    for (int r = 0; r < rows; r++) {
                        sum += x[r][c].absSquared();
                    }
                    out[c] = Math.sqrt(sum / rows);
                }
                yield out;
            }
            default -> throw new SpatialShapeException("axis " + axis
                + " is out of bounds for array of dimension 2");
        };
    }

    private static int[] removeAxis(int[] shape, int axis) {
        int[] out = new int[shape.length - 1];
        for (int a = 0, j = 0; a < shape.length; a++) {
            if (a != axis) out[j++] = shape[a];
        }
        return out;
    }
}
