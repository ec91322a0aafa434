package io.dynamis.spatial.api;

/**
 * Immutable complex sample, used for RMS and level estimation of analytic
 * or spectral-domain signals.
 */
public record Complex(double real, double imag) {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    /** Real-valued sample with zero imaginary part. */
    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    /** Unit phasor scaled by magnitude: magnitude * e^(i * phase). */
    public static Complex polar(double magnitude, double phase) {
        return new Complex(magnitude * Math.cos(phase), magnitude * Math.sin(phase));
    }

    public Complex conjugate() {
        return new Complex(real, -imag);
    }

    public Complex multiply(Complex other) {
        return new Complex(
            real * other.real - imag * other.imag,
            real * other.imag + imag * other.real);
    }

    /** |z|, computed without intermediate overflow. */
    public double abs() {
        return Math.hypot(real, imag);
    }

    /** z * conj(z), which is always real. */
    public double absSquared() {
        return real * real + imag * imag;
    }
}
