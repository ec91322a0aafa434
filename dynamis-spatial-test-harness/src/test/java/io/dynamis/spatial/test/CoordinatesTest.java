package io.dynamis.spatial.test;

import io.dynamis.spatial.api.CartesianCoordinates;
import io.dynamis.spatial.api.Complex;
import io.dynamis.spatial.api.DimensionMismatchException;
import io.dynamis.spatial.api.SphericalConvention;
import io.dynamis.spatial.api.SphericalCoordinates;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class CoordinatesTest {

    @Test
    void sphericalComponentsMustAgreeInLength() {
        assertThatThrownBy(() -> new SphericalCoordinates(new double[2], new double[2], new double[3]))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void cartesianComponentsMustAgreeInLength() {
        assertThatThrownBy(() -> new CartesianCoordinates(new double[1], new double[2], new double[1]))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void elevationIsComplementOfColatitude() {
        SphericalCoordinates sph = new SphericalCoordinates(
            new double[] {0, 0}, new double[] {0, Math.PI / 2}, new double[] {1, 1});
        assertThat(sph.elevation()).containsExactly(new double[] {Math.PI / 2, 0}, within(1e-15));
    }

    @Test
    void toVectorsLaysPointsOutAsRows() {
        CartesianCoordinates c = new CartesianCoordinates(
            new double[] {1, 4}, new double[] {2, 5}, new double[] {3, 6});
        assertThat(c.toVectors()).isDeepEqualTo(new double[][] {{1, 2, 3}, {4, 5, 6}});
    }

    @Test
    void batchesWithEqualContentsAreEqual() {
        SphericalCoordinates a = new SphericalCoordinates(new double[] {1, 2}, new double[] {0.5, 1}, new double[] {1, 1});
        SphericalCoordinates b = new SphericalCoordinates(new double[] {1, 2}, new double[] {0.5, 1}, new double[] {1, 1});
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new SphericalCoordinates(new double[] {1, 2}, new double[] {0.5, 1}, new double[] {1, 2}));

        CartesianCoordinates c = new CartesianCoordinates(new double[] {1}, new double[] {2}, new double[] {3});
        CartesianCoordinates d = new CartesianCoordinates(new double[] {1}, new double[] {2}, new double[] {3});
        assertThat(c).isEqualTo(d).hasSameHashCodeAs(d);
        assertThat(c).isNotEqualTo(new CartesianCoordinates(new double[] {1}, new double[] {2}, new double[] {4}));
    }

    @Test
    void toStringShowsComponentValues() {
        CartesianCoordinates c = new CartesianCoordinates(new double[] {1}, new double[] {2}, new double[] {3});
        assertThat(c).hasToString("CartesianCoordinates[x=[1.0], y=[2.0], z=[3.0]]");
    }

    @Test
    void conventionConvertsToColatitude() {
        assertThat(SphericalConvention.COLATITUDE.toColatitude(0.3)).isEqualTo(0.3);
        assertThat(SphericalConvention.ELEVATION.toColatitude(0.0)).isCloseTo(Math.PI / 2, within(1e-15));
    }

    @Test
    void complexTimesConjugateIsReal() {
        Complex z = new Complex(3, -4);
        Complex p = z.multiply(z.conjugate());
        assertThat(p.real()).isEqualTo(25.0);
        assertThat(p.imag()).isZero();
        assertThat(z.abs()).isEqualTo(5.0);
    }
}
