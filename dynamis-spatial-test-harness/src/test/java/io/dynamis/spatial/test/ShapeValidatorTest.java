package io.dynamis.spatial.test;

import io.dynamis.spatial.api.DimensionMismatchException;
import io.dynamis.spatial.api.FormatConstraintException;
import io.dynamis.spatial.api.ShapedArray;
import io.dynamis.spatial.api.SpatialShapeException;
import io.dynamis.spatial.core.ShapeValidator;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class ShapeValidatorTest {

    @Test
    void scalarIsPromotedToLengthOneSequence() {
        assertThat(ShapeValidator.asVector(5.0)).containsExactly(5.0);
        assertThat(ShapeValidator.asVector(ShapedArray.scalar(5.0))).containsExactly(5.0);
    }

    @Test
    void twoByTwoIsRejected() {
        assertThatThrownBy(() -> ShapeValidator.asVector(new double[][] {{1, 2}, {3, 4}}))
            .isExactlyInstanceOf(SpatialShapeException.class)
            .hasMessageContaining("array must be one-dimensional");
    }

    @Test
    void shapeErrorIsNotAMismatchOrLayoutError() {
        Throwable thrown = catchThrowable(() -> ShapeValidator.asVector(new double[][] {{1, 2}, {3, 4}}));
        assertThat(thrown)
            .isExactlyInstanceOf(SpatialShapeException.class)
            .isNotInstanceOf(DimensionMismatchException.class)
            .isNotInstanceOf(FormatConstraintException.class);
    }

    @Test
    void rowVectorIsSqueezed() {
        assertThat(ShapeValidator.asVector(new double[][] {{1, 2, 3}})).containsExactly(1, 2, 3);
    }

    @Test
    void columnVectorIsSqueezed() {
        assertThat(ShapeValidator.asVector(new double[][] {{1}, {2}, {3}})).containsExactly(1, 2, 3);
    }

    @Test
    void oneByOneBecomesLengthOne() {
        assertThat(ShapeValidator.asVector(new double[][] {{4}})).containsExactly(4.0);
    }

    @Test
    void higherRankWithSingletonsIsAccepted() {
        ShapedArray t = ShapedArray.of(new int[] {1, 1, 4}, new double[] {1, 2, 3, 4});
        assertThat(ShapeValidator.asVector(t)).containsExactly(1, 2, 3, 4);
    }

    @Test
    void higherRankWithTwoRealAxesIsRejected() {
        ShapedArray t = ShapedArray.of(new int[] {2, 1, 2}, new double[] {1, 2, 3, 4});
        assertThatThrownBy(() -> ShapeValidator.asVector(t))
            .isExactlyInstanceOf(SpatialShapeException.class);
    }

    @Test
    void emptySequencePassesThrough() {
        assertThat(ShapeValidator.asVector(new double[0])).isEmpty();
    }

    @Test
    void resultIsAFreshCopy() {
        double[] in = {1, 2};
        double[] out = ShapeValidator.asVector(in);
        out[0] = 42;
        assertThat(in[0]).isEqualTo(1.0);
    }

    @Test
    void atLeast2dPromotesVectorToRow() {
        assertThat(ShapeValidator.atLeast2d(ShapedArray.vector(1, 2, 3)).shape()).containsExactly(1, 3);
        assertThat(ShapeValidator.atLeast2d(ShapedArray.scalar(1)).shape()).containsExactly(1, 1);
    }

    @Test
    void atLeast2dRejectsRankThree() {
        ShapedArray t = ShapedArray.of(new int[] {2, 2, 2}, new double[8]);
        assertThatThrownBy(() -> ShapeValidator.atLeast2d(t))
            .isExactlyInstanceOf(SpatialShapeException.class);
    }
}
