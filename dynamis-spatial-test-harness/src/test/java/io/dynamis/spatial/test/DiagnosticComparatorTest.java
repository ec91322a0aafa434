package io.dynamis.spatial.test;

import io.dynamis.spatial.api.CompareOptions;
import io.dynamis.spatial.api.DimensionMismatchException;
import io.dynamis.spatial.api.ShapedArray;
import io.dynamis.spatial.api.SpatialShapeException;
import io.dynamis.spatial.core.DiagnosticComparator;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class DiagnosticComparatorTest {

    private CapturingAppender captured;

    @BeforeEach
    void setUp() {
        captured = CapturingAppender.attachTo(DiagnosticComparator.class);
    }

    @AfterEach
    void tearDown() {
        captured.detach();
    }

    @Test
    void identicalArraysHaveZeroDifference() {
        assertThat(DiagnosticComparator.compare(new double[] {1, 2, 3}, new double[] {1, 2, 3})).isZero();
    }

    @Test
    void differenceIsCumulativeAbsolute() {
        double d = DiagnosticComparator.compare(new double[] {1, 2, 3}, new double[] {2, 0, 3});
        assertThat(d).isCloseTo(3.0, within(1e-15));
    }

    @Test
    void differenceIsReturnedWhenQuiet() {
        double d = DiagnosticComparator.compare(new double[] {0, 0}, new double[] {1, 1},
            CompareOptions.defaults().quiet());
        assertThat(d).isCloseTo(2.0, within(1e-15));
    }

    // -- logging ---------------------------------------------------------------

    @Test
    void labelledDifferenceAboveToleranceIsLoggedAtWarn() {
        DiagnosticComparator.compare(new double[] {1}, new double[] {5},
            CompareOptions.defaults().withLabel("round trip").withTolerance(1e-3));
        assertThat(captured.entries()).containsExactly(
            new CapturingAppender.Entry(Level.WARN, "round trip -- Diff: 4.0"));
    }

    @Test
    void labelledDifferenceWithinToleranceIsLoggedAtInfo() {
        DiagnosticComparator.compare(new double[] {1, 2}, new double[] {1, 2},
            CompareOptions.defaults().withLabel("identity"));
        assertThat(captured.entries()).containsExactly(
            new CapturingAppender.Entry(Level.INFO, "identity -- Close enough."));
    }

    @Test
    void unlabelledMessagesHaveNoPrefix() {
        DiagnosticComparator.compare(new double[] {0}, new double[] {0});
        DiagnosticComparator.compare(new double[] {0}, new double[] {2});
        assertThat(captured.entries()).containsExactly(
            new CapturingAppender.Entry(Level.INFO, "Close enough."),
            new CapturingAppender.Entry(Level.WARN, "Diff: 2.0"));
    }

    @Test
    void quietComparisonLogsNothing() {
        CompareOptions quiet = CompareOptions.defaults().withLabel("silent").quiet();
        DiagnosticComparator.compare(new double[] {0}, new double[] {0}, quiet);
        DiagnosticComparator.compare(new double[] {0}, new double[] {2}, quiet);
        assertThat(captured.entries()).isEmpty();
    }

    @Test
    void inputsAreFlattenedBeforeComparing() {
        double d = DiagnosticComparator.compare(
            ShapedArray.matrix(new double[][] {{1, 2}, {3, 4}}),
            ShapedArray.vector(1, 2, 3, 5),
            CompareOptions.defaults().quiet());
        assertThat(d).isCloseTo(1.0, within(1e-15));
    }

    @Test
    void lengthOneSideBroadcasts() {
        double d = DiagnosticComparator.compare(new double[] {1, 2, 3}, new double[] {2},
            CompareOptions.defaults().quiet());
        assertThat(d).isCloseTo(2.0, within(1e-15));
    }

    @Test
    void sizeMismatchIsRejected() {
        assertThatThrownBy(() -> DiagnosticComparator.compare(new double[] {1, 2}, new double[] {1, 2, 3}))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void flattenedAxisZeroMatchesUnsetAxis() {
        double[] a = {1, 4, 9};
        double[] b = {1, 2, 3};
        CompareOptions quiet = CompareOptions.defaults().quiet();
        assertThat(DiagnosticComparator.compare(a, b, quiet.withAxis(0)))
            .isEqualTo(DiagnosticComparator.compare(a, b, quiet))
            .isEqualTo(DiagnosticComparator.compare(a, b, quiet.withAxis(-1)));
    }

    @Test
    void axisBeyondFlattenedRankIsRejected() {
        assertThatThrownBy(() -> DiagnosticComparator.compare(new double[] {1}, new double[] {1},
            CompareOptions.defaults().withAxis(1)))
            .isExactlyInstanceOf(SpatialShapeException.class);
    }

    @Test
    void nanDifferenceIsReturnedNotThrown() {
        assertThat(DiagnosticComparator.compare(new double[] {Double.NaN}, new double[] {0})).isNaN();
    }

    @Test
    void defaultsUseShippedTolerance() {
        CompareOptions defaults = CompareOptions.defaults();
        assertThat(defaults.tolerance()).isEqualTo(1e-6);
        assertThat(defaults.verbose()).isTrue();
        assertThat(defaults.label()).isNull();
        assertThat(defaults.axis()).isNull();
    }
}
