package pixinsight.ext.pipeline.stretch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coefficient derivation, expression rendering and the Java-side evaluator of the
 * generalized hyperbolic stretch.
 */
class GeneralizedHyperbolicStretchTest {

    private static final double PIVOT_EPSILON = 1e-9;

    // ==================== Shape of the curve ====================

    @ParameterizedTest(name = "D_log={0} B={1} SP={2} LP={3} HP={4}")
    @CsvSource({
            "2.0, -1.0, 0.20, 0.00, 1.00",
            "2.0, -1.0, 0.20, 0.05, 0.90",
            "3.0,  0.0, 0.15, 0.00, 1.00",
            "3.0,  0.0, 0.15, 0.02, 0.85",
            "1.5, -0.5, 0.30, 0.10, 0.95",
            "4.0,  2.0, 0.10, 0.00, 1.00",
            "4.0,  2.0, 0.10, 0.05, 0.80",
            "0.7,  8.0, 0.50, 0.25, 0.75"
    })
    @DisplayName("Curve runs from 0 to 1, is continuous at every pivot and never decreases")
    void testContinuousAndMonotonic(double dLog, double b, double sp, double lp, double hp) {
        GhsDerivation derivation = GeneralizedHyperbolicStretch.deriveCoefficients(dLog, b, sp, lp, hp);
        assertEquals(GhsDerivation.Status.VALID, derivation.getStatus(), derivation.toString());
        GhsCoefficients c = derivation.getCoefficients();
        assertTrue(c.isFinite());

        assertEquals(0.0, c.evaluate(0.0), 1e-9);
        assertEquals(1.0, c.evaluate(1.0), 1e-9);

        for (double pivot : new double[]{lp, sp, hp}) {
            if (pivot <= 0 || pivot >= 1) {
                continue;
            }
            assertEquals(c.evaluate(pivot - PIVOT_EPSILON), c.evaluate(pivot), 1e-6,
                    "discontinuity at pivot " + pivot);
        }

        double previous = c.evaluate(0.0);
        for (int i = 1; i <= 1000; i++) {
            double y = c.evaluate(i / 1000.0);
            assertTrue(y >= previous - 1e-12, "curve decreases at x=" + i / 1000.0);
            previous = y;
        }
    }

    @Test
    @DisplayName("A positive stretch lifts the symmetry point region")
    void testStretchBrightensShadows() {
        GhsCoefficients c = GeneralizedHyperbolicStretch.deriveCoefficients(3.0, 0.0, 0.1, 0.0, 1.0).getCoefficients();
        assertTrue(c.evaluate(0.1) > 0.1);
    }

    // ==================== Validation ====================

    @ParameterizedTest(name = "SP={0} LP={1} HP={2}")
    @CsvSource({
            "0.5, 0.0, 0.5",
            "0.5, 0.0, 0.4",
            "0.2, 0.2, 1.0",
            "0.2, 0.3, 1.0",
            "0.2, -0.1, 1.0",
            "0.2, 0.0, 1.1"
    })
    @DisplayName("Bad pivots give an INVALID derivation instead of throwing")
    void testInvalidPivots(double sp, double lp, double hp) {
        GhsDerivation derivation = assertDoesNotThrow(
                () -> GeneralizedHyperbolicStretch.deriveCoefficients(2.0, 0.0, sp, lp, hp));
        assertEquals(GhsDerivation.Status.INVALID, derivation.getStatus());
        assertFalse(derivation.isValid());
        assertNotNull(derivation.getReason());
        assertThrows(IllegalStateException.class, derivation::toTransform);
    }

    @Test
    @DisplayName("Non-finite and negative stretch factors are rejected")
    void testNonFiniteAndNegative() {
        assertEquals(GhsDerivation.Status.INVALID,
                GeneralizedHyperbolicStretch.deriveCoefficients(Double.NaN, 0, 0.2, 0, 1).getStatus());
        assertEquals(GhsDerivation.Status.INVALID,
                GeneralizedHyperbolicStretch.deriveCoefficients(-1, 0, 0.2, 0, 1).getStatus());
    }

    @Test
    @DisplayName("D = 0 is the identity")
    void testIdentity() {
        GhsDerivation derivation = GeneralizedHyperbolicStretch.deriveCoefficients(0.0, 0.0, 0.2, 0.0, 1.0);
        assertEquals(GhsDerivation.Status.IDENTITY, derivation.getStatus());
    }

    @Test
    @DisplayName("A stretch factor that overflows is never rendered for dispatch")
    void testOverflowNotDispatched() {
        GhsDerivation derivation = GeneralizedHyperbolicStretch.prepare(new StretchSpec(800, 0, 0.2, 0, 1), 0.1);
        assertEquals(GhsDerivation.Status.INVALID, derivation.getStatus());
        assertNull(derivation.getExpression());
    }

    // ==================== Rendering ====================

    @Test
    @DisplayName("LP and HP branches are omitted when LP is 0 and HP is 1")
    void testExpressionOmitsUnusedBranches() {
        GhsDerivation full = GeneralizedHyperbolicStretch.prepare(new StretchSpec(2.0, 0.0, 0.2, 0.0, 1.0), 0.1);
        assertTrue(full.isValid());
        String expression = full.getExpression();
        assertTrue(expression.startsWith("iif($T<0.2,"), expression);
        assertFalse(expression.contains("iif($T<0.0,"), expression);
        assertFalse(expression.contains("iif($T<1.0,"), expression);
        assertEquals(1, expression.split("iif\\(", -1).length - 1);

        GhsDerivation bounded = GeneralizedHyperbolicStretch.prepare(new StretchSpec(2.0, 0.0, 0.2, 0.05, 0.9), 0.1);
        String nested = bounded.getExpression();
        assertTrue(nested.startsWith("iif($T<0.05,"), nested);
        assertTrue(nested.contains("iif($T<0.2,"), nested);
        assertTrue(nested.contains("iif($T<0.9,"), nested);
    }

    @Test
    @DisplayName("Regime selects ln, exp or power segments")
    void testRegimeFunctions() {
        assertTrue(GeneralizedHyperbolicStretch.prepare(new StretchSpec(2, -1, 0.2, 0, 1), 0).getExpression().contains("ln("));
        assertTrue(GeneralizedHyperbolicStretch.prepare(new StretchSpec(2, 0, 0.2, 0, 1), 0).getExpression().contains("exp("));
        String power = GeneralizedHyperbolicStretch.prepare(new StretchSpec(2, 1.5, 0.2, 0, 1), 0).getExpression();
        assertTrue(power.contains("exp(") && power.contains("*ln("), power);
    }

    @Test
    @DisplayName("Unset symmetry point uses the current median")
    void testSymmetryPointDefaultsToMedian() {
        GhsDerivation derivation = GeneralizedHyperbolicStretch.prepare(new StretchSpec(2, 0, null, 0, 1), 0.137);
        assertTrue(derivation.isValid());
        assertEquals(0.137, derivation.getCoefficients().sp(), 0.0);
        assertTrue(derivation.getExpression().startsWith("iif($T<0.137,"));
    }

    @Test
    @DisplayName("Rendered transform evaluates like the coefficients")
    void testTransformMatchesEvaluator() {
        GhsDerivation derivation = GeneralizedHyperbolicStretch.prepare(new StretchSpec(2.5, 0.5, 0.15, 0.02, 0.9), 0);
        PixelTransform transform = derivation.toTransform();
        assertTrue(transform.truncates());
        assertEquals(derivation.getExpression(), transform.expression());
        for (double x = 0; x <= 1.0; x += 0.05) {
            assertEquals(derivation.getCoefficients().evaluate(x), transform.apply(x), 0.0);
        }
    }
}
