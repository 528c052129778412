package pixinsight.ext.pipeline.stretch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionFormatTest {

    @Test
    @DisplayName("Numbers are rendered with at most 12 decimals and no trailing zeros")
    void testNumber() {
        assertEquals("0.25", ExpressionFormat.number(0.25));
        assertEquals("1.0", ExpressionFormat.number(1));
        assertEquals("0.0", ExpressionFormat.number(0));
        assertEquals("0.333333333333", ExpressionFormat.number(1.0 / 3));
        assertEquals("0.0", ExpressionFormat.number(1e-15));
    }

    @Test
    @DisplayName("Negative numbers are parenthesised")
    void testNegative() {
        assertEquals("(-0.5)", ExpressionFormat.number(-0.5));
        assertEquals("0.0", ExpressionFormat.number(-0.0));
    }

    @Test
    @DisplayName("Non-finite values make an expression undispatchable")
    void testNonFinite() {
        String bad = "$T*" + ExpressionFormat.number(Double.NaN);
        assertFalse(ExpressionFormat.isDispatchable(bad));
        assertFalse(ExpressionFormat.isDispatchable("$T+" + ExpressionFormat.number(Double.NEGATIVE_INFINITY)));
        assertFalse(ExpressionFormat.isDispatchable(null));
        assertTrue(ExpressionFormat.isDispatchable("$T*" + ExpressionFormat.number(2.5)));
    }
}
