package pixinsight.ext.pipeline.stretch;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number rendering for PixelMath expressions.
 */
public final class ExpressionFormat {

    private ExpressionFormat() {
    }

    /**
     * Fixed 12-decimal rendering with trailing zeros trimmed (keeping one decimal), negative
     * values wrapped in parentheses. Non-finite values are rendered as {@code NaN},
     * {@code Infinity} or {@code -Infinity} so that {@link #isDispatchable(String)} catches them.
     */
    public static String number(double v) {
        if (Double.isNaN(v)) {
            return "NaN";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "Infinity" : "(-Infinity)";
        }
        String s = BigDecimal.valueOf(v).setScale(12, RoundingMode.HALF_UP).toPlainString();
        s = s.replaceAll("(\\.\\d*?)0+$", "$1");
        if (s.endsWith(".")) {
            s = s + "0";
        }
        if (s.equals("-0.0")) {
            s = "0.0";
        }
        return v < 0 && !s.equals("0.0") ? "(" + s + ")" : s;
    }

    /**
     * True unless the expression contains a non-finite literal.
     */
    public static boolean isDispatchable(String expression) {
        return expression != null && !expression.contains("NaN") && !expression.contains("Infinity");
    }
}
