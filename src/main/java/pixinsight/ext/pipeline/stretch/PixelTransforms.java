package pixinsight.ext.pipeline.stretch;

import static pixinsight.ext.pipeline.stretch.ExpressionFormat.number;

/**
 * Factories for the transforms the stretch procedures are built from.
 */
public final class PixelTransforms {

    private PixelTransforms() {
    }

    /**
     * Affine map sending {@code blackpoint} to 0 and {@code whitepoint} to 1, clamped so that
     * samples below the blackpoint never reach a later midtones transfer as negative values.
     */
    public static PixelTransform rescale(double blackpoint, double whitepoint) {
        if (!(whitepoint > blackpoint)) {
            throw new IllegalArgumentException("Whitepoint " + whitepoint + " must exceed blackpoint " + blackpoint);
        }
        double range = whitepoint - blackpoint;
        String expr = "($T-" + number(blackpoint) + ")/" + number(range);
        return new Simple("rescale", expr, true) {
            @Override
            public double apply(double x) {
                return (x - blackpoint) / range;
            }
        };
    }

    /**
     * Midtones transfer that sends {@code midtone} to {@code target} while fixing 0 and 1:
     * {@code y = ((m-1)·T·x) / (m·(T+x-1) - T·x)}.
     */
    public static PixelTransform midtones(double midtone, double target) {
        if (!(midtone > 0 && midtone < 1) || !(target > 0 && target < 1)) {
            throw new IllegalArgumentException("Midtone " + midtone + " and target " + target + " must be in (0,1)");
        }
        String m = number(midtone);
        String t = number(target);
        String expr = "((" + m + "-1)*" + t + "*$T)/(" + m + "*(" + t + "+$T-1)-" + t + "*$T)";
        return new Simple("midtones", expr, false) {
            @Override
            public double apply(double x) {
                return ((midtone - 1) * target * x) / (midtone * (target + x - 1) - target * x);
            }
        };
    }

    /**
     * Standard histogram transformation: clip shadows at {@code shadows}, then apply the
     * midtones balance {@code m} in the form {@code ((m-1)x) / ((2m-1)x - m)}.
     */
    public static PixelTransform histogram(double shadows, double midtone) {
        if (!(shadows >= 0 && shadows < 1) || !(midtone > 0 && midtone < 1)) {
            throw new IllegalArgumentException("Invalid histogram parameters c0=" + shadows + ", m=" + midtone);
        }
        String c0 = number(shadows);
        String m = number(midtone);
        String x = "max(0,($T-" + c0 + ")/(1-" + c0 + "))";
        String expr = "((" + m + "-1)*" + x + ")/((2*" + m + "-1)*" + x + "-" + m + ")";
        return new Simple("histogram", expr, true) {
            @Override
            public double apply(double v) {
                double xs = Math.max(0, (v - shadows) / (1 - shadows));
                return ((midtone - 1) * xs) / ((2 * midtone - 1) * xs - midtone);
            }
        };
    }

    /** Clamp to [0,1] without changing values inside the range. */
    public static PixelTransform truncate() {
        return new Simple("truncate", "$T", true) {
            @Override
            public double apply(double x) {
                return x;
            }
        };
    }

    /** Multiply by a constant and clamp; used to normalise by a measured maximum. */
    public static PixelTransform scale(double factor) {
        return new Simple("scale", "$T*" + number(factor), true) {
            @Override
            public double apply(double x) {
                return x * factor;
            }
        };
    }

    /**
     * Hermite soft-knee highlight compression.
     *
     * @param amount   end slope control, slope = clamp(1 + 4·amount, 1, 5)
     * @param knee     input level where compression starts, clamped to [0.1, 0.999999]
     * @param headroom output reserved below 1; the curve ends at {@code 1 - headroom}
     */
    public static PixelTransform highlightCompression(double amount, double knee, double headroom) {
        return new HighlightCompression(amount, knee, headroom);
    }

    /**
     * GHS segments rendered by {@link GeneralizedHyperbolicStretch#buildExpression}.
     */
    public static PixelTransform ghs(GhsCoefficients coefficients, String expression) {
        return new Simple("ghs", expression, true) {
            @Override
            public double apply(double x) {
                return coefficients.evaluate(x);
            }
        };
    }

    private abstract static class Simple implements PixelTransform {
        private final String name;
        private final String expression;
        private final boolean truncates;

        Simple(String name, String expression, boolean truncates) {
            this.name = name;
            this.expression = expression;
            this.truncates = truncates;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String expression() {
            return expression;
        }

        @Override
        public boolean truncates() {
            return truncates;
        }

        @Override
        public String toString() {
            return name + "[" + expression + "]";
        }
    }
}
