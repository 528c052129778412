package pixinsight.ext.pipeline.stretch;

/**
 * Segment coefficients of a generalized hyperbolic stretch.
 *
 * <p>The curve has four segments over [0,LP), [LP,SP), [SP,HP) and [HP,1]:</p>
 * <ul>
 *   <li>segment 1 and 4 are linear: {@code a + b·x}</li>
 *   <li>segments 2 and 3 are {@code a + b·ln(c + d·x)} ({@link Type#LOG}),
 *       {@code a + b·exp(c + d·x)} ({@link Type#EXP}), or
 *       {@code a + b·(c + d·x)^e} ({@link Type#POW})</li>
 * </ul>
 */
public record GhsCoefficients(Type type,
                              double a1, double b1,
                              double a2, double b2, double c2, double d2, double e2,
                              double a3, double b3, double c3, double d3, double e3,
                              double a4, double b4,
                              double lp, double sp, double hp) {

    public enum Type {
        LOG, EXP, POW
    }

    /**
     * Evaluates the curve the way the rendered expression does, including which segment
     * boundaries exist.
     */
    public double evaluate(double x) {
        if (lp > 0 && x < lp) {
            return a1 + b1 * x;
        }
        if (lp < sp && x < sp) {
            return segment(a2, b2, c2, d2, e2, x);
        }
        if (hp < 1 && x >= hp) {
            return a4 + b4 * x;
        }
        return segment(a3, b3, c3, d3, e3, x);
    }

    private double segment(double a, double b, double c, double d, double e, double x) {
        return switch (type) {
            case LOG -> a + b * Math.log(c + d * x);
            case EXP -> a + b * Math.exp(c + d * x);
            case POW -> a + b * Math.exp(e * Math.log(c + d * x));
        };
    }

    /** True if every coefficient is a finite number. */
    public boolean isFinite() {
        double[] all = {a1, b1, a2, b2, c2, d2, e2, a3, b3, c3, d3, e3, a4, b4};
        for (double v : all) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
