package pixinsight.ext.pipeline.stretch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static pixinsight.ext.pipeline.stretch.ExpressionFormat.number;

/**
 * Generalized hyperbolic stretch: coefficient derivation and PixelMath rendering.
 *
 * <p>The curve is built from the stretch factor {@code D = exp(D_log) - 1}, the local
 * intensity {@code B}, and three pivots {@code LP < SP < HP}. Four regimes are supported:
 * {@code B = -1} (logarithmic), {@code B = 0} (exponential), {@code B < 0} and
 * {@code B > 0} (power). All are normalised by {@code q = 1/(q1 - q0)} so that the curve
 * runs from 0 to 1, and the segments meet continuously at the pivots.</p>
 *
 * <h3>Failure handling</h3>
 * <p>Nothing here throws on bad input: an invalid pass comes back as an
 * {@link GhsDerivation.Status#INVALID} derivation with a reason, and {@code D = 0} comes
 * back as an identity derivation the caller skips.</p>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * GhsDerivation pass = GeneralizedHyperbolicStretch.prepare(spec, stats.getMedian());
 * if (pass.isValid()) {
 *     engine.applyTransform(handle, pass.toTransform());
 * } else {
 *     logger.warn("GHS pass skipped: {}", pass.getReason());
 * }
 * }</pre>
 *
 * @since 0.2.0
 */
public final class GeneralizedHyperbolicStretch {
    private static final Logger logger = LoggerFactory.getLogger(GeneralizedHyperbolicStretch.class);

    private GeneralizedHyperbolicStretch() {
    }

    /**
     * Derives segment coefficients.
     *
     * @param dLog stretch factor, {@code ln(D + 1)}
     * @param b    local intensity
     * @param sp   symmetry point
     * @param lp   shadow protection point
     * @param hp   highlight protection point
     */
    public static GhsDerivation deriveCoefficients(double dLog, double b, double sp, double lp, double hp) {
        if (!Double.isFinite(dLog) || !Double.isFinite(b) || !Double.isFinite(sp)
                || !Double.isFinite(lp) || !Double.isFinite(hp)) {
            return GhsDerivation.invalid("non-finite parameter");
        }
        if (dLog < 0) {
            return GhsDerivation.invalid("D must not be negative (D_log=" + dLog + ")");
        }
        if (lp < 0 || hp > 1) {
            return GhsDerivation.invalid("pivots outside [0,1]: LP=" + lp + ", HP=" + hp);
        }
        if (hp <= sp) {
            return GhsDerivation.invalid("HP (" + hp + ") must be above SP (" + sp + ")");
        }
        if (lp >= sp) {
            return GhsDerivation.invalid("LP (" + lp + ") must be below SP (" + sp + ")");
        }

        double d = Math.exp(dLog) - 1.0;
        if (d == 0) {
            return GhsDerivation.identity();
        }

        GhsCoefficients c;
        if (b == -1) {
            c = logarithmic(d, sp, lp, hp);
        } else if (b == 0) {
            c = exponential(d, sp, lp, hp);
        } else if (b < 0) {
            c = negativePower(d, -b, sp, lp, hp);
        } else {
            c = positivePower(d, b, sp, lp, hp);
        }
        return GhsDerivation.valid(c);
    }

    private static GhsCoefficients logarithmic(double d, double sp, double lp, double hp) {
        double qlp = -Math.log(1 + d * (sp - lp));
        double q0 = qlp - d * lp / (1 + d * (sp - lp));
        double qwp = Math.log(1 + d * (hp - sp));
        double q1 = qwp + d * (1 - hp) / (1 + d * (hp - sp));
        double q = 1 / (q1 - q0);
        return new GhsCoefficients(GhsCoefficients.Type.LOG,
                0, d / (1 + d * (sp - lp)) * q,
                -q0 * q, -q, 1 + d * sp, -d, 0,
                -q0 * q, q, 1 - d * sp, d, 0,
                (qwp - q0 - d * hp / (1 + d * (hp - sp))) * q, q * d / (1 + d * (hp - sp)),
                lp, sp, hp);
    }

    private static GhsCoefficients exponential(double d, double sp, double lp, double hp) {
        double qlp = Math.exp(-d * (sp - lp));
        double q0 = qlp - d * lp * Math.exp(-d * (sp - lp));
        double qwp = 2 - Math.exp(-d * (hp - sp));
        double q1 = qwp + d * (1 - hp) * Math.exp(-d * (hp - sp));
        double q = 1 / (q1 - q0);
        return new GhsCoefficients(GhsCoefficients.Type.EXP,
                0, d * Math.exp(-d * (sp - lp)) * q,
                -q0 * q, q, -d * sp, d, 0,
                (2 - q0) * q, -q, d * sp, -d, 0,
                (qwp - q0 - d * hp * Math.exp(-d * (hp - sp))) * q, d * Math.exp(-d * (hp - sp)) * q,
                lp, sp, hp);
    }

    private static GhsCoefficients negativePower(double d, double ab, double sp, double lp, double hp) {
        double qlp = (1 - Math.pow(1 + d * ab * (sp - lp), (ab - 1) / ab)) / (ab - 1);
        double q0 = qlp - d * lp * Math.pow(1 + d * ab * (sp - lp), -1 / ab);
        double qwp = (Math.pow(1 + d * ab * (hp - sp), (ab - 1) / ab) - 1) / (ab - 1);
        double q1 = qwp + d * (1 - hp) * Math.pow(1 + d * ab * (hp - sp), -1 / ab);
        double q = 1 / (q1 - q0);
        return new GhsCoefficients(GhsCoefficients.Type.POW,
                0, d * Math.pow(1 + d * ab * (sp - lp), -1 / ab) * q,
                (1 / (ab - 1) - q0) * q, -q / (ab - 1), 1 + d * ab * sp, -d * ab, (ab - 1) / ab,
                (-1 / (ab - 1) - q0) * q, q / (ab - 1), 1 - d * ab * sp, d * ab, (ab - 1) / ab,
                (qwp - q0 - d * hp * Math.pow(1 + d * ab * (hp - sp), -1 / ab)) * q,
                d * Math.pow(1 + d * ab * (hp - sp), -1 / ab) * q,
                lp, sp, hp);
    }

    private static GhsCoefficients positivePower(double d, double b, double sp, double lp, double hp) {
        double qlp = Math.pow(1 + d * b * (sp - lp), -1 / b);
        double q0 = qlp - d * lp * Math.pow(1 + d * b * (sp - lp), -(1 + b) / b);
        double qwp = 2 - Math.pow(1 + d * b * (hp - sp), -1 / b);
        double q1 = qwp + d * (1 - hp) * Math.pow(1 + d * b * (hp - sp), -(1 + b) / b);
        double q = 1 / (q1 - q0);
        return new GhsCoefficients(GhsCoefficients.Type.POW,
                0, d * Math.pow(1 + d * b * (sp - lp), -(1 + b) / b) * q,
                -q0 * q, q, 1 + d * b * sp, -d * b, -1 / b,
                (2 - q0) * q, -q, 1 - d * b * sp, d * b, -1 / b,
                (qwp - q0 - d * hp * Math.pow(1 + d * b * (hp - sp), -(b + 1) / b)) * q,
                d * Math.pow(1 + d * b * (hp - sp), -(b + 1) / b) * q,
                lp, sp, hp);
    }

    /**
     * Renders the nested PixelMath expression. The LP branch is omitted when LP is 0 and the
     * HP branch when HP is 1.
     */
    public static String buildExpression(GhsCoefficients c) {
        String e1 = number(c.a1()) + "+" + number(c.b1()) + "*$T";
        String e4 = number(c.a4()) + "+" + number(c.b4()) + "*$T";
        String e2 = segment(c.type(), c.a2(), c.b2(), c.c2(), c.d2(), c.e2());
        String e3 = segment(c.type(), c.a3(), c.b3(), c.c3(), c.d3(), c.e3());

        String result = e3;
        if (c.hp() < 1.0) {
            result = "iif($T<" + number(c.hp()) + "," + e3 + "," + e4 + ")";
        }
        if (c.lp() < c.sp()) {
            result = "iif($T<" + number(c.sp()) + "," + e2 + "," + result + ")";
        }
        if (c.lp() > 0.0) {
            result = "iif($T<" + number(c.lp()) + "," + e1 + "," + result + ")";
        }
        return result;
    }

    private static String segment(GhsCoefficients.Type type, double a, double b, double c, double d, double e) {
        String inner = number(c) + "+" + number(d) + "*$T";
        return switch (type) {
            case LOG -> number(a) + "+" + number(b) + "*ln(" + inner + ")";
            case EXP -> number(a) + "+" + number(b) + "*exp(" + inner + ")";
            case POW -> number(a) + "+" + number(b) + "*exp(" + number(e) + "*ln(" + inner + "))";
        };
    }

    /**
     * Derives and renders a pass, resolving an unset symmetry point to the current median.
     * The result is VALID only if the rendered expression is safe to dispatch.
     */
    public static GhsDerivation prepare(StretchSpec spec, double currentMedian) {
        double sp = spec.symmetryPointOr(currentMedian);
        GhsDerivation derivation = deriveCoefficients(spec.dLog(), spec.b(), sp, spec.lp(), spec.hp());
        if (!derivation.isValid()) {
            logger.debug("GHS D_log={} B={} SP={} LP={} HP={}: {}",
                    spec.dLog(), spec.b(), sp, spec.lp(), spec.hp(), derivation);
            return derivation;
        }
        String expression = buildExpression(derivation.getCoefficients());
        if (!ExpressionFormat.isDispatchable(expression)) {
            return GhsDerivation.invalid("non-finite value in rendered expression (D_log=" + spec.dLog() + ")");
        }
        return derivation.withExpression(expression);
    }
}
