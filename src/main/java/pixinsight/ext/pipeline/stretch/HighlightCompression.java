package pixinsight.ext.pipeline.stretch;

import pixinsight.ext.pipeline.model.ImageStatistics;

import static pixinsight.ext.pipeline.stretch.ExpressionFormat.number;

/**
 * Soft-knee highlight compression with a cubic Hermite segment above the knee.
 *
 * <p>Inputs at or below the knee pass through. Above it, {@code t = (x-k)/(1-k)} is
 * mapped by {@code h10 + h01·ep + h11·m1}, starting with slope 1 at the knee and ending at
 * {@code ep = 1 - headroom} with slope {@code m1}. Grey images are compressed directly;
 * colour images are compressed on Rec.709 luminance and every channel is scaled by
 * {@code y(L)/L}, which keeps hue.</p>
 */
class HighlightCompression implements PixelTransform {

    private static final String SYMBOLS = "L,k,t,t2,t3,h10,h01,h11,m1,ep,f,y";

    private final double knee;
    private final double endSlope;
    private final double ceiling;

    HighlightCompression(double amount, double knee, double headroom) {
        this.knee = Math.min(0.999999, Math.max(0.1, knee));
        this.endSlope = Math.min(5, Math.max(1, 1 + 4 * amount));
        this.ceiling = 1 - headroom;
    }

    double curve(double x) {
        if (!(x > knee)) {
            return x;
        }
        double t = Math.min(1, Math.max(0, (x - knee) / (1 - knee)));
        double t2 = t * t;
        double t3 = t2 * t;
        double h10 = t3 - 2 * t2 + t;
        double h01 = -2 * t3 + 3 * t2;
        double h11 = t3 - t2;
        double f = h10 + h01 * ceiling + h11 * endSlope;
        return knee + (1 - knee) * Math.min(1, Math.max(0, f));
    }

    @Override
    public String name() {
        return "highlight-compression";
    }

    @Override
    public double apply(double value) {
        return curve(value);
    }

    @Override
    public double[] applyColor(double[] rgb) {
        double[] w = ImageStatistics.LUMINANCE_WEIGHTS;
        double lum = w[0] * rgb[0] + w[1] * rgb[1] + w[2] * rgb[2];
        if (!(lum > knee)) {
            return rgb.clone();
        }
        double ratio = curve(lum) / lum;
        return new double[]{rgb[0] * ratio, rgb[1] * ratio, rgb[2] * ratio};
    }

    @Override
    public boolean truncates() {
        return true;
    }

    @Override
    public String symbols() {
        return SYMBOLS;
    }

    @Override
    public String expression() {
        return body("$T") + "\niif(L>k, y, $T);";
    }

    @Override
    public String[] colorExpressions() {
        double[] w = ImageStatistics.LUMINANCE_WEIGHTS;
        String lum = number(w[0]) + "*$T[0]+" + number(w[1]) + "*$T[1]+" + number(w[2]) + "*$T[2]";
        String perChannel = body(lum) + "\niif(L>k, $T*y/L, $T);";
        return new String[]{perChannel, perChannel, perChannel};
    }

    private String body(String luminance) {
        return String.join("\n",
                "L = " + luminance + ";",
                "k = " + number(knee) + ";",
                "t = min(1, max(0, (L - k)/(1 - k)));",
                "t2 = t*t;",
                "t3 = t2*t;",
                "h10 = t3 - 2*t2 + t;",
                "h01 = -2*t3 + 3*t2;",
                "h11 = t3 - t2;",
                "m1 = " + number(endSlope) + ";",
                "ep = " + number(ceiling) + ";",
                "f = h10 + h01*ep + h11*m1;",
                "y = k + (1 - k)*min(1, max(0, f));");
    }

    @Override
    public String toString() {
        return String.format("highlight-compression[knee=%.4f, slope=%.2f, ceiling=%.4f]", knee, endSlope, ceiling);
    }
}
