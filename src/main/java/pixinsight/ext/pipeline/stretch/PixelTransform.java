package pixinsight.ext.pipeline.stretch;

/**
 * A per-pixel intensity mapping that can be rendered as a PixelMath expression and
 * evaluated on the Java side.
 *
 * <p>The rendered expression refers to the current sample as {@code $T}; it may use
 * intermediate variables, declared by {@link #symbols()}. When {@link #truncates()} is
 * true the engine clamps results to [0, 1].</p>
 */
public interface PixelTransform {

    /** Short name used in logs. */
    String name();

    /** Expression applied to every channel. */
    String expression();

    /** Evaluates the mapping for one sample, before truncation. */
    double apply(double value);

    /** Comma separated PixelMath symbols the expression declares, or null. */
    default String symbols() {
        return null;
    }

    default boolean truncates() {
        return false;
    }

    /**
     * Per-channel expressions for RGB images, or null when {@link #expression()} is applied
     * to each channel independently.
     */
    default String[] colorExpressions() {
        return null;
    }

    /**
     * Evaluates the mapping for one RGB pixel. The default applies {@link #apply(double)} per channel.
     */
    default double[] applyColor(double[] rgb) {
        double[] out = new double[rgb.length];
        for (int c = 0; c < rgb.length; c++) {
            out[c] = apply(rgb[c]);
        }
        return out;
    }
}
