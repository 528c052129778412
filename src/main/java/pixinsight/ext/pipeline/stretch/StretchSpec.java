package pixinsight.ext.pipeline.stretch;

import pixinsight.ext.pipeline.config.StepParams;

/**
 * Parameters of one GHS pass.
 *
 * @param dLog stretch factor as {@code ln(D + 1)}
 * @param b    local intensity (-1 log, 0 exponential, otherwise power)
 * @param sp   symmetry point, null to use the current image median
 * @param lp   shadow protection point
 * @param hp   highlight protection point
 */
public record StretchSpec(double dLog, double b, Double sp, double lp, double hp) {

    /**
     * Reads a pass from parameters {@code D}, {@code B}, {@code SP}, {@code LP}, {@code HP};
     * B defaults to 0, LP to 0 and HP to 1.
     */
    public static StretchSpec from(StepParams params) {
        return new StretchSpec(
                params.getDouble("D", 0),
                params.getDouble("B", 0),
                params.getDouble("SP"),
                params.getDouble("LP", 0),
                params.getDouble("HP", 1));
    }

    public double symmetryPointOr(double median) {
        return sp != null ? sp : median;
    }
}
