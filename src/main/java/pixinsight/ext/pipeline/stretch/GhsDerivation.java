package pixinsight.ext.pipeline.stretch;

/**
 * Outcome of preparing a GHS pass. Never an exception: invalid passes are skipped by the caller.
 */
public final class GhsDerivation {

    public enum Status {
        /** Coefficients (and, once rendered, an expression) are available. */
        VALID,
        /** D is zero; the pass would not change the image. */
        IDENTITY,
        /** The pass must not be dispatched; see {@link #getReason()}. */
        INVALID
    }

    private final Status status;
    private final GhsCoefficients coefficients;
    private final String expression;
    private final String reason;

    private GhsDerivation(Status status, GhsCoefficients coefficients, String expression, String reason) {
        this.status = status;
        this.coefficients = coefficients;
        this.expression = expression;
        this.reason = reason;
    }

    static GhsDerivation valid(GhsCoefficients coefficients) {
        return new GhsDerivation(Status.VALID, coefficients, null, null);
    }

    static GhsDerivation identity() {
        return new GhsDerivation(Status.IDENTITY, null, null, "D = 0");
    }

    static GhsDerivation invalid(String reason) {
        return new GhsDerivation(Status.INVALID, null, null, reason);
    }

    GhsDerivation withExpression(String expression) {
        return new GhsDerivation(status, coefficients, expression, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    /** Null unless VALID. */
    public GhsCoefficients getCoefficients() {
        return coefficients;
    }

    /** Rendered PixelMath expression; null until rendered or when not VALID. */
    public String getExpression() {
        return expression;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Transform for a VALID, rendered derivation.
     *
     * @throws IllegalStateException otherwise
     */
    public PixelTransform toTransform() {
        if (status != Status.VALID || expression == null) {
            throw new IllegalStateException("No dispatchable GHS transform: " + status + " " + reason);
        }
        return PixelTransforms.ghs(coefficients, expression);
    }

    @Override
    public String toString() {
        return status + (reason != null ? " (" + reason + ")" : "");
    }
}
