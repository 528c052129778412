package pixinsight.ext.pipeline.controller;

/**
 * Engine memory crossed the abort threshold. When {@link #isCheckpointSaved()} is true the
 * live branches were checkpointed before {@link #getStepId()} and the run can be resumed with
 * {@code --restart-from <stepId>}; otherwise the run loop reports a plain failure.
 */
public class ResumableAbortException extends Exception {

    private final String stepId;
    private final long sampledBytes;
    private final boolean checkpointSaved;

    public ResumableAbortException(String stepId, long sampledBytes, boolean checkpointSaved) {
        super(String.format("Engine memory %.1f GiB at step '%s'%s", sampledBytes / (double) (1L << 30), stepId,
                checkpointSaved ? "; resume with --restart-from " + stepId : "; checkpoint could not be saved"));
        this.stepId = stepId;
        this.sampledBytes = sampledBytes;
        this.checkpointSaved = checkpointSaved;
    }

    public String getStepId() {
        return stepId;
    }

    public long getSampledBytes() {
        return sampledBytes;
    }

    public boolean isCheckpointSaved() {
        return checkpointSaved;
    }
}
