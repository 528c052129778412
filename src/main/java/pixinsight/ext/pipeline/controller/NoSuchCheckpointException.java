package pixinsight.ext.pipeline.controller;

/**
 * A restart was requested from a step that has no checkpoint on disk.
 */
public class NoSuchCheckpointException extends PipelineSetupException {

    private final String stepId;

    public NoSuchCheckpointException(String stepId, String location) {
        super("No checkpoint for step '" + stepId + "' in " + location);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
