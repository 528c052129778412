package pixinsight.ext.pipeline.controller;

/**
 * A condition that makes the run impossible: unresolvable inputs, ambiguous channel
 * identification, a missing restart checkpoint. Stops the run with status FAILED.
 */
public class PipelineSetupException extends RuntimeException {

    public PipelineSetupException(String message) {
        super(message);
    }

    public PipelineSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
