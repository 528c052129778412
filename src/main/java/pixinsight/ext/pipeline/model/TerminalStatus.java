package pixinsight.ext.pipeline.model;

/**
 * How a pipeline run ended, with the process exit code for each outcome.
 */
public enum TerminalStatus {
    /** All steps were attempted (individual steps may have warned). */
    COMPLETED(0),
    /** A setup or configuration error stopped the run. */
    FAILED(1),
    /** Memory pressure stopped the run after a checkpoint was written. */
    ABORTED_RESUMABLE(2);

    private final int exitCode;

    TerminalStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
