package pixinsight.ext.pipeline.model;

import java.util.List;

/**
 * Result of one pipeline run.
 *
 * @param status        terminal status
 * @param stepId        step the run stopped at (the resume point for
 *                      {@link TerminalStatus#ABORTED_RESUMABLE}), null on completion
 * @param message       human readable summary
 * @param executedSteps steps whose handler completed
 * @param failedSteps   steps whose handler failed and were treated as no-ops
 */
public record RunOutcome(TerminalStatus status, String stepId, String message,
                         List<String> executedSteps, List<String> failedSteps) {

    public RunOutcome {
        executedSteps = executedSteps == null ? List.of() : List.copyOf(executedSteps);
        failedSteps = failedSteps == null ? List.of() : List.copyOf(failedSteps);
    }

    public static RunOutcome completed(List<String> executed, List<String> failed) {
        String message = failed.isEmpty()
                ? "Pipeline completed (" + executed.size() + " steps)"
                : "Pipeline completed with " + failed.size() + " failed step(s): " + failed;
        return new RunOutcome(TerminalStatus.COMPLETED, null, message, executed, failed);
    }

    public static RunOutcome failed(String stepId, String message, List<String> executed, List<String> failed) {
        return new RunOutcome(TerminalStatus.FAILED, stepId, message, executed, failed);
    }

    public static RunOutcome aborted(String stepId, String message, List<String> executed, List<String> failed) {
        return new RunOutcome(TerminalStatus.ABORTED_RESUMABLE, stepId, message, executed, failed);
    }

    public int exitCode() {
        return status.getExitCode();
    }
}
