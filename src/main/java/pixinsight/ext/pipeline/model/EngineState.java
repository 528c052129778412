package pixinsight.ext.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one run, owned by the execution engine and handed to the
 * components that need it. Nothing here is shared between runs.
 */
public class EngineState {

    private final LiveImageRegistry registry;
    private String currentStepId;
    private final List<String> executedSteps = new ArrayList<>();
    private final List<String> skippedSteps = new ArrayList<>();
    private final List<String> disabledSteps = new ArrayList<>();
    private final List<String> failedSteps = new ArrayList<>();

    public EngineState() {
        this(new LiveImageRegistry());
    }

    public EngineState(LiveImageRegistry registry) {
        this.registry = registry;
    }

    public LiveImageRegistry getRegistry() {
        return registry;
    }

    public String getCurrentStepId() {
        return currentStepId;
    }

    public void setCurrentStepId(String currentStepId) {
        this.currentStepId = currentStepId;
    }

    public void markExecuted(String stepId) {
        executedSteps.add(stepId);
    }

    /** Step passed over because it lies before the restart point. */
    public void markSkipped(String stepId) {
        skippedSteps.add(stepId);
    }

    public void markDisabled(String stepId) {
        disabledSteps.add(stepId);
    }

    public void markFailed(String stepId) {
        failedSteps.add(stepId);
    }

    public List<String> getExecutedSteps() {
        return Collections.unmodifiableList(executedSteps);
    }

    public List<String> getSkippedSteps() {
        return Collections.unmodifiableList(skippedSteps);
    }

    public List<String> getDisabledSteps() {
        return Collections.unmodifiableList(disabledSteps);
    }

    public List<String> getFailedSteps() {
        return Collections.unmodifiableList(failedSteps);
    }
}
