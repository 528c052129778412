package pixinsight.ext.pipeline.config;

/**
 * Declaration of a secondary working image.
 */
public class BranchSpec {

    private String label;
    private String forkAfterStepId;

    public BranchSpec() {
    }

    public BranchSpec(String label, String forkAfterStepId) {
        this.label = label;
        this.forkAfterStepId = forkAfterStepId;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Step after which the branch image is created, or null if a handler forks it
     * on its own (e.g. star removal).
     */
    public String getForkAfterStepId() {
        return forkAfterStepId;
    }
}
