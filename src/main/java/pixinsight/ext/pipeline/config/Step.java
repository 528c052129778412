package pixinsight.ext.pipeline.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the pipeline step list, as read from the config JSON.
 *
 * <p>Fields are left null when absent from the document; the getters apply the
 * defaults (enabled, branch {@code main}, kind = id).</p>
 */
public class Step {

    public static final String MAIN_BRANCH = "main";

    private String id;
    private String label;
    private String branchId;
    private Boolean enabled;
    private String kind;
    private Map<String, Object> params;
    private List<String> merges;
    private Boolean checkpoint;

    public Step() {
    }

    public Step(String id, String kind, Map<String, Object> params) {
        this.id = id;
        this.kind = kind;
        this.params = params == null ? null : new LinkedHashMap<>(params);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label != null ? label : id;
    }

    public String getBranchId() {
        return branchId != null ? branchId : MAIN_BRANCH;
    }

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    /**
     * Handler kind. Falls back to the step id, which the handler registry matches by prefix.
     */
    public String getKind() {
        return kind != null && !kind.isBlank() ? kind : id;
    }

    public boolean hasExplicitKind() {
        return kind != null && !kind.isBlank();
    }

    public StepParams getParams() {
        return new StepParams(params == null ? Collections.emptyMap() : params);
    }

    public List<String> getMerges() {
        return merges == null ? List.of() : Collections.unmodifiableList(merges);
    }

    /**
     * Explicit checkpoint flag: TRUE forces, FALSE suppresses, null defers to the default set.
     */
    public Boolean getCheckpoint() {
        return checkpoint;
    }

    public Step withEnabled(boolean enabled) {
        Step copy = copy();
        copy.enabled = enabled;
        return copy;
    }

    public Step withCheckpoint(Boolean checkpoint) {
        Step copy = copy();
        copy.checkpoint = checkpoint;
        return copy;
    }

    public Step withBranch(String branchId) {
        Step copy = copy();
        copy.branchId = branchId;
        return copy;
    }

    public Step withMerges(List<String> merges) {
        Step copy = copy();
        copy.merges = merges == null ? null : List.copyOf(merges);
        return copy;
    }

    private Step copy() {
        Step copy = new Step(id, kind, params);
        copy.label = label;
        copy.branchId = branchId;
        copy.enabled = enabled;
        copy.merges = merges;
        copy.checkpoint = checkpoint;
        return copy;
    }

    @Override
    public String toString() {
        return id + (branchId != null ? "@" + branchId : "");
    }
}
