package pixinsight.ext.pipeline.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative pipeline definition: input files, branches and the ordered step list.
 *
 * <p>Loaded once per run by {@link PipelineConfigLoader} and never modified afterwards.
 * The {@code files} map holds one entry per input channel plus the two reserved keys
 * {@code outputDir} and {@code targetName}.</p>
 */
public class PipelineConfig {

    public static final String OUTPUT_DIR_KEY = "outputDir";
    public static final String TARGET_NAME_KEY = "targetName";

    private String version;
    private String name;
    private Map<String, String> files;
    private Map<String, BranchSpec> branches;
    private List<Step> steps;

    public PipelineConfig() {
    }

    public PipelineConfig(String name, Map<String, String> files, Map<String, BranchSpec> branches, List<Step> steps) {
        this.version = "1";
        this.name = name;
        this.files = files;
        this.branches = branches;
        this.steps = steps;
    }

    public String getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    /** Raw files map including the reserved keys. */
    public Map<String, String> getFiles() {
        return files == null ? Map.of() : Collections.unmodifiableMap(files);
    }

    /**
     * Input channels only (e.g. R, G, B, Ha), in declaration order, with blank entries dropped.
     */
    public Map<String, String> getChannelFiles() {
        Map<String, String> channels = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : getFiles().entrySet()) {
            String key = entry.getKey();
            if (OUTPUT_DIR_KEY.equals(key) || TARGET_NAME_KEY.equals(key)) {
                continue;
            }
            if (entry.getValue() != null && !entry.getValue().isBlank()) {
                channels.put(key, entry.getValue());
            }
        }
        return channels;
    }

    public String getOutputDir() {
        return getFiles().get(OUTPUT_DIR_KEY);
    }

    public String getTargetName() {
        return getFiles().get(TARGET_NAME_KEY);
    }

    public Map<String, BranchSpec> getBranches() {
        return branches == null ? Map.of() : Collections.unmodifiableMap(branches);
    }

    public List<Step> getSteps() {
        return steps == null ? List.of() : Collections.unmodifiableList(steps);
    }

    /**
     * @return position of the step in the list, or -1
     */
    public int indexOf(String stepId) {
        List<Step> list = getSteps();
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getId().equals(stepId)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Step> findStep(String stepId) {
        int index = indexOf(stepId);
        return index < 0 ? Optional.empty() : Optional.of(getSteps().get(index));
    }

    /**
     * Branches that fork right after the given step.
     */
    public List<String> branchesForkingAfter(String stepId) {
        return getBranches().entrySet().stream()
                .filter(e -> e.getValue() != null && stepId.equals(e.getValue().getForkAfterStepId()))
                .map(Map.Entry::getKey)
                .toList();
    }
}
