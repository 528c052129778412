package pixinsight.ext.pipeline.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a pipeline definition from JSON and validates it before any engine call is made.
 *
 * <p>Validation collects every problem instead of stopping at the first one:</p>
 * <ul>
 *   <li>missing or duplicate step ids</li>
 *   <li>steps on, or merging, branches that are not declared</li>
 *   <li>fork points naming unknown steps</li>
 *   <li>steps no handler serves</li>
 *   <li>parameters violating the handler's schema</li>
 * </ul>
 */
public class PipelineConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    private final Gson gson = new GsonBuilder().create();
    private final SchemaResolver schemas;

    /**
     * @param schemas resolves each step to its handler's schema
     */
    public PipelineConfigLoader(SchemaResolver schemas) {
        this.schemas = schemas;
    }

    public PipelineConfig load(Path path) throws IOException {
        logger.info("Loading pipeline config from {}", path);
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws PipelineConfigurationException if the document is malformed or fails validation
     */
    public PipelineConfig parse(String json) {
        PipelineConfig config;
        try {
            config = gson.fromJson(json, PipelineConfig.class);
        } catch (JsonParseException e) {
            throw new PipelineConfigurationException("Pipeline config is not valid JSON: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new PipelineConfigurationException("Pipeline config is empty");
        }
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            logger.error("Pipeline config validation failed: {}", problems);
            throw new PipelineConfigurationException(
                    "Pipeline config has " + problems.size() + " problem(s): " + String.join("; ", problems), problems);
        }
        logger.info("Pipeline '{}' loaded: {} steps, {} branches",
                config.getName(), config.getSteps().size(), config.getBranches().size());
        return config;
    }

    public List<String> validate(PipelineConfig config) {
        List<String> problems = new ArrayList<>();
        if (config.getSteps().isEmpty()) {
            problems.add("no steps defined");
        }

        Set<String> branchIds = new HashSet<>(config.getBranches().keySet());
        branchIds.add(Step.MAIN_BRANCH);

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < config.getSteps().size(); i++) {
            Step step = config.getSteps().get(i);
            if (step == null) {
                problems.add("step #" + i + " is null");
                continue;
            }
            if (step.getId() == null || step.getId().isBlank()) {
                problems.add("step #" + i + " has no id");
                continue;
            }
            String where = "step '" + step.getId() + "': ";
            if (!seen.add(step.getId())) {
                problems.add(where + "duplicate id");
            }
            if (!branchIds.contains(step.getBranchId())) {
                problems.add(where + "unknown branch '" + step.getBranchId() + "'");
            }
            for (String merged : step.getMerges()) {
                if (!branchIds.contains(merged)) {
                    problems.add(where + "merges undeclared branch '" + merged + "'");
                } else if (Step.MAIN_BRANCH.equals(merged)) {
                    problems.add(where + "cannot merge the main branch");
                }
            }

            Optional<ParamSchema> schema = schemas.schemaFor(step);
            if (schema.isEmpty()) {
                problems.add(where + "no handler for kind '" + step.getKind() + "'");
            } else {
                for (String problem : schema.get().validate(step.getParams())) {
                    problems.add(where + problem);
                }
            }
        }

        config.getBranches().forEach((id, spec) -> {
            if (spec == null) {
                problems.add("branch '" + id + "' has no definition");
            } else if (spec.getForkAfterStepId() != null && !seen.contains(spec.getForkAfterStepId())) {
                problems.add("branch '" + id + "' forks after unknown step '" + spec.getForkAfterStepId() + "'");
            }
        });
        return problems;
    }
}
