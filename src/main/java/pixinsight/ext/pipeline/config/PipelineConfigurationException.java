package pixinsight.ext.pipeline.config;

import java.util.List;

/**
 * Fatal problem with the pipeline definition. Carries every problem found, not just the first.
 */
public class PipelineConfigurationException extends RuntimeException {

    private final List<String> problems;

    public PipelineConfigurationException(String message) {
        this(message, List.of(message));
    }

    public PipelineConfigurationException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
