package pixinsight.ext.pipeline.config;

import java.util.Optional;

/**
 * Looks up the parameter schema bound to a step; empty when no handler serves the step.
 */
@FunctionalInterface
public interface SchemaResolver {

    Optional<ParamSchema> schemaFor(Step step);
}
