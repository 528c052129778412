package pixinsight.ext.pipeline.controller.workflow;

import pixinsight.ext.pipeline.config.ParamSchema;

import java.io.IOException;

/**
 * Engine call sequence for one kind of pipeline step.
 *
 * <p>Handlers are stateless; everything run-specific comes from the {@link StepContext},
 * which is also the only way to read or change which image a branch points at.</p>
 *
 * <p>Error contract:</p>
 * <ul>
 *   <li>{@link IOException} (bridge timeouts, engine error results) and other runtime
 *       failures make the step a no-op with a warning; the run continues</li>
 *   <li>{@link pixinsight.ext.pipeline.controller.PipelineSetupException} stops the run</li>
 * </ul>
 *
 * @see StepHandlerRegistry
 */
public interface StepHandler {

    /**
     * Parameters this handler accepts, checked when the pipeline config is loaded.
     */
    ParamSchema schema();

    void execute(StepContext context) throws IOException;
}
