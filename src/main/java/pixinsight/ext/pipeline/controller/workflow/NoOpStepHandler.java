package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;

/**
 * Fallback for step kinds no handler is registered for. Does nothing but say so.
 */
public class NoOpStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(NoOpStepHandler.class);

    @Override
    public ParamSchema schema() {
        return ParamSchema.open();
    }

    @Override
    public void execute(StepContext context) {
        logger.warn("Step '{}' has no handler for kind '{}'; nothing done",
                context.getStep().getId(), context.getStep().getKind());
    }
}
