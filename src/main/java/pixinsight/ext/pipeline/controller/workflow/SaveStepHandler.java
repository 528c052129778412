package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.service.ImageEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves a branch's image into the output directory, overwriting any existing file.
 */
public class SaveStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(SaveStepHandler.class);

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.optional("branch", ParamSpec.Type.STRING),
                ParamSpec.optional("filename", ParamSpec.Type.STRING));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        StepParams params = context.getParams();
        ImageEngine engine = context.getEngine();
        String branch = params.getString("branch", context.getStep().getBranchId());
        String filename = params.getString("filename", context.targetName() + "_" + context.getStep().getId() + ".xisf");

        Path outputDir = context.outputDir();
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(filename);
        String handle = context.handleOf(branch);
        String saved = engine.saveImage(handle, file);
        if (!saved.equals(handle)) {
            String restored = engine.renameImage(saved, handle);
            if (!restored.equals(handle)) {
                context.replaceHandle(branch, restored);
            }
        }
        logger.info("Step '{}': saved branch '{}' to {}", context.getStep().getId(), branch, file);
    }
}
