package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.ProcessCall;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * StarXTerminator on the step's branch. The star image it generates becomes a new branch
 * (default {@code stars}) for a later recombination step.
 */
public class StarRemovalStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(StarRemovalStepHandler.class);

    public static final String DEFAULT_STARS_BRANCH = "stars";

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.optional("starsBranch", ParamSpec.Type.STRING),
                ParamSpec.number("overlap", false, 0.0, 0.5),
                ParamSpec.optional("unscreen", ParamSpec.Type.BOOLEAN),
                ParamSpec.optional("keepStars", ParamSpec.Type.BOOLEAN));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        StepParams params = context.getParams();
        ImageEngine engine = context.getEngine();
        String stepId = context.getStep().getId();
        String starsBranch = params.getString("starsBranch", DEFAULT_STARS_BRANCH);
        boolean keepStars = params.getBoolean("keepStars", true);

        ProcessCall call = ProcessCall.of("StarXTerminator")
                .with("stars", keepStars)
                .with("unscreen", params.getBoolean("unscreen", false))
                .with("overlap", params.getDouble("overlap", 0.20));
        List<String> created = engine.runProcess(context.handle(), call);
        if (!keepStars) {
            for (String id : created) {
                engine.closeImage(id);
            }
            logger.info("Step '{}': stars removed and discarded", stepId);
            return;
        }
        if (created.isEmpty()) {
            throw new IOException("StarXTerminator produced no star image on " + context.handle());
        }

        String starImage = created.stream()
                .filter(id -> id.toLowerCase(Locale.ROOT).contains("star"))
                .findFirst()
                .orElse(created.get(0));
        for (String id : created) {
            if (!id.equals(starImage)) {
                engine.closeImage(id);
            }
        }

        String handle = engine.renameImage(starImage, context.uniqueHandle(starsBranch));
        if (context.isLive(starsBranch)) {
            String previous = context.handleOf(starsBranch);
            context.replaceHandle(starsBranch, handle);
            engine.closeImage(previous);
        } else {
            context.forkBranch(starsBranch, handle);
        }
        logger.info("Step '{}': star image {} is branch '{}'", stepId, handle, starsBranch);
    }
}
