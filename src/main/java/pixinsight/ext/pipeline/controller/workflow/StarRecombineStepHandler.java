package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.ProcessCall;
import pixinsight.ext.pipeline.stretch.AutoStretch;

import java.io.IOException;
import java.util.List;

/**
 * Screen-blends the star branch back into the step's branch: {@code ~(~$T*~stars)}.
 *
 * <p>The star image can be stretched and saturated first. List the star branch under
 * {@code merges} so it is released after the step.</p>
 */
public class StarRecombineStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(StarRecombineStepHandler.class);

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.optional("starsBranch", ParamSpec.Type.STRING),
                ParamSpec.optional("stretchStars", ParamSpec.Type.BOOLEAN),
                ParamSpec.number("starBackground", false, 0.001, 0.999),
                ParamSpec.number("saturation", false, 0.0, 1.0));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        StepParams params = context.getParams();
        ImageEngine engine = context.getEngine();
        String stepId = context.getStep().getId();
        String target = context.handle();
        String stars = context.handleOf(params.getString("starsBranch", StarRemovalStepHandler.DEFAULT_STARS_BRANCH));

        if (params.getBoolean("stretchStars", false)) {
            AutoStretch.Result result = new AutoStretch(engine).run(stars, params.getDouble("starBackground", 0.10));
            logger.info("Step '{}': stretched stars {} (shadows {}, midtone {})", stepId, stars,
                    result.shadows(), result.midtone());
        }
        double saturation = params.getDouble("saturation", 0);
        if (saturation > 0) {
            engine.runProcess(stars, saturationCurve(saturation));
        }

        engine.pixelMath(target, List.of(screenExpression(stars)), true);
        logger.info("Step '{}': recombined {} into {}", stepId, stars, target);
    }

    static String screenExpression(String stars) {
        return "~(~$T*~" + stars + ")";
    }

    /**
     * Saturation boost as a CurvesTransformation S curve lifting mid saturation by {@code amount / 2}.
     */
    static ProcessCall saturationCurve(double amount) {
        double mid = Math.min(1.0, 0.5 + amount / 2);
        return ProcessCall.of("CurvesTransformation")
                .with("S", List.of(List.of(0.0, 0.0), List.of(0.5, mid), List.of(1.0, 1.0)));
    }
}
