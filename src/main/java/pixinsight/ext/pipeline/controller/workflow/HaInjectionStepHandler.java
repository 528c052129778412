package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.ProcessCall;
import pixinsight.ext.pipeline.stretch.ExpressionFormat;

import java.io.IOException;
import java.util.List;

/**
 * Injects narrowband H-alpha signal into the red channel of the step's branch.
 *
 * <p>The Ha branch is first linear-fitted to the red channel so both share a scale, then
 * only pixels where Ha is brighter than the target are lifted:
 * {@code iif(Ha>$T, $T + s*(Ha - med(Ha)), $T)}. List the Ha branch under {@code merges}
 * so it is released after the step.</p>
 */
public class HaInjectionStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(HaInjectionStepHandler.class);

    public static final String DEFAULT_HA_BRANCH = "ha";

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.optional("haBranch", ParamSpec.Type.STRING),
                ParamSpec.number("strength", false, 0.0, 2.0),
                ParamSpec.optional("linearFit", ParamSpec.Type.BOOLEAN),
                ParamSpec.number("rejectHigh", false, 0.0, 1.0));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        StepParams params = context.getParams();
        ImageEngine engine = context.getEngine();
        String stepId = context.getStep().getId();
        String target = context.handle();
        String ha = context.handleOf(params.getString("haBranch", DEFAULT_HA_BRANCH));
        boolean color = engine.statistics(target).isColor();

        if (params.getBoolean("linearFit", true)) {
            String reference = engine.createImage(context.uniqueHandle(target + "_R"),
                    List.of(color ? target + "[0]" : target), target);
            try {
                ProcessCall fit = ProcessCall.of("LinearFit")
                        .with("referenceViewId", reference)
                        .with("rejectLow", 0.0)
                        .with("rejectHigh", params.getDouble("rejectHigh", 0.92));
                for (String created : engine.runProcess(ha, fit)) {
                    engine.closeImage(created);
                }
            } finally {
                engine.closeImage(reference);
            }
        }

        String injection = injectionExpression(ha, params.getDouble("strength", 0.5));
        engine.pixelMath(target, color ? List.of(injection, "$T", "$T") : List.of(injection), true);
        logger.info("Step '{}': injected {} into {} ({})", stepId, ha, target, injection);
    }

    static String injectionExpression(String ha, double strength) {
        return "iif(" + ha + ">$T,$T+" + ExpressionFormat.number(strength) + "*(" + ha + "-med(" + ha + ")),$T)";
    }
}
