package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.stretch.AutoStretch;
import pixinsight.ext.pipeline.stretch.GeneralizedHyperbolicStretch;
import pixinsight.ext.pipeline.stretch.GhsDerivation;
import pixinsight.ext.pipeline.stretch.StatisticalStretch;
import pixinsight.ext.pipeline.stretch.StretchSpec;

import java.io.IOException;
import java.util.List;

/**
 * Linear to non-linear stretch of the step's branch.
 *
 * <p>{@code mode} selects the base stretch: {@code stat} (iterative statistical stretch,
 * the default), {@code auto} (one histogram transform solved for {@code targetBackground})
 * or {@code none}. The optional {@code ghs} list is applied afterwards, one pass each; a
 * pass without {@code SP} pivots on the median measured just before it. Passes that fail
 * validation are skipped with a warning and never sent to the engine.</p>
 */
public class StretchStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(StretchStepHandler.class);

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.oneOf("mode", false, "stat", "auto", "none"),
                ParamSpec.number("targetMedian", false, 0.001, 0.999),
                ParamSpec.number("targetBackground", false, 0.001, 0.999),
                ParamSpec.number("blackpointSigma", false, 0.0, null),
                ParamSpec.optional("noBlackClip", ParamSpec.Type.BOOLEAN),
                ParamSpec.optional("normalize", ParamSpec.Type.BOOLEAN),
                ParamSpec.optional("hdrCompress", ParamSpec.Type.BOOLEAN),
                ParamSpec.number("hdrAmount", false, 0.0, 1.0),
                ParamSpec.number("hdrKnee", false, 0.0, 1.0),
                ParamSpec.number("hdrHeadroom", false, 0.0, 0.5),
                new ParamSpec("iterations", ParamSpec.Type.INTEGER, false, 1.0, 50.0, null),
                ParamSpec.optional("ghs", ParamSpec.Type.LIST));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        StepParams params = context.getParams();
        ImageEngine engine = context.getEngine();
        String stepId = context.getStep().getId();
        String handle = context.handle();

        switch (params.getString("mode", "stat")) {
            case "auto" -> {
                AutoStretch.Result result = new AutoStretch(engine)
                        .run(handle, params.getDouble("targetBackground", 0.25));
                logger.info("Step '{}': auto stretch shadows={} midtone={}", stepId,
                        result.shadows(), result.midtone());
            }
            case "none" -> logger.debug("Step '{}': no base stretch", stepId);
            default -> {
                StatisticalStretch.Options options =
                        StatisticalStretch.Options.from(params, context.getSettings().getStretchMaxIterations());
                StatisticalStretch.FinalStats stats = new StatisticalStretch(engine).run(handle, options);
                if (!stats.converged()) {
                    logger.warn("Step '{}': statistical stretch stopped at median {} after {} iterations (target {})",
                            stepId, stats.median(), stats.iterations(), options.targetMedian());
                }
            }
        }

        List<StepParams> passes = params.getSections("ghs");
        for (int i = 0; i < passes.size(); i++) {
            applyGhsPass(context, handle, i + 1, passes.get(i));
        }
    }

    private void applyGhsPass(StepContext context, String handle, int pass, StepParams section) throws IOException {
        String stepId = context.getStep().getId();
        double median = context.getEngine().statistics(handle).getMedian();
        GhsDerivation derivation = GeneralizedHyperbolicStretch.prepare(StretchSpec.from(section), median);
        switch (derivation.getStatus()) {
            case VALID -> {
                context.getEngine().applyTransform(handle, derivation.toTransform());
                logger.info("Step '{}': GHS pass {} applied ({})", stepId, pass, derivation);
            }
            case IDENTITY -> logger.info("Step '{}': GHS pass {} is the identity (D=0); skipped", stepId, pass);
            case INVALID -> logger.warn("Step '{}': GHS pass {} skipped: {} (median {})",
                    stepId, pass, derivation.getReason(), median);
        }
    }
}
