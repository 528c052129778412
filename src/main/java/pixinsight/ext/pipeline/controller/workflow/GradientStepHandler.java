package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.controller.GradientRemovalSelector;
import pixinsight.ext.pipeline.controller.GradientRemovalSelector.Candidate;
import pixinsight.ext.pipeline.controller.GradientRemovalSelector.Selection;
import pixinsight.ext.pipeline.controller.UniformityScorer;
import pixinsight.ext.pipeline.service.ProcessCall;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Background gradient removal, choosing between AutomaticBackgroundExtractor ({@code abe})
 * and GradientCorrection ({@code gc}) by the flatness of the result.
 *
 * <p>Steps whose kind starts with {@code abe} or {@code gc} try only that candidate unless
 * {@code candidates} says otherwise.</p>
 */
public class GradientStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(GradientStepHandler.class);

    public static final String ABE = "abe";
    public static final String GC = "gc";
    static final int DEFAULT_POLY_DEGREE = 4;

    @Override
    public ParamSchema schema() {
        return ParamSchema.of(
                ParamSpec.optional("candidates", ParamSpec.Type.LIST),
                new ParamSpec("polyDegree", ParamSpec.Type.INTEGER, false, 1.0, 8.0, null),
                ParamSpec.optional("requireImprovement", ParamSpec.Type.BOOLEAN),
                ParamSpec.number("boxFraction", false, 0.01, 0.5));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        StepParams params = context.getParams();
        List<Candidate> candidates = candidates(context.getStep().getKind(), params);
        double boxFraction = params.getDouble("boxFraction", context.getSettings().getUniformityBoxFraction());
        GradientRemovalSelector selector = new GradientRemovalSelector(context.getEngine(),
                new UniformityScorer(context.getEngine(), boxFraction));

        Selection selection = selector.selectBest(context.handle(), candidates,
                params.getBoolean("requireImprovement", true), context.getRegistry());
        if (selection.applied()) {
            logger.info("Step '{}': applied {} (baseline {}, scores {})", context.getStep().getId(),
                    selection.winner(), selection.baseline(), selection.scores());
        } else {
            logger.warn("Step '{}': no gradient correction applied (baseline {}, scores {})",
                    context.getStep().getId(), selection.baseline(), selection.scores());
        }
    }

    static List<Candidate> candidates(String kind, StepParams params) {
        List<Object> names = params.getList("candidates");
        if (names.isEmpty()) {
            String k = kind == null ? "" : kind.toLowerCase(Locale.ROOT);
            if (k.startsWith(ABE)) {
                names = List.of(ABE);
            } else if (k.startsWith(GC)) {
                names = List.of(GC);
            } else {
                names = List.of(ABE, GC);
            }
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Object name : names) {
            String n = String.valueOf(name).toLowerCase(Locale.ROOT);
            switch (n) {
                case ABE -> candidates.add(new Candidate(ABE, ProcessCall.of("AutomaticBackgroundExtractor")
                        .with("polyDegree", params.getInt("polyDegree", DEFAULT_POLY_DEGREE))));
                case GC -> candidates.add(new Candidate(GC, ProcessCall.of("GradientCorrection")));
                default -> throw new IllegalArgumentException("Unknown gradient candidate '" + name
                        + "'; expected " + ABE + " or " + GC);
            }
        }
        return candidates;
    }
}
