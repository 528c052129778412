package pixinsight.ext.pipeline.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.model.LiveImageRegistry;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.ProcessCall;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tries competing gradient corrections and keeps the one leaving the flattest background.
 *
 * <p>Each candidate runs on its own fresh clone of the live image, which is scored and
 * closed; the live image is only touched once, when the winner is re-applied to it. Ties
 * go to the earlier candidate.</p>
 */
public class GradientRemovalSelector {
    private static final Logger logger = LoggerFactory.getLogger(GradientRemovalSelector.class);

    /**
     * A named correction.
     */
    public record Candidate(String name, ProcessCall call) {
    }

    /**
     * @param winner   chosen candidate, null if none was applied
     * @param baseline score of the image before correction
     * @param scores   score per candidate that ran, in candidate order
     */
    public record Selection(String winner, double baseline, Map<String, Double> scores) {

        public boolean applied() {
            return winner != null;
        }
    }

    private final ImageEngine engine;
    private final UniformityScorer scorer;

    public GradientRemovalSelector(ImageEngine engine, UniformityScorer scorer) {
        this.engine = engine;
        this.scorer = scorer;
    }

    /**
     * @param handle             live image to correct
     * @param candidates         corrections to compare
     * @param requireImprovement leave the image untouched unless the best candidate beats the baseline
     * @param registry           used to derive collision-free scratch handles
     */
    public Selection selectBest(String handle, List<Candidate> candidates, boolean requireImprovement,
                                LiveImageRegistry registry) throws IOException {
        double baseline = scorer.score(handle);
        logger.info("Gradient selection on {}: baseline uniformity {}", handle, format(baseline));

        Map<String, Double> scores = new LinkedHashMap<>();
        Candidate best = null;
        double bestScore = Double.POSITIVE_INFINITY;

        for (Candidate candidate : candidates) {
            List<String> open = engine.listImages().stream().map(ImageInfo::id).toList();
            String scratch = engine.cloneImage(handle, registry.uniqueHandle(handle + "_" + candidate.name(), open));
            try {
                closeAll(engine.runProcess(scratch, candidate.call()));
                double score = scorer.score(scratch);
                scores.put(candidate.name(), score);
                logger.info("  {}: uniformity {}", candidate.name(), format(score));
                if (score < bestScore) {
                    bestScore = score;
                    best = candidate;
                }
            } catch (IOException e) {
                logger.warn("  Candidate '{}' failed on {}: {}", candidate.name(), handle, e.getMessage());
            } finally {
                closeQuietly(scratch);
            }
        }

        if (best == null) {
            logger.warn("No gradient candidate succeeded on {}; image left unchanged", handle);
            return new Selection(null, baseline, Collections.unmodifiableMap(scores));
        }
        if (requireImprovement && !(bestScore < baseline)) {
            logger.info("Best candidate '{}' ({}) does not improve on baseline {}; image left unchanged",
                    best.name(), format(bestScore), format(baseline));
            return new Selection(null, baseline, Collections.unmodifiableMap(scores));
        }

        logger.info("Applying '{}' to {}", best.name(), handle);
        closeAll(engine.runProcess(handle, best.call()));
        return new Selection(best.name(), baseline, Collections.unmodifiableMap(scores));
    }

    private void closeAll(List<String> created) {
        for (String id : created) {
            closeQuietly(id);
        }
    }

    private void closeQuietly(String handle) {
        try {
            engine.closeImage(handle);
        } catch (IOException e) {
            logger.warn("Could not close {}: {}", handle, e.getMessage());
        }
    }

    private static String format(double v) {
        return String.format("%.6f", v);
    }
}
