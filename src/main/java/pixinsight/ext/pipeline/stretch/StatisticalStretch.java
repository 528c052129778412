package pixinsight.ext.pipeline.stretch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.model.ImageStatistics;
import pixinsight.ext.pipeline.service.ImageEngine;

import java.io.IOException;

/**
 * Iterative statistical stretch driving the image median to a target background level.
 *
 * <p>Each iteration, on statistics measured by the engine:</p>
 * <ol>
 *   <li>blackpoint {@code BP = median - sigma·1.4826·MAD}, never below the image minimum
 *       (with {@code noBlackClip} the minimum itself)</li>
 *   <li>rescale so that BP maps to 0 and the image maximum to 1</li>
 *   <li>midtones transfer sending the rescaled median to the target</li>
 *   <li>normalise by the new maximum, or truncate to [0,1]</li>
 *   <li>optional highlight compression</li>
 * </ol>
 * <p>Iteration stops once {@code |median - target| < 0.001} or after the iteration cap.
 * Colour images use luminance-weighted statistics and one linked transform for all channels.</p>
 */
public class StatisticalStretch {
    private static final Logger logger = LoggerFactory.getLogger(StatisticalStretch.class);

    public static final double CONVERGENCE_TOLERANCE = 0.001;

    /**
     * Options of one statistical stretch.
     */
    public record Options(double targetMedian, double blackpointSigma, boolean noBlackClip, boolean normalize,
                          boolean hdrCompress, double hdrAmount, double hdrKnee, double hdrHeadroom,
                          int maxIterations) {

        public Options {
            if (!(targetMedian > 0 && targetMedian < 1)) {
                throw new IllegalArgumentException("Target median must be in (0,1): " + targetMedian);
            }
            if (maxIterations < 1) {
                throw new IllegalArgumentException("At least one iteration is required");
            }
        }

        public static Options defaults() {
            return new Options(0.25, 5.0, false, false, false, 0.25, 0.35, 0, 5);
        }

        /**
         * Reads options from step parameters, using {@code defaultIterations} when
         * {@code iterations} is not given.
         */
        public static Options from(StepParams params, int defaultIterations) {
            return new Options(
                    params.getDouble("targetMedian", 0.25),
                    params.getDouble("blackpointSigma", 5.0),
                    params.getBoolean("noBlackClip", false),
                    params.getBoolean("normalize", false),
                    params.getBoolean("hdrCompress", false),
                    params.getDouble("hdrAmount", 0.25),
                    params.getDouble("hdrKnee", 0.35),
                    params.getDouble("hdrHeadroom", 0),
                    params.getInt("iterations", defaultIterations));
        }
    }

    /**
     * Statistics after the last iteration.
     */
    public record FinalStats(double median, double max, int iterations, boolean converged) {
    }

    private final ImageEngine engine;

    public StatisticalStretch(ImageEngine engine) {
        this.engine = engine;
    }

    public FinalStats run(String handle, Options options) throws IOException {
        double target = options.targetMedian();
        ImageStatistics stats = engine.statistics(handle);
        logger.info("Statistical stretch on {}: target={}, bpSigma={}, HDR={} (initial {})",
                handle, target, options.blackpointSigma(), options.hdrCompress(), stats);

        int iterations = 0;
        boolean converged = false;
        while (iterations < options.maxIterations()) {
            double median = stats.getMedian();
            double min = stats.getMin();
            double max = stats.getMax();

            double bpRaw = median - options.blackpointSigma() * ImageStatistics.MAD_TO_SIGMA * stats.getMad();
            double blackpoint = options.noBlackClip() ? min : Math.max(bpRaw, min);
            if (!(max > blackpoint)) {
                logger.warn("Stretch of {} stopped: max {} not above blackpoint {}", handle, max, blackpoint);
                break;
            }
            double midtone = (median - blackpoint) / (max - blackpoint);
            if (!(midtone > 0 && midtone < 1)) {
                logger.warn("Stretch of {} stopped: rescaled median {} outside (0,1)", handle, midtone);
                break;
            }

            engine.applyTransform(handle, PixelTransforms.rescale(blackpoint, max));
            engine.applyTransform(handle, PixelTransforms.midtones(midtone, target));

            if (options.normalize()) {
                double newMax = engine.statistics(handle).getMax();
                engine.applyTransform(handle, newMax > 0 ? PixelTransforms.scale(1 / newMax) : PixelTransforms.truncate());
            } else {
                engine.applyTransform(handle, PixelTransforms.truncate());
            }

            if (options.hdrCompress() && options.hdrAmount() > 0) {
                engine.applyTransform(handle, PixelTransforms.highlightCompression(
                        options.hdrAmount(), options.hdrKnee(), options.hdrHeadroom()));
            }

            iterations++;
            stats = engine.statistics(handle);
            double diff = Math.abs(stats.getMedian() - target);
            logger.info("  Iter {}: median={}, max={}, diff={}",
                    iterations, String.format("%.6f", stats.getMedian()), String.format("%.4f", stats.getMax()),
                    String.format("%.6f", diff));
            if (diff < CONVERGENCE_TOLERANCE) {
                converged = true;
                logger.info("  Converged after {} iteration(s)", iterations);
                break;
            }
        }

        return new FinalStats(stats.getMedian(), stats.getMax(), iterations, converged);
    }
}
