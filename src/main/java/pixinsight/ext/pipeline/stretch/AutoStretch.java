package pixinsight.ext.pipeline.stretch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.model.ImageStatistics;
import pixinsight.ext.pipeline.service.ImageEngine;

import java.io.IOException;

/**
 * One-shot histogram auto-stretch: shadows at {@code median - 2.8·MAD}, midtone balance
 * solved so that the median lands on the target background.
 */
public class AutoStretch {
    private static final Logger logger = LoggerFactory.getLogger(AutoStretch.class);

    public static final double SHADOWS_CLIP_MADS = 2.8;

    public record Result(double shadows, double midtone) {
    }

    private final ImageEngine engine;

    public AutoStretch(ImageEngine engine) {
        this.engine = engine;
    }

    /**
     * Computes shadows and midtone balance from statistics.
     */
    public static Result solve(ImageStatistics stats, double targetBackground) {
        double median = stats.getMedian();
        double c0 = Math.max(0, median - SHADOWS_CLIP_MADS * stats.getMad());
        double x = (1 > c0) ? (median - c0) / (1 - c0) : 0.5;
        double m;
        if (x <= 0 || x >= 1) {
            m = 0.5;
        } else {
            m = x * (1 - targetBackground) / (x * (1 - 2 * targetBackground) + targetBackground);
        }
        return new Result(c0, m);
    }

    public Result run(String handle, double targetBackground) throws IOException {
        ImageStatistics stats = engine.statistics(handle);
        Result result = solve(stats, targetBackground);
        logger.info("Auto-stretch {}: median={}, MAD={} -> shadows={}, midtone={}", handle,
                String.format("%.6f", stats.getMedian()), String.format("%.6f", stats.getMad()),
                String.format("%.6f", result.shadows()), String.format("%.6f", result.midtone()));
        engine.applyTransform(handle, PixelTransforms.histogram(result.shadows(), result.midtone()));
        return result;
    }
}
