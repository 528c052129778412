package pixinsight.ext.pipeline.controller;

import pixinsight.ext.pipeline.service.ImageEngine;

import java.io.IOException;

/**
 * Background flatness: population standard deviation of the luminance medians of the four
 * corner boxes and the centre box. Lower is flatter.
 */
public class UniformityScorer {

    private final ImageEngine engine;
    private final double boxFraction;

    public UniformityScorer(ImageEngine engine, double boxFraction) {
        this.engine = engine;
        this.boxFraction = boxFraction;
    }

    public double score(String handle) throws IOException {
        return spread(engine.regionMedians(handle, boxFraction));
    }

    static double spread(double[] medians) {
        if (medians.length == 0) {
            return 0;
        }
        double mean = 0;
        for (double m : medians) {
            mean += m;
        }
        mean /= medians.length;
        double var = 0;
        for (double m : medians) {
            var += (m - mean) * (m - mean);
        }
        return Math.sqrt(var / medians.length);
    }
}
