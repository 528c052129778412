package pixinsight.ext.pipeline.stretch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pixinsight.ext.pipeline.SimulatedImageEngine;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.model.ImageStatistics;

import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalStretchTest {

    private SimulatedImageEngine engine;
    private StatisticalStretch stretch;

    @BeforeEach
    void setUp() {
        engine = new SimulatedImageEngine();
        stretch = new StatisticalStretch(engine);
    }

    /**
     * Faint linear frame: sky background near 0.02 with noise and a handful of bright stars.
     * 11x11 pixels, so the median is a single sample.
     */
    private static double[] linearFrame(long seed) {
        Random random = new Random(seed);
        double[] pixels = new double[121];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = 0.02 + random.nextGaussian() * 0.002;
        }
        pixels[5] = 0.9;
        pixels[40] = 0.6;
        pixels[77] = 0.35;
        pixels[100] = 0.15;
        return pixels;
    }

    @Test
    @DisplayName("Mono stretch converges to the target median of 0.25")
    void testConvergesToTarget() throws IOException {
        String handle = engine.addImage("lum", 11, 11, linearFrame(7));

        StatisticalStretch.FinalStats result = stretch.run(handle, StatisticalStretch.Options.defaults());

        assertTrue(result.converged());
        assertTrue(result.iterations() >= 1 && result.iterations() <= 5);
        assertEquals(0.25, result.median(), StatisticalStretch.CONVERGENCE_TOLERANCE);
        ImageStatistics stats = engine.statistics(handle);
        assertEquals(0.25, stats.getMedian(), StatisticalStretch.CONVERGENCE_TOLERANCE);
        assertTrue(stats.getMax() <= 1.0);
        assertTrue(stats.getMin() >= 0.0);
    }

    @Test
    @DisplayName("Other targets are reached as well")
    void testCustomTarget() throws IOException {
        String handle = engine.addImage("lum", 11, 11, linearFrame(11));
        StatisticalStretch.Options options = StatisticalStretch.Options.from(
                new StepParams(Map.of("targetMedian", 0.15, "iterations", 3.0)), 5);

        StatisticalStretch.FinalStats result = stretch.run(handle, options);

        assertEquals(3, options.maxIterations());
        assertTrue(result.converged());
        assertEquals(0.15, result.median(), StatisticalStretch.CONVERGENCE_TOLERANCE);
    }

    @Test
    @DisplayName("Highlight compression pulls the brightest stars below 1")
    void testHighlightCompression() throws IOException {
        String handle = engine.addImage("lum", 11, 11, linearFrame(3));
        StatisticalStretch.Options options = StatisticalStretch.Options.from(new StepParams(Map.of(
                "hdrCompress", true, "hdrAmount", 0.5, "hdrKnee", 0.6, "hdrHeadroom", 0.05)), 5);

        stretch.run(handle, options);

        ImageStatistics stats = engine.statistics(handle);
        assertTrue(stats.getMax() <= 0.6 + 0.4 * 0.95 + 1e-9, "max " + stats.getMax());
        assertTrue(stats.getMin() >= 0.0);
    }

    @Test
    @DisplayName("A flat frame cannot be stretched and is left untouched")
    void testFlatFrameStops() throws IOException {
        double[] flat = new double[25];
        Arrays.fill(flat, 0.1);
        String handle = engine.addImage("flat", 5, 5, flat);

        StatisticalStretch.FinalStats result = stretch.run(handle, StatisticalStretch.Options.defaults());

        assertFalse(result.converged());
        assertEquals(0, result.iterations());
        assertEquals(0, engine.countCalls("applyTransform"));
        assertEquals(0.1, engine.pixels(handle)[0][0], 0.0);
    }

    @Test
    @DisplayName("Target median outside (0,1) is rejected")
    void testInvalidOptions() {
        assertThrows(IllegalArgumentException.class,
                () -> new StatisticalStretch.Options(1.2, 5, false, false, false, 0.25, 0.35, 0, 5));
        assertThrows(IllegalArgumentException.class,
                () -> new StatisticalStretch.Options(0.25, 5, false, false, false, 0.25, 0.35, 0, 0));
    }
}
