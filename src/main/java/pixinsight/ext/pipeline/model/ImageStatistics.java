package pixinsight.ext.pipeline.model;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Per-channel statistics of a working image, plus the combined views the stretch
 * procedures need.
 *
 * <p>Colour images are summarised with Rec.709 luminance weights so that one
 * background estimate can be applied identically to all three channels.</p>
 */
public class ImageStatistics {

    /** Rec.709 luminance weights for R, G, B. */
    public static final double[] LUMINANCE_WEIGHTS = {0.2126, 0.7152, 0.0722};

    /** Scale factor turning a MAD into a normal-consistent sigma. */
    public static final double MAD_TO_SIGMA = 1.4826;

    /**
     * Statistics of one channel.
     */
    public record Channel(double median, double mad, double min, double max, double mean) {
    }

    private final List<Channel> channels;

    public ImageStatistics(List<Channel> channels) {
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("Statistics need at least one channel");
        }
        this.channels = List.copyOf(channels);
    }

    /**
     * Convenience for a single-channel image.
     */
    public static ImageStatistics mono(double median, double mad, double min, double max) {
        return new ImageStatistics(List.of(new Channel(median, mad, min, max, median)));
    }

    public List<Channel> getChannels() {
        return channels;
    }

    public boolean isColor() {
        return channels.size() >= 3;
    }

    /**
     * Median used to drive the stretch: the channel median for mono images, the
     * luminance-weighted combination of channel medians for colour.
     */
    public double getMedian() {
        return combine(Channel::median);
    }

    public double getMad() {
        return combine(Channel::mad);
    }

    /** Lowest sample over all channels. */
    public double getMin() {
        return channels.stream().mapToDouble(Channel::min).min().orElse(0);
    }

    /** Highest sample over all channels. */
    public double getMax() {
        return channels.stream().mapToDouble(Channel::max).max().orElse(1);
    }

    private double combine(ToDoubleFunction<Channel> field) {
        if (!isColor()) {
            return field.applyAsDouble(channels.get(0));
        }
        double sum = 0;
        for (int c = 0; c < 3; c++) {
            sum += LUMINANCE_WEIGHTS[c] * field.applyAsDouble(channels.get(c));
        }
        return sum;
    }

    @Override
    public String toString() {
        return String.format("median=%.6f, MAD=%.6f, min=%.6f, max=%.4f (%d ch)",
                getMedian(), getMad(), getMin(), getMax(), channels.size());
    }
}
