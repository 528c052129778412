package pixinsight.ext.pipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed read access to a step's free-form parameter map.
 *
 * <p>Gson hands numbers back as {@code Double}, so every numeric getter accepts
 * any {@link Number} and also a numeric string.</p>
 */
public class StepParams {
    private static final Logger logger = LoggerFactory.getLogger(StepParams.class);

    private final Map<String, Object> values;

    public StepParams(Map<String, Object> values) {
        this.values = values;
    }

    public boolean has(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return v != null ? v.toString() : defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Double v = toDouble(key, values.get(key));
        return v != null ? v : defaultValue;
    }

    /**
     * @return the value, or null when absent
     */
    public Double getDouble(String key) {
        return toDouble(key, values.get(key));
    }

    public int getInt(String key, int defaultValue) {
        Double v = toDouble(key, values.get(key));
        return v != null ? (int) Math.round(v) : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v instanceof Boolean b) return b;
        return v != null ? Boolean.parseBoolean(v.toString()) : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String key) {
        Object v = values.get(key);
        return (v instanceof List<?>) ? (List<Object>) v : List.of();
    }

    /**
     * Nested object parameter (e.g. one GHS pass), or an empty map.
     */
    @SuppressWarnings("unchecked")
    public StepParams getSection(String key) {
        Object v = values.get(key);
        return new StepParams((v instanceof Map<?, ?>) ? (Map<String, Object>) v : Collections.emptyMap());
    }

    /**
     * List of nested objects, e.g. the GHS passes of a stretch step.
     */
    @SuppressWarnings("unchecked")
    public List<StepParams> getSections(String key) {
        List<StepParams> sections = new ArrayList<>();
        for (Object item : getList(key)) {
            if (item instanceof Map<?, ?> map) {
                sections.add(new StepParams((Map<String, Object>) map));
            }
        }
        return sections;
    }

    private static Double toDouble(String key, Object v) {
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected number at {} but got {}", key, v);
            return null;
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
