package pixinsight.ext.pipeline.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An engine process instance: the process class name plus the properties to set on it.
 *
 * @param processName engine process class, e.g. {@code NoiseXTerminator}
 * @param properties  property values (numbers, booleans, strings, nested lists)
 */
public record ProcessCall(String processName, Map<String, Object> properties) {

    public ProcessCall {
        if (processName == null || !processName.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid process name: " + processName);
        }
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static ProcessCall of(String processName) {
        return new ProcessCall(processName, Map.of());
    }

    public ProcessCall with(String property, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(properties);
        copy.put(property, value);
        return new ProcessCall(processName, copy);
    }
}
