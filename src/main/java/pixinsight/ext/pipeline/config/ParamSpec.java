package pixinsight.ext.pipeline.config;

import java.util.List;
import java.util.Map;

/**
 * Constraint on one step parameter.
 *
 * @param name     parameter key
 * @param type     expected value type
 * @param required whether the key must be present
 * @param min      inclusive lower bound for numbers, or null
 * @param max      inclusive upper bound for numbers, or null
 * @param allowed  permitted string values, empty for any
 */
public record ParamSpec(String name, Type type, boolean required, Double min, Double max, List<String> allowed) {

    public enum Type {
        NUMBER, INTEGER, BOOLEAN, STRING, LIST, OBJECT, ANY
    }

    public ParamSpec {
        allowed = allowed == null ? List.of() : List.copyOf(allowed);
    }

    public static ParamSpec required(String name, Type type) {
        return new ParamSpec(name, type, true, null, null, null);
    }

    public static ParamSpec optional(String name, Type type) {
        return new ParamSpec(name, type, false, null, null, null);
    }

    public static ParamSpec number(String name, boolean required, Double min, Double max) {
        return new ParamSpec(name, Type.NUMBER, required, min, max, null);
    }

    public static ParamSpec oneOf(String name, boolean required, String... values) {
        return new ParamSpec(name, Type.STRING, required, null, null, List.of(values));
    }

    /**
     * Checks a single value.
     *
     * @return problem description, or null if the value is acceptable
     */
    public String check(Object value) {
        if (value == null) {
            return required ? "missing required parameter '" + name + "'" : null;
        }
        switch (type) {
            case NUMBER, INTEGER -> {
                if (!(value instanceof Number n)) {
                    return "'" + name + "' must be a number but was " + value;
                }
                double d = n.doubleValue();
                if (type == Type.INTEGER && d != Math.rint(d)) {
                    return "'" + name + "' must be an integer but was " + value;
                }
                if (min != null && d < min) {
                    return "'" + name + "' = " + value + " is below " + min;
                }
                if (max != null && d > max) {
                    return "'" + name + "' = " + value + " is above " + max;
                }
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    return "'" + name + "' must be true or false but was " + value;
                }
            }
            case STRING -> {
                if (!(value instanceof String s)) {
                    return "'" + name + "' must be a string but was " + value;
                }
                if (!allowed.isEmpty() && !allowed.contains(s)) {
                    return "'" + name + "' = " + s + " is not one of " + allowed;
                }
            }
            case LIST -> {
                if (!(value instanceof List<?>)) {
                    return "'" + name + "' must be a list but was " + value;
                }
            }
            case OBJECT -> {
                if (!(value instanceof Map<?, ?>)) {
                    return "'" + name + "' must be an object but was " + value;
                }
            }
            case ANY -> {
                // any value
            }
        }
        return null;
    }
}
