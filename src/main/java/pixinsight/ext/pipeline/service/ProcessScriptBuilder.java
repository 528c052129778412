package pixinsight.ext.pipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.stretch.ExpressionFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized builder for PJSR process invocations sent through {@code run_script}.
 *
 * <p>Renders a process instance, its properties and the execution target into a script
 * the watcher can evaluate:</p>
 * <pre>{@code
 * var P = new NoiseXTerminator;
 * P.denoise = 0.3;
 * P.executeOn(view('main'));
 * }</pre>
 * <p>A view lookup that fails raises a script error, so a missing image surfaces as an
 * engine error result rather than a silent no-op.</p>
 */
public class ProcessScriptBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ProcessScriptBuilder.class);

    /**
     * A property value rendered verbatim, e.g. {@code PixelMath.prototype.RGB}.
     */
    public record Raw(String code) {
    }

    private String processName;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private String targetView;
    private boolean global;
    private String trailer;

    private ProcessScriptBuilder() {}

    public static ProcessScriptBuilder builder() {
        return new ProcessScriptBuilder();
    }

    /**
     * Builder pre-filled from a process call.
     */
    public static ProcessScriptBuilder forCall(ProcessCall call) {
        return builder().process(call.processName()).properties(call.properties());
    }

    public ProcessScriptBuilder process(String processName) {
        this.processName = processName;
        return this;
    }

    public ProcessScriptBuilder property(String name, Object value) {
        properties.put(name, value);
        return this;
    }

    public ProcessScriptBuilder properties(Map<String, Object> values) {
        properties.putAll(values);
        return this;
    }

    public ProcessScriptBuilder executeOn(String viewId) {
        this.targetView = viewId;
        this.global = false;
        return this;
    }

    public ProcessScriptBuilder executeGlobal() {
        this.global = true;
        this.targetView = null;
        return this;
    }

    /**
     * Script appended after execution; its last expression becomes the console output.
     */
    public ProcessScriptBuilder thenEvaluate(String trailer) {
        this.trailer = trailer;
        return this;
    }

    private void validate() {
        List<String> missing = new ArrayList<>();
        if (processName == null || processName.isEmpty()) missing.add("process");
        if (!global && (targetView == null || targetView.isEmpty())) missing.add("target view");
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required parameters: " + String.join(", ", missing));
        }
    }

    public String build() {
        validate();
        StringBuilder script = new StringBuilder();
        script.append(viewFunction());
        script.append("var P = new ").append(processName).append(";\n");
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (!entry.getKey().matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new IllegalArgumentException("Invalid property name: " + entry.getKey());
            }
            script.append("P.").append(entry.getKey()).append(" = ").append(literal(entry.getValue())).append(";\n");
        }
        if (global) {
            script.append("P.executeGlobal();\n");
        } else {
            script.append("P.executeOn(view(").append(quote(targetView)).append("));\n");
        }
        script.append(trailer != null ? trailer : "'ok';");
        String result = script.toString();
        logger.debug("Built script for {}: {}", processName, result);
        return result;
    }

    /**
     * Helper every generated script starts with: {@code view(id)} returns the main view of
     * an open window or throws.
     */
    public static String viewFunction() {
        return "function view(id) { var w = ImageWindow.windowById(id); "
                + "if (w.isNull) throw new Error('Image not found: ' + id); return w.mainView; }\n";
    }

    /**
     * Renders a Java value as a JavaScript literal.
     */
    public static String literal(Object value) {
        if (value instanceof Raw raw) {
            return raw.code();
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            String s = ExpressionFormat.number(d);
            return s.startsWith("(") ? s.substring(1, s.length() - 1) : s;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(ProcessScriptBuilder::literal).collect(Collectors.joining(",", "[", "]"));
        }
        return quote(value.toString());
    }

    /**
     * Single-quoted JavaScript string literal.
     */
    public static String quote(String s) {
        StringBuilder out = new StringBuilder("'");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.append('\'').toString();
    }

    /**
     * Absolute path literal; Windows separators become forward slashes, which PixInsight accepts everywhere.
     */
    public static String path(Path path) {
        return quote(path.toAbsolutePath().toString().replace('\\', '/'));
    }
}
