package pixinsight.ext.pipeline.service.bridge;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Command document written to the bridge commands directory.
 * Field names match the JSON the PJSR watcher reads.
 */
public class BridgeCommand {

    /** How the watcher applies the process. */
    public enum ExecuteMethod {
        executeGlobal,
        executeOn
    }

    private final String id;
    private final String timestamp;
    private final String tool;
    private final String process;
    private final Map<String, Object> parameters;
    private final ExecuteMethod executeMethod;
    private final String targetView;

    private BridgeCommand(String tool, String process, Map<String, Object> parameters,
                          ExecuteMethod executeMethod, String targetView) {
        this.id = UUID.randomUUID().toString();
        this.timestamp = Instant.now().toString();
        this.tool = tool;
        this.process = process;
        this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
        this.executeMethod = executeMethod;
        this.targetView = targetView;
    }

    /**
     * Creates a globally executed command.
     */
    public static BridgeCommand global(String tool, String process, Map<String, Object> parameters) {
        return new BridgeCommand(tool, process, parameters, ExecuteMethod.executeGlobal, null);
    }

    /**
     * Creates a command executed on a specific view.
     */
    public static BridgeCommand on(String tool, String process, Map<String, Object> parameters, String targetView) {
        return new BridgeCommand(tool, process, parameters, ExecuteMethod.executeOn, targetView);
    }

    /**
     * Convenience for the watcher's script tool; the last expression of {@code code}
     * is returned as {@code outputs.consoleOutput}.
     */
    public static BridgeCommand script(String code) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("code", code);
        return global("run_script", "__script__", params);
    }

    public String getId() { return id; }
    public String getTimestamp() { return timestamp; }
    public String getTool() { return tool; }
    public String getProcess() { return process; }
    public Map<String, Object> getParameters() { return parameters; }
    public ExecuteMethod getExecuteMethod() { return executeMethod; }
    public String getTargetView() { return targetView; }

    @Override
    public String toString() {
        return String.format("%s/%s [%s]%s", tool, process, id,
                targetView != null ? " on " + targetView : "");
    }
}
