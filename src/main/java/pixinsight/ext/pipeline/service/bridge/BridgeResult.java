package pixinsight.ext.pipeline.service.bridge;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.Map;

/**
 * Result document the watcher writes for a command.
 * A {@code running} result is an intermediate progress report, not an answer.
 */
public class BridgeResult {

    /**
     * Result status enumeration matching the watcher states.
     */
    public enum Status {
        @SerializedName("running") RUNNING,
        @SerializedName("success") SUCCESS,
        @SerializedName("error") ERROR;

        public boolean isTerminal() {
            return this != RUNNING;
        }
    }

    /**
     * Error block of a failed command.
     */
    public static class ErrorInfo {
        private String message;
        private String type;
        private String stack;

        public ErrorInfo() {
        }

        public ErrorInfo(String message, String type) {
            this.message = message;
            this.type = type;
        }

        public String getMessage() { return message; }
        public String getType() { return type; }
        public String getStack() { return stack; }
    }

    private String id;
    private String timestamp;
    private Status status;
    private String process;
    @SerializedName("duration_ms")
    private long durationMs;
    private Map<String, Object> outputs;
    private ErrorInfo error;
    private String message;

    public BridgeResult() {
    }

    public BridgeResult(String id, Status status, Map<String, Object> outputs, ErrorInfo error) {
        this.id = id;
        this.status = status;
        this.outputs = outputs;
        this.error = error;
    }

    public String getId() { return id; }
    public String getTimestamp() { return timestamp; }
    public Status getStatus() { return status; }
    public String getProcess() { return process; }
    public long getDurationMs() { return durationMs; }
    public ErrorInfo getError() { return error; }
    public String getMessage() { return message; }

    public Map<String, Object> getOutputs() {
        return outputs == null ? Collections.emptyMap() : outputs;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * The value of the last expression of a {@code run_script} command, or null.
     */
    public String getConsoleOutput() {
        Object value = getOutputs().get("consoleOutput");
        return value == null ? null : value.toString();
    }

    public String getErrorMessage() {
        if (error == null || error.getMessage() == null) {
            return message != null ? message : "unknown engine error";
        }
        return error.getMessage();
    }

    @Override
    public String toString() {
        return String.format("BridgeResult[%s, %s, %dms]", id, status, durationMs);
    }
}
