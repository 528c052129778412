package pixinsight.ext.pipeline.service.bridge;

import java.io.IOException;

/**
 * Exception thrown when no terminal result arrives within a call's polling budget.
 * This is kept distinct from {@link EngineCommandException} so callers can tell a
 * silent watcher (not running, busy, or aborted by the operator) from a command
 * the engine rejected.
 */
public class BridgeTimeoutException extends IOException {

    private final String commandId;
    private final long waitedMs;

    /**
     * @param commandId correlation id of the command that timed out
     * @param waitedMs  how long the client polled before giving up
     */
    public BridgeTimeoutException(String commandId, long waitedMs) {
        super("Command " + commandId + " timed out after " + waitedMs
                + "ms. The PJSR watcher may not be running in PixInsight.");
        this.commandId = commandId;
        this.waitedMs = waitedMs;
    }

    public String getCommandId() {
        return commandId;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
