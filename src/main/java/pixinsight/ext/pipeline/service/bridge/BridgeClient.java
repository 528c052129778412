package pixinsight.ext.pipeline.service.bridge;

import java.io.IOException;

/**
 * Request/response channel to the engine.
 *
 * <p>Exactly one command is in flight at a time. Implementations block until a
 * terminal result correlated by command id arrives, or throw
 * {@link BridgeTimeoutException} once the polling budget of the given
 * {@link CallClass} is exhausted. There is no retry.</p>
 */
public interface BridgeClient {

    /**
     * Sends a command and waits for its terminal result (success or error).
     *
     * @param command   command document to dispatch
     * @param callClass polling budget to apply
     * @return the terminal result
     * @throws BridgeTimeoutException if no terminal result arrives in time
     * @throws IOException            if the command cannot be written or the result read
     */
    BridgeResult send(BridgeCommand command, CallClass callClass) throws IOException;

    /**
     * Sends a command and converts an error result into an {@link EngineCommandException}.
     *
     * @return the successful result
     */
    default BridgeResult execute(BridgeCommand command, CallClass callClass) throws IOException {
        BridgeResult result = send(command, callClass);
        if (!result.isSuccess()) {
            BridgeResult.ErrorInfo error = result.getError();
            throw new EngineCommandException(
                    command.getTool() + " failed: " + result.getErrorMessage(),
                    error != null ? error.getType() : null);
        }
        return result;
    }
}
