package pixinsight.ext.pipeline.service.bridge;

import java.io.IOException;

/**
 * Exception thrown when the engine answers a command with an error result.
 * Used to distinguish between communication problems and commands the engine
 * accepted but could not execute (missing view, bad expression, process failure).
 */
public class EngineCommandException extends IOException {

    private final String errorType;

    /**
     * Constructs a new engine command exception.
     *
     * @param message   the engine's error message
     * @param errorType the engine's error type, may be null
     */
    public EngineCommandException(String message, String errorType) {
        super(message);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
