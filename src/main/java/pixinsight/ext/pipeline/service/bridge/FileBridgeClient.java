package pixinsight.ext.pipeline.service.bridge;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * File-based client for communicating with the PJSR watcher running inside PixInsight.
 *
 * <p>A command is written as {@code <bridgeDir>/commands/<id>.json}; the watcher answers
 * with {@code <bridgeDir>/results/<id>.json}. The client polls for the result at a fixed
 * interval up to a maximum number of attempts that depends on the {@link CallClass}, skips
 * {@code running} progress reports, and deletes the result once consumed.</p>
 *
 * <p>Key properties:</p>
 * <ul>
 *   <li>Commands are written to a temporary name and moved into place, so the watcher
 *       never reads a partial document</li>
 *   <li>A partially written result is re-read on the next poll</li>
 *   <li>No retry: a timeout surfaces as {@link BridgeTimeoutException}</li>
 * </ul>
 *
 * @since 0.1.0
 */
public class FileBridgeClient implements BridgeClient {
    private static final Logger logger = LoggerFactory.getLogger(FileBridgeClient.class);

    /** Commands older than this are considered abandoned. */
    public static final long DEFAULT_STALE_COMMAND_AGE_MS = 600_000;

    /**
     * Poll interval and attempt cap for one call class.
     */
    public record PollBudget(long pollIntervalMs, int maxAttempts) {
        public PollBudget {
            if (pollIntervalMs <= 0 || maxAttempts <= 0) {
                throw new IllegalArgumentException("Poll budget must be positive: "
                        + pollIntervalMs + "ms x " + maxAttempts);
            }
        }

        public long timeoutMs() {
            return pollIntervalMs * maxAttempts;
        }
    }

    private final Path commandsDir;
    private final Path resultsDir;
    private final Path logsDir;
    private final PollBudget shortBudget;
    private final PollBudget longBudget;
    private final long staleCommandAgeMs;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Creates a client with the default budgets: 200ms x 150 for short calls and
     * 500ms x 2400 for long-running processes.
     *
     * @param bridgeDir root of the bridge exchange directory
     */
    public FileBridgeClient(Path bridgeDir) {
        this(bridgeDir, new PollBudget(200, 150), new PollBudget(500, 2400), DEFAULT_STALE_COMMAND_AGE_MS);
    }

    /**
     * @param bridgeDir         root of the bridge exchange directory
     * @param shortBudget       polling budget for {@link CallClass#SHORT}
     * @param longBudget        polling budget for {@link CallClass#LONG}
     * @param staleCommandAgeMs age above which unanswered commands are removed by {@link #cleanStaleCommands()}
     */
    public FileBridgeClient(Path bridgeDir, PollBudget shortBudget, PollBudget longBudget, long staleCommandAgeMs) {
        this.commandsDir = bridgeDir.resolve("commands");
        this.resultsDir = bridgeDir.resolve("results");
        this.logsDir = bridgeDir.resolve("logs");
        this.shortBudget = shortBudget;
        this.longBudget = longBudget;
        this.staleCommandAgeMs = staleCommandAgeMs;
    }

    /**
     * Creates the commands, results and logs directories if needed.
     */
    public void ensureDirectories() throws IOException {
        Files.createDirectories(commandsDir);
        Files.createDirectories(resultsDir);
        Files.createDirectories(logsDir);
    }

    @Override
    public BridgeResult send(BridgeCommand command, CallClass callClass) throws IOException {
        ensureDirectories();
        writeCommand(command);
        logger.debug("Sent {} ({})", command, callClass);
        PollBudget budget = callClass == CallClass.LONG ? longBudget : shortBudget;
        return awaitResult(command.getId(), budget);
    }

    private void writeCommand(BridgeCommand command) throws IOException {
        Path target = commandsDir.resolve(command.getId() + ".json");
        Path temp = commandsDir.resolve(command.getId() + ".json.tmp");
        Files.writeString(temp, gson.toJson(command), StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private BridgeResult awaitResult(String id, PollBudget budget) throws IOException {
        Path resultPath = resultsDir.resolve(id + ".json");
        long start = System.currentTimeMillis();

        for (int attempt = 0; attempt < budget.maxAttempts(); attempt++) {
            if (Files.exists(resultPath)) {
                BridgeResult result = tryReadResult(resultPath);
                if (result != null && result.getStatus() != null && result.getStatus().isTerminal()) {
                    try {
                        Files.deleteIfExists(resultPath);
                    } catch (IOException e) {
                        logger.warn("Could not delete consumed result {}: {}", resultPath, e.getMessage());
                    }
                    logger.debug("Result for {}: {} after {}ms", id, result.getStatus(),
                            System.currentTimeMillis() - start);
                    return result;
                }
                if (result != null && result.getMessage() != null) {
                    logger.trace("Command {} still running: {}", id, result.getMessage());
                }
            }
            sleep(budget.pollIntervalMs());
        }

        withdrawCommand(id);
        throw new BridgeTimeoutException(id, System.currentTimeMillis() - start);
    }

    /**
     * Deletes an unanswered command file so the watcher cannot run it after the caller gave up.
     */
    private void withdrawCommand(String id) {
        Path commandPath = commandsDir.resolve(id + ".json");
        try {
            if (Files.deleteIfExists(commandPath)) {
                logger.debug("Withdrew unanswered command {}", id);
            }
        } catch (IOException e) {
            logger.warn("Could not withdraw timed-out command {}: {}", id, e.getMessage());
        }
    }

    private BridgeResult tryReadResult(Path resultPath) {
        try {
            String json = Files.readString(resultPath, StandardCharsets.UTF_8);
            return gson.fromJson(json, BridgeResult.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException | JsonParseException e) {
            // still being written by the watcher
            logger.trace("Result {} not readable yet: {}", resultPath.getFileName(), e.getMessage());
            return null;
        }
    }

    private static void sleep(long ms) throws IOException {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for bridge result", e);
        }
    }

    /**
     * Sends a trivial command with the short budget.
     *
     * @return true if the watcher answered successfully
     */
    public boolean isWatcherAlive() {
        try {
            return send(BridgeCommand.global("list_open_images", "__internal__", null), CallClass.SHORT).isSuccess();
        } catch (IOException e) {
            logger.debug("Watcher ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Removes command files nobody picked up: older than the stale age, or unparsable.
     *
     * @return number of files removed
     */
    public int cleanStaleCommands() {
        if (!Files.isDirectory(commandsDir)) {
            return 0;
        }
        int cleaned = 0;
        long now = System.currentTimeMillis();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(commandsDir, "*.json")) {
            for (Path file : files) {
                if (isStale(file, now)) {
                    Files.deleteIfExists(file);
                    cleaned++;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to clean stale commands in {}: {}", commandsDir, e.getMessage());
        }
        if (cleaned > 0) {
            logger.info("Removed {} stale command file(s) from {}", cleaned, commandsDir);
        }
        return cleaned;
    }

    private boolean isStale(Path file, long now) {
        try {
            BridgeCommand command = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), BridgeCommand.class);
            if (command == null || command.getTimestamp() == null) {
                return true;
            }
            long age = now - Instant.parse(command.getTimestamp()).toEpochMilli();
            return age > staleCommandAgeMs;
        } catch (IOException | JsonParseException | DateTimeParseException e) {
            return true;
        }
    }

    public Path getCommandsDir() {
        return commandsDir;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public PollBudget getBudget(CallClass callClass) {
        return callClass == CallClass.LONG ? longBudget : shortBudget;
    }
}
