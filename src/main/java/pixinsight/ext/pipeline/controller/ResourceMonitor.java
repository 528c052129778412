package pixinsight.ext.pipeline.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.model.EngineState;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.MemoryProbe;

import java.io.IOException;

/**
 * Watches engine memory before each step.
 *
 * <ul>
 *   <li>below the warn threshold: nothing</li>
 *   <li>between warn and abort: purge the undo history of every live branch</li>
 *   <li>at or above abort: checkpoint the live branches and abort the run resumably</li>
 * </ul>
 * <p>A failed sample is logged and treated as no pressure.</p>
 */
public class ResourceMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ResourceMonitor.class);

    public enum Level {
        OK, PURGED, ABORT
    }

    private final MemoryProbe probe;
    private final ImageEngine engine;
    private final CheckpointStore checkpoints;
    private final long warnBytes;
    private final long abortBytes;

    public ResourceMonitor(MemoryProbe probe, ImageEngine engine, CheckpointStore checkpoints,
                           long warnBytes, long abortBytes) {
        if (warnBytes >= abortBytes) {
            throw new IllegalArgumentException("Warn threshold must be below abort threshold");
        }
        this.probe = probe;
        this.engine = engine;
        this.checkpoints = checkpoints;
        this.warnBytes = warnBytes;
        this.abortBytes = abortBytes;
    }

    /**
     * @param currentStepId step about to run; the resume point if the run aborts
     * @return what the monitor did
     * @throws ResumableAbortException if memory is at or above the abort threshold
     */
    public Level check(String currentStepId, EngineState state) throws ResumableAbortException {
        long used;
        try {
            used = probe.sampleBytes();
        } catch (IOException e) {
            logger.warn("Memory sample before '{}' failed: {}", currentStepId, e.getMessage());
            return Level.OK;
        }

        if (used >= abortBytes) {
            logger.error("Engine memory {} before '{}' is above the abort threshold {}",
                    gib(used), currentStepId, gib(abortBytes));
            boolean saved = false;
            try {
                checkpoints.save(currentStepId, state.getRegistry());
                saved = true;
            } catch (IOException e) {
                logger.error("Could not checkpoint before aborting at '{}'", currentStepId, e);
            }
            throw new ResumableAbortException(currentStepId, used, saved);
        }

        if (used >= warnBytes) {
            logger.warn("Engine memory {} before '{}' is above {}; purging history of {}",
                    gib(used), currentStepId, gib(warnBytes), state.getRegistry().branches());
            for (String handle : state.getRegistry().handles()) {
                try {
                    engine.purgeHistory(handle);
                } catch (IOException e) {
                    logger.warn("History purge of {} failed: {}", handle, e.getMessage());
                }
            }
            try {
                logger.info("Engine memory after purge: {}", gib(probe.sampleBytes()));
            } catch (IOException e) {
                logger.warn("Memory re-sample failed: {}", e.getMessage());
            }
            return Level.PURGED;
        }

        logger.debug("Engine memory before '{}': {}", currentStepId, gib(used));
        return Level.OK;
    }

    private static String gib(long bytes) {
        return String.format("%.2f GiB", bytes / (double) (1L << 30));
    }
}
