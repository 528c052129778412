package pixinsight.ext.pipeline.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.OrchestratorSettings;
import pixinsight.ext.pipeline.config.PipelineConfig;
import pixinsight.ext.pipeline.config.PipelineConfigurationException;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.controller.workflow.StepContext;
import pixinsight.ext.pipeline.controller.workflow.StepHandler;
import pixinsight.ext.pipeline.controller.workflow.StepHandlerRegistry;
import pixinsight.ext.pipeline.model.EngineState;
import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.model.LiveImageRegistry;
import pixinsight.ext.pipeline.model.RunOutcome;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.utilities.RunLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Walks a pipeline's steps in order and drives the image engine through them.
 *
 * <h3>Step sequence</h3>
 * <p>For every step that is neither skipped by a restart nor disabled:</p>
 * <ol>
 *   <li>the {@link ResourceMonitor} samples engine memory and may purge or abort</li>
 *   <li>a checkpoint of the live branches is saved when the checkpoint policy matches
 *       (not for the step a restart resumes at, whose checkpoint was just restored)</li>
 *   <li>every branch the step merges must be live, otherwise the run stops</li>
 *   <li>the step's handler runs; a failure is logged and the step becomes a no-op</li>
 *   <li>merged branches are closed and forgotten, branches declared to fork after the
 *       step are cloned from the step's branch</li>
 * </ol>
 * <p>Steps before a restart point cause no engine calls at all. A disabled step is skipped
 * entirely, so the run behaves as if it were absent from the configuration. After the last
 * step the {@code main} branch is saved to {@code <outputDir>/<targetName>.xisf}.</p>
 *
 * <h3>Outcomes</h3>
 * <ul>
 *   <li>{@code COMPLETED} (exit 0): every step ran or was turned into a no-op</li>
 *   <li>{@code FAILED} (exit 1): configuration or setup errors, a missing restart checkpoint,
 *       bridge failures outside a handler, unexpected runtime errors, and memory aborts
 *       whose checkpoint could not be written</li>
 *   <li>{@code ABORTED_RESUMABLE} (exit 2): memory crossed the abort threshold and the live
 *       branches were checkpointed before the reported step</li>
 * </ul>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ExecutionEngine runner = new ExecutionEngine(engine, StepHandlerRegistry.withDefaults(),
 *         checkpoints, monitor, settings);
 * RunOutcome outcome = runner.run(config, restartFrom);
 * System.exit(outcome.exitCode());
 * }</pre>
 *
 * <p>The engine itself keeps no run state; everything lives in the {@link EngineState}
 * passed through {@link #run(PipelineConfig, String, EngineState)}. The whole run is logged
 * to {@code <outputDir>/pipeline.log} through a {@link RunLogger} session.</p>
 */
public class ExecutionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionEngine.class);

    public static final String FINAL_EXTENSION = ".xisf";

    private final ImageEngine engine;
    private final StepHandlerRegistry handlers;
    private final CheckpointStore checkpoints;
    private final ResourceMonitor monitor;
    private final OrchestratorSettings settings;

    public ExecutionEngine(ImageEngine engine, StepHandlerRegistry handlers, CheckpointStore checkpoints,
                           ResourceMonitor monitor, OrchestratorSettings settings) {
        this.engine = engine;
        this.handlers = handlers;
        this.checkpoints = checkpoints;
        this.monitor = monitor;
        this.settings = settings;
    }

    /**
     * Runs a pipeline with fresh state.
     *
     * @param restartFrom step id to resume at from its checkpoint, or null to run from the start
     */
    public RunOutcome run(PipelineConfig config, String restartFrom) {
        return run(config, restartFrom, new EngineState());
    }

    /**
     * Runs a pipeline, recording progress in {@code state}. Problems are reported in the
     * returned outcome, including unexpected runtime errors; nothing is thrown.
     */
    public RunOutcome run(PipelineConfig config, String restartFrom, EngineState state) {
        Path outputDir = prepareOutputDir(config);
        try (RunLogger.Session session = RunLogger.start(outputDir)) {
            logger.info("Starting pipeline '{}' ({} steps){}", config.getName(), config.getSteps().size(),
                    restartFrom != null ? ", restarting from '" + restartFrom + "'" : "");
            RunOutcome outcome = execute(config, restartFrom, state);
            switch (outcome.status()) {
                case COMPLETED -> logger.info(outcome.message());
                case FAILED -> logger.error("Pipeline failed at step '{}': {}", outcome.stepId(), outcome.message());
                case ABORTED_RESUMABLE -> logger.warn("Pipeline aborted at step '{}': {}",
                        outcome.stepId(), outcome.message());
            }
            return outcome;
        }
    }

    private RunOutcome execute(PipelineConfig config, String restartFrom, EngineState state) {
        LiveImageRegistry registry = state.getRegistry();
        try {
            int restartIndex = 0;
            if (restartFrom != null) {
                restartIndex = config.indexOf(restartFrom);
                if (restartIndex < 0) {
                    throw new PipelineSetupException("Cannot restart from unknown step '" + restartFrom + "'");
                }
                state.setCurrentStepId(restartFrom);
                checkpoints.restore(restartFrom, registry);
            }

            List<Step> steps = config.getSteps();
            for (int i = 0; i < steps.size(); i++) {
                Step step = steps.get(i);
                if (i < restartIndex) {
                    logger.debug("Skipping step '{}' (before restart point)", step.getId());
                    state.markSkipped(step.getId());
                    continue;
                }
                if (!step.isEnabled()) {
                    logger.info("Step '{}' is disabled", step.getId());
                    state.markDisabled(step.getId());
                    continue;
                }
                boolean resumedHere = restartFrom != null && i == restartIndex;
                runStep(config, step, state, resumedHere);
            }

            finalSave(config, registry);
            return RunOutcome.completed(state.getExecutedSteps(), state.getFailedSteps());
        } catch (ResumableAbortException e) {
            if (!e.isCheckpointSaved()) {
                return RunOutcome.failed(e.getStepId(), e.getMessage(), state.getExecutedSteps(), state.getFailedSteps());
            }
            return RunOutcome.aborted(e.getStepId(), e.getMessage(), state.getExecutedSteps(), state.getFailedSteps());
        } catch (PipelineConfigurationException e) {
            return RunOutcome.failed(state.getCurrentStepId(), String.join("; ", e.getProblems()),
                    state.getExecutedSteps(), state.getFailedSteps());
        } catch (PipelineSetupException | IOException e) {
            return RunOutcome.failed(state.getCurrentStepId(), e.getMessage(),
                    state.getExecutedSteps(), state.getFailedSteps());
        } catch (RuntimeException e) {
            logger.error("Unexpected error at step '{}'", state.getCurrentStepId(), e);
            return RunOutcome.failed(state.getCurrentStepId(), e.getClass().getSimpleName() + ": " + e.getMessage(),
                    state.getExecutedSteps(), state.getFailedSteps());
        }
    }

    private void runStep(PipelineConfig config, Step step, EngineState state, boolean resumedHere)
            throws ResumableAbortException {
        String stepId = step.getId();
        LiveImageRegistry registry = state.getRegistry();
        state.setCurrentStepId(stepId);
        logger.info("Step '{}'{}", stepId, step.getLabel() != null ? " (" + step.getLabel() + ")" : "");

        monitor.check(stepId, state);

        if (!resumedHere && checkpoints.shouldCheckpoint(step)) {
            try {
                checkpoints.save(stepId, registry);
            } catch (IOException e) {
                logger.warn("Step '{}': checkpoint could not be saved: {}", stepId, e.getMessage());
            }
        }

        for (String merged : step.getMerges()) {
            if (!registry.isLive(merged)) {
                throw new PipelineConfigurationException("Step '" + stepId + "' merges branch '" + merged
                        + "' which has no live image");
            }
        }

        StepHandler handler = handlers.getHandler(step);
        try {
            handler.execute(new StepContext(step, config, engine, state, settings));
        } catch (PipelineSetupException | PipelineConfigurationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            logger.warn("Step '{}' failed and was skipped: {}", stepId, e.getMessage());
            logger.debug("Step '{}' failure", stepId, e);
            state.markFailed(stepId);
            return;
        }

        for (String merged : step.getMerges()) {
            registry.remove(merged).ifPresent(handle -> closeQuietly(stepId, handle));
        }
        forkDeclaredBranches(config, step, registry);
        state.markExecuted(stepId);
    }

    /**
     * Creates branches declared to fork after {@code step} that the handler did not create itself.
     */
    private void forkDeclaredBranches(PipelineConfig config, Step step, LiveImageRegistry registry) {
        for (String branchId : config.branchesForkingAfter(step.getId())) {
            if (registry.isLive(branchId)) {
                continue;
            }
            Optional<String> source = registry.handleOf(step.getBranchId());
            if (source.isEmpty()) {
                logger.warn("Cannot fork branch '{}' after step '{}': branch '{}' has no live image",
                        branchId, step.getId(), step.getBranchId());
                continue;
            }
            try {
                List<String> open = engine.listImages().stream().map(ImageInfo::id).toList();
                String handle = engine.cloneImage(source.get(), registry.uniqueHandle(branchId, open));
                registry.register(branchId, handle);
                logger.info("Forked branch '{}' from '{}' as {}", branchId, step.getBranchId(), handle);
            } catch (IOException e) {
                logger.warn("Could not fork branch '{}' after step '{}': {}", branchId, step.getId(), e.getMessage());
            }
        }
    }

    private void finalSave(PipelineConfig config, LiveImageRegistry registry) throws IOException {
        String outputDir = config.getOutputDir();
        String targetName = config.getTargetName();
        if (outputDir == null || outputDir.isBlank() || targetName == null || targetName.isBlank()) {
            logger.info("No outputDir/targetName configured; skipping final save");
            return;
        }
        Optional<String> main = registry.handleOf(Step.MAIN_BRANCH);
        if (main.isEmpty()) {
            logger.warn("No live main image; nothing to save");
            return;
        }
        Path file = Paths.get(outputDir).resolve(targetName + FINAL_EXTENSION);
        Files.createDirectories(file.getParent());
        String saved = engine.saveImage(main.get(), file);
        if (!saved.equals(main.get())) {
            registry.replace(Step.MAIN_BRANCH, saved);
        }
        logger.info("Saved final image to {}", file);
    }

    private static Path prepareOutputDir(PipelineConfig config) {
        String dir = config.getOutputDir();
        if (dir == null || dir.isBlank()) {
            return null;
        }
        Path path = Paths.get(dir);
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            logger.warn("Could not create output directory {}: {}", path, e.getMessage());
        }
        return path;
    }

    private void closeQuietly(String stepId, String handle) {
        try {
            engine.closeImage(handle);
        } catch (IOException e) {
            logger.warn("Step '{}': could not close merged image {}: {}", stepId, handle, e.getMessage());
        }
    }
}
