package pixinsight.ext.pipeline.controller.workflow;

import pixinsight.ext.pipeline.config.OrchestratorSettings;
import pixinsight.ext.pipeline.config.PipelineConfig;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.config.StepParams;
import pixinsight.ext.pipeline.controller.PipelineSetupException;
import pixinsight.ext.pipeline.model.EngineState;
import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.model.LiveImageRegistry;
import pixinsight.ext.pipeline.service.ImageEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Everything a handler may use while executing one step.
 *
 * <p>Branch handles are read and written only through this class, backed by the run's
 * {@link LiveImageRegistry}.</p>
 */
public class StepContext {

    private final Step step;
    private final PipelineConfig config;
    private final ImageEngine engine;
    private final EngineState state;
    private final OrchestratorSettings settings;

    public StepContext(Step step, PipelineConfig config, ImageEngine engine, EngineState state,
                       OrchestratorSettings settings) {
        this.step = step;
        this.config = config;
        this.engine = engine;
        this.state = state;
        this.settings = settings;
    }

    public Step getStep() {
        return step;
    }

    public StepParams getParams() {
        return step.getParams();
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public ImageEngine getEngine() {
        return engine;
    }

    public OrchestratorSettings getSettings() {
        return settings;
    }

    /**
     * Handle of the branch the step runs on.
     */
    public String handle() {
        return handleOf(step.getBranchId());
    }

    /**
     * @throws IllegalStateException if the branch has no live image
     */
    public String handleOf(String branchId) {
        return state.getRegistry().requireHandle(branchId);
    }

    public Optional<String> findHandle(String branchId) {
        return state.getRegistry().handleOf(branchId);
    }

    public boolean isLive(String branchId) {
        return state.getRegistry().isLive(branchId);
    }

    /**
     * Registers a new branch.
     */
    public void forkBranch(String branchId, String handle) {
        state.getRegistry().register(branchId, handle);
    }

    /**
     * Points an existing branch at a new handle.
     */
    public void replaceHandle(String branchId, String handle) {
        state.getRegistry().replace(branchId, handle);
    }

    /**
     * Forgets every branch, used when a step rebuilds the working set from scratch.
     * Does not close anything in the engine.
     */
    public void resetBranches() {
        state.getRegistry().clear();
    }

    /**
     * The run's registry, for collaborators that derive scratch handles from it.
     */
    public LiveImageRegistry getRegistry() {
        return state.getRegistry();
    }

    /**
     * A handle id not used by any branch or any image open in the engine.
     */
    public String uniqueHandle(String base) throws IOException {
        List<String> open = engine.listImages().stream().map(ImageInfo::id).toList();
        return state.getRegistry().uniqueHandle(base, open);
    }

    /**
     * @throws PipelineSetupException if the config has no output directory
     */
    public Path outputDir() {
        String dir = config.getOutputDir();
        if (dir == null || dir.isBlank()) {
            throw new PipelineSetupException("Step '" + step.getId() + "' needs files.outputDir");
        }
        return Paths.get(dir);
    }

    public String targetName() {
        String name = config.getTargetName();
        return name != null && !name.isBlank() ? name : "image";
    }
}
