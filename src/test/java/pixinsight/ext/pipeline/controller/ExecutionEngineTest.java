package pixinsight.ext.pipeline.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pixinsight.ext.pipeline.SimulatedImageEngine;
import pixinsight.ext.pipeline.config.BranchSpec;
import pixinsight.ext.pipeline.config.OrchestratorSettings;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.PipelineConfig;
import pixinsight.ext.pipeline.config.Step;
import pixinsight.ext.pipeline.controller.workflow.StepContext;
import pixinsight.ext.pipeline.controller.workflow.StepHandler;
import pixinsight.ext.pipeline.controller.workflow.StepHandlerRegistry;
import pixinsight.ext.pipeline.model.EngineState;
import pixinsight.ext.pipeline.model.RunOutcome;
import pixinsight.ext.pipeline.model.TerminalStatus;
import pixinsight.ext.pipeline.utilities.RunLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionEngineTest {

    private static final long WARN = 100;
    private static final long ABORT = 200;

    @TempDir
    Path tempDir;

    private SimulatedImageEngine engine;
    private CheckpointStore checkpoints;
    private StepHandlerRegistry handlers;
    private ExecutionEngine executionEngine;
    private final AtomicInteger samples = new AtomicInteger();
    private volatile int abortAtSample = Integer.MAX_VALUE;

    private ScriptedHandler seed;
    private ScriptedHandler work;

    /**
     * Handler that records the steps it ran and performs a scripted action.
     */
    private static class ScriptedHandler implements StepHandler {
        interface Action {
            void run(StepContext context) throws IOException;
        }

        final List<String> ran = new ArrayList<>();
        Action action = context -> { };

        @Override
        public ParamSchema schema() {
            return ParamSchema.open();
        }

        @Override
        public void execute(StepContext context) throws IOException {
            ran.add(context.getStep().getId());
            action.run(context);
        }
    }

    @BeforeEach
    void setUp() {
        samples.set(0);
        engine = new SimulatedImageEngine();
        checkpoints = new CheckpointStore(tempDir.resolve("checkpoints"), engine, Set.of());
        ResourceMonitor monitor = new ResourceMonitor(
                () -> samples.incrementAndGet() >= abortAtSample ? ABORT + 1 : 0,
                engine, checkpoints, WARN, ABORT);

        seed = new ScriptedHandler();
        seed.action = context -> {
            String handle = context.uniqueHandle(context.targetName());
            context.forkBranch(Step.MAIN_BRANCH,
                    engine.addImage(handle, 2, 2, new double[]{0.1, 0.2, 0.3, 0.4}));
            if (context.getParams().getBoolean("ha", false)) {
                context.forkBranch("ha", engine.addImage(context.uniqueHandle("ha"), 2, 2,
                        new double[]{0.5, 0.5, 0.5, 0.5}));
            }
        };
        work = new ScriptedHandler();

        handlers = new StepHandlerRegistry();
        handlers.register("seed", seed);
        handlers.register("work", work);
        executionEngine = new ExecutionEngine(engine, handlers, checkpoints, monitor, OrchestratorSettings.defaults());
    }

    private PipelineConfig config(Map<String, BranchSpec> branches, Step... steps) {
        Map<String, String> files = new LinkedHashMap<>();
        files.put(PipelineConfig.OUTPUT_DIR_KEY, tempDir.resolve("out").toString());
        files.put(PipelineConfig.TARGET_NAME_KEY, "M81");
        return new PipelineConfig("test", files, branches, List.of(steps));
    }

    private PipelineConfig config(Step... steps) {
        return config(Map.of(), steps);
    }

    private static Step step(String id, String kind) {
        return new Step(id, kind, null);
    }

    // ==================== Normal runs ====================

    @Test
    @DisplayName("steps run in order and main is saved as <outputDir>/<targetName>.xisf")
    void completesAndSavesFinalImage() {
        RunOutcome outcome = executionEngine.run(config(step("seed", null), step("w1", "work"), step("w2", "work")), null);

        assertEquals(TerminalStatus.COMPLETED, outcome.status());
        assertEquals(0, outcome.exitCode());
        assertEquals(List.of("seed", "w1", "w2"), outcome.executedSteps());
        assertEquals(List.of("w1", "w2"), work.ran);
        assertTrue(Files.exists(tempDir.resolve("out").resolve("M81.xisf")));
        assertTrue(Files.exists(tempDir.resolve("out").resolve(RunLogger.LOG_FILE_NAME)));
    }

    @Test
    void disabledStepsAreNotRun() {
        EngineState state = new EngineState();
        RunOutcome outcome = executionEngine.run(config(step("seed", null),
                step("w1", "work").withEnabled(false), step("w2", "work")), null, state);

        assertEquals(TerminalStatus.COMPLETED, outcome.status());
        assertEquals(List.of("w2"), work.ran);
        assertEquals(List.of("w1"), state.getDisabledSteps());
    }

    @Test
    @DisplayName("a disabled step leaves the same branches and pixels as leaving it out")
    void disabledStepMatchesPipelineWithoutIt() {
        Step seedWithHa = new Step("seed", null, Map.of("ha", true));
        EngineState withDisabled = new EngineState();
        work.action = this::brightenOrSquareMain;
        executionEngine.run(config(seedWithHa,
                step("w1", "work").withMerges(List.of("ha")).withEnabled(false),
                step("w2", "work")), null, withDisabled);
        Map<String, String> disabledBranches = withDisabled.getRegistry().snapshot();
        double[] disabledPixels = engine.pixels(disabledBranches.get(Step.MAIN_BRANCH))[0].clone();

        setUp();
        work.action = this::brightenOrSquareMain;
        EngineState without = new EngineState();
        executionEngine.run(config(seedWithHa, step("w2", "work")), null, without);

        assertEquals(without.getRegistry().snapshot(), disabledBranches);
        assertEquals(Map.of(Step.MAIN_BRANCH, "M81", "ha", "ha"), disabledBranches);
        assertArrayEquals(engine.pixels(without.getRegistry().requireHandle(Step.MAIN_BRANCH))[0],
                disabledPixels, 1e-12);
        assertEquals(0.04, disabledPixels[1], 1e-12);
    }

    /** w1 adds 0.1 to main, any other work step squares it. */
    private void brightenOrSquareMain(StepContext context) {
        double[] main = engine.pixels(context.handleOf(Step.MAIN_BRANCH))[0];
        boolean brighten = context.getStep().getId().equals("w1");
        for (int i = 0; i < main.length; i++) {
            main[i] = brighten ? main[i] + 0.1 : main[i] * main[i];
        }
    }

    @Test
    @DisplayName("a failing handler turns its step into a no-op and the run goes on")
    void handlerFailureIsNotFatal() {
        work.action = context -> {
            if (context.getStep().getId().equals("w1")) {
                throw new IOException("engine error");
            }
        };

        RunOutcome outcome = executionEngine.run(config(step("seed", null), step("w1", "work"), step("w2", "work")), null);

        assertEquals(TerminalStatus.COMPLETED, outcome.status());
        assertEquals(List.of("w1"), outcome.failedSteps());
        assertEquals(List.of("seed", "w2"), outcome.executedSteps());
        assertTrue(outcome.message().contains("1 failed step"));
    }

    @Test
    void setupErrorStopsTheRun() {
        work.action = context -> {
            throw new PipelineSetupException("missing input");
        };

        RunOutcome outcome = executionEngine.run(config(step("seed", null), step("w1", "work"), step("w2", "work")), null);

        assertEquals(TerminalStatus.FAILED, outcome.status());
        assertEquals(1, outcome.exitCode());
        assertEquals("w1", outcome.stepId());
        assertEquals("missing input", outcome.message());
        assertEquals(List.of("w1"), work.ran);
    }

    @Test
    @DisplayName("an unexpected runtime error outside a handler is reported, not thrown")
    void unexpectedRuntimeErrorFailsTheRun() {
        ResourceMonitor crashing = new ResourceMonitor(() -> {
            throw new IllegalStateException("probe crashed");
        }, engine, checkpoints, WARN, ABORT);
        ExecutionEngine runner = new ExecutionEngine(engine, handlers, checkpoints, crashing,
                OrchestratorSettings.defaults());

        RunOutcome outcome = runner.run(config(step("seed", null), step("w1", "work")), null);

        assertEquals(TerminalStatus.FAILED, outcome.status());
        assertEquals(1, outcome.exitCode());
        assertEquals("seed", outcome.stepId());
        assertTrue(outcome.message().contains("probe crashed"), outcome.message());
        assertTrue(seed.ran.isEmpty());
    }

    @Test
    void unknownKindRunsAsNoOp() {
        RunOutcome outcome = executionEngine.run(config(step("seed", null), step("mystery", null)), null);
        assertEquals(TerminalStatus.COMPLETED, outcome.status());
        assertEquals(List.of("seed", "mystery"), outcome.executedSteps());
    }

    // ==================== Branches ====================

    @Test
    @DisplayName("merging a branch that is not live fails the run")
    void mergeOfMissingBranchFails() {
        RunOutcome outcome = executionEngine.run(config(step("seed", null),
                step("w1", "work").withMerges(List.of("ha"))), null);

        assertEquals(TerminalStatus.FAILED, outcome.status());
        assertEquals("w1", outcome.stepId());
        assertTrue(outcome.message().contains("merges branch 'ha'"), outcome.message());
        assertTrue(work.ran.isEmpty());
    }

    @Test
    void mergedBranchIsReleased() {
        Step seedWithHa = new Step("seed", null, Map.of("ha", true));
        EngineState state = new EngineState();

        RunOutcome outcome = executionEngine.run(config(seedWithHa,
                step("w1", "work").withMerges(List.of("ha"))), null, state);

        assertEquals(TerminalStatus.COMPLETED, outcome.status());
        assertFalse(state.getRegistry().isLive("ha"));
        assertFalse(engine.isOpen("ha"));
        assertTrue(state.getRegistry().isLive(Step.MAIN_BRANCH));
    }

    @Test
    @DisplayName("a declared branch is cloned from the step it forks after")
    void declaredBranchIsForked() {
        EngineState state = new EngineState();
        Map<String, BranchSpec> branches = Map.of("stars", new BranchSpec("Stars", "seed"));

        executionEngine.run(config(branches, step("seed", null), step("w1", "work")), null, state);

        String stars = state.getRegistry().requireHandle("stars");
        assertNotEquals(state.getRegistry().requireHandle(Step.MAIN_BRANCH), stars);
        assertEquals(0.3, engine.pixels(stars)[0][2], 1e-12);
    }

    // ==================== Restart / abort ====================

    @Test
    @DisplayName("restart restores the checkpoint and makes no calls for earlier steps")
    void restartSkipsEarlierSteps() {
        PipelineConfig config = config(step("seed", null),
                step("w1", "work").withCheckpoint(true), step("w2", "work"));
        assertEquals(TerminalStatus.COMPLETED, executionEngine.run(config, null).status());
        assertTrue(checkpoints.exists("w1"));
        seed.ran.clear();
        work.ran.clear();
        engine.clearCalls();

        EngineState state = new EngineState();
        RunOutcome outcome = executionEngine.run(config, "w1", state);

        assertEquals(TerminalStatus.COMPLETED, outcome.status());
        assertTrue(seed.ran.isEmpty());
        assertEquals(List.of("w1", "w2"), work.ran);
        assertEquals(List.of("seed"), state.getSkippedSteps());
        assertEquals("M81", state.getRegistry().requireHandle(Step.MAIN_BRANCH));
        // the final save only, no new checkpoint for the resumed step
        assertEquals(1, engine.countCalls("saveImage"));
    }

    @Test
    void restartFromUnknownStepFails() {
        RunOutcome outcome = executionEngine.run(config(step("seed", null)), "nope");
        assertEquals(TerminalStatus.FAILED, outcome.status());
        assertTrue(outcome.message().contains("unknown step 'nope'"));
        assertTrue(seed.ran.isEmpty());
    }

    @Test
    void restartWithoutCheckpointFails() {
        RunOutcome outcome = executionEngine.run(config(step("seed", null), step("w1", "work")), "w1");
        assertEquals(TerminalStatus.FAILED, outcome.status());
        assertTrue(work.ran.isEmpty());
    }

    @Test
    @DisplayName("memory above the abort threshold checkpoints and stops resumably")
    void memoryAbortIsResumable() {
        abortAtSample = 2;
        PipelineConfig config = config(step("seed", null), step("w1", "work"), step("w2", "work"));

        RunOutcome outcome = executionEngine.run(config, null);

        assertEquals(TerminalStatus.ABORTED_RESUMABLE, outcome.status());
        assertEquals(2, outcome.exitCode());
        assertEquals("w1", outcome.stepId());
        assertTrue(work.ran.isEmpty());
        assertTrue(checkpoints.exists("w1"));

        abortAtSample = Integer.MAX_VALUE;
        RunOutcome resumed = executionEngine.run(config, outcome.stepId());
        assertEquals(TerminalStatus.COMPLETED, resumed.status());
        assertEquals(List.of("w1", "w2"), work.ran);
    }

    @Test
    @DisplayName("an abort whose checkpoint could not be written is not reported as resumable")
    void abortWithoutCheckpointFails() throws IOException {
        Files.writeString(tempDir.resolve("checkpoints"), "not a directory");
        abortAtSample = 2;

        RunOutcome outcome = executionEngine.run(config(step("seed", null), step("w1", "work"), step("w2", "work")),
                null);

        assertEquals(TerminalStatus.FAILED, outcome.status());
        assertEquals(1, outcome.exitCode());
        assertEquals("w1", outcome.stepId());
        assertTrue(outcome.message().contains("checkpoint could not be saved"), outcome.message());
        assertFalse(checkpoints.exists("w1"));
        assertTrue(work.ran.isEmpty());
    }
}
