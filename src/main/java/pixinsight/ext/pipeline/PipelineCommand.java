package pixinsight.ext.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import pixinsight.ext.pipeline.config.OrchestratorSettings;
import pixinsight.ext.pipeline.config.PipelineConfig;
import pixinsight.ext.pipeline.config.PipelineConfigLoader;
import pixinsight.ext.pipeline.config.PipelineConfigurationException;
import pixinsight.ext.pipeline.controller.CheckpointManifest;
import pixinsight.ext.pipeline.controller.CheckpointStore;
import pixinsight.ext.pipeline.controller.ExecutionEngine;
import pixinsight.ext.pipeline.controller.ResourceMonitor;
import pixinsight.ext.pipeline.controller.workflow.StepHandlerRegistry;
import pixinsight.ext.pipeline.model.RunOutcome;
import pixinsight.ext.pipeline.model.TerminalStatus;
import pixinsight.ext.pipeline.service.BridgeImageEngine;
import pixinsight.ext.pipeline.service.ImageEngine;
import pixinsight.ext.pipeline.service.PsMemoryProbe;
import pixinsight.ext.pipeline.service.bridge.FileBridgeClient;
import pixinsight.ext.pipeline.service.bridge.FileBridgeClient.PollBudget;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <pre>
 * pixinsight-pipeline --config pipeline.json [--restart-from stepId] [--settings settings.yml]
 * pixinsight-pipeline --list-checkpoints
 * </pre>
 *
 * Exit codes: 0 completed, 1 failed, 2 aborted on memory pressure (resumable).
 */
@Command(
        name = "pixinsight-pipeline",
        mixinStandardHelpOptions = true,
        version = "pixinsight-pipeline 0.3.0",
        description = "Runs a branching PixInsight processing pipeline through the file bridge watcher.",
        showDefaultValues = true)
public class PipelineCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(PipelineCommand.class);

    static final int MEMORY_PROBE_TIMEOUT_SEC = 10;

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "Pipeline configuration (JSON).")
    Path configFile;

    @Option(names = "--restart-from", paramLabel = "STEP",
            description = "Resume at this step from its checkpoint.")
    String restartFrom;

    @Option(names = "--settings", paramLabel = "FILE",
            description = "Orchestrator settings (YAML); unset keys fall back to the built-in defaults.")
    Path settingsFile;

    @Option(names = "--validate", description = "Only load and validate the pipeline configuration.")
    boolean validateOnly;

    @Option(names = "--list-checkpoints", description = "List saved checkpoints and exit.")
    boolean listCheckpoints;

    @Option(names = "--clear-checkpoints", description = "Delete all saved checkpoints and exit.")
    boolean clearCheckpoints;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PipelineCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        OrchestratorSettings settings = settingsFile != null
                ? OrchestratorSettings.load(settingsFile)
                : OrchestratorSettings.defaults();
        List<String> settingProblems = settings.validateConfiguration();
        if (!settingProblems.isEmpty()) {
            settingProblems.forEach(p -> err.println("Settings: " + p));
            return TerminalStatus.FAILED.getExitCode();
        }

        FileBridgeClient bridge = new FileBridgeClient(settings.getBridgeDir(),
                new PollBudget(settings.getPollIntervalMs(), settings.getShortAttempts()),
                new PollBudget(settings.getLongPollIntervalMs(), settings.getLongAttempts()),
                settings.getStaleCommandAgeMs());
        ImageEngine engine = new BridgeImageEngine(bridge);
        CheckpointStore checkpoints = new CheckpointStore(settings.getCheckpointDir(), engine,
                settings.getDefaultCheckpointSteps());

        if (listCheckpoints) {
            Map<String, CheckpointManifest> manifests = checkpoints.list();
            if (manifests.isEmpty()) {
                out.println("No checkpoints in " + checkpoints.getDirectory());
            }
            manifests.forEach((stepId, manifest) -> out.printf("%-24s %s  %s%n",
                    stepId, manifest.getTimestamp(), manifest.getImages().keySet()));
            return TerminalStatus.COMPLETED.getExitCode();
        }
        if (clearCheckpoints) {
            out.println("Deleted " + checkpoints.clear() + " file(s) from " + checkpoints.getDirectory());
            return TerminalStatus.COMPLETED.getExitCode();
        }
        if (configFile == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--config=FILE'");
        }

        StepHandlerRegistry handlers = StepHandlerRegistry.withDefaults();
        PipelineConfig config;
        try {
            config = new PipelineConfigLoader(handlers).load(configFile);
        } catch (PipelineConfigurationException e) {
            err.println("Invalid pipeline configuration " + configFile + ":");
            e.getProblems().forEach(p -> err.println("  - " + p));
            return TerminalStatus.FAILED.getExitCode();
        }
        if (validateOnly) {
            out.println("Pipeline '" + config.getName() + "' is valid (" + config.getSteps().size() + " steps)");
            return TerminalStatus.COMPLETED.getExitCode();
        }

        bridge.ensureDirectories();
        bridge.cleanStaleCommands();
        if (!bridge.isWatcherAlive()) {
            logger.warn("No watcher answered in {}; is the PixInsight watcher script running?", settings.getBridgeDir());
        }

        ResourceMonitor monitor = new ResourceMonitor(
                new PsMemoryProbe(settings.getMemoryProcessPattern(), MEMORY_PROBE_TIMEOUT_SEC),
                engine, checkpoints, settings.getMemoryWarnBytes(), settings.getMemoryAbortBytes());
        ExecutionEngine executionEngine = new ExecutionEngine(engine, handlers, checkpoints, monitor, settings);

        RunOutcome outcome = executionEngine.run(config, restartFrom);
        (outcome.status() == TerminalStatus.COMPLETED ? out : err).println(outcome.message());
        if (outcome.status() == TerminalStatus.ABORTED_RESUMABLE) {
            err.println("Resume with: --config " + configFile + " --restart-from " + outcome.stepId());
        }
        return outcome.exitCode();
    }
}
