package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.ParamSpec;
import pixinsight.ext.pipeline.service.ProcessCall;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one engine process on the step's branch, passing the step parameters through as
 * process properties.
 *
 * <p>A handler bound to a fixed process (e.g. {@code nxt} to NoiseXTerminator) ignores the
 * {@code process} key; the generic {@code process} kind requires it. Images the process
 * creates are closed.</p>
 */
public class ProcessStepHandler implements StepHandler {
    private static final Logger logger = LoggerFactory.getLogger(ProcessStepHandler.class);

    static final String PROCESS_KEY = "process";

    private final String processName;

    /**
     * @param processName engine process to run, or null to take it from the step's {@code process} parameter
     */
    public ProcessStepHandler(String processName) {
        this.processName = processName;
    }

    public String getProcessName() {
        return processName;
    }

    @Override
    public ParamSchema schema() {
        return processName == null
                ? ParamSchema.open(ParamSpec.required(PROCESS_KEY, ParamSpec.Type.STRING))
                : ParamSchema.open(ParamSpec.optional(PROCESS_KEY, ParamSpec.Type.STRING));
    }

    @Override
    public void execute(StepContext context) throws IOException {
        ProcessCall call = toCall(context);
        String handle = context.handle();
        logger.info("Step '{}': running {} on {}", context.getStep().getId(), call.processName(), handle);
        List<String> created = context.getEngine().runProcess(handle, call);
        for (String id : created) {
            logger.debug("Closing {} created by {}", id, call.processName());
            context.getEngine().closeImage(id);
        }
    }

    ProcessCall toCall(StepContext context) {
        Map<String, Object> properties = new LinkedHashMap<>(context.getParams().asMap());
        Object named = properties.remove(PROCESS_KEY);
        String name = processName != null ? processName : String.valueOf(named);
        return new ProcessCall(name, properties);
    }
}
