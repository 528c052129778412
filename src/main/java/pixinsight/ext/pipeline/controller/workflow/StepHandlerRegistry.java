package pixinsight.ext.pipeline.controller.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixinsight.ext.pipeline.config.ParamSchema;
import pixinsight.ext.pipeline.config.SchemaResolver;
import pixinsight.ext.pipeline.config.Step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry mapping step-kind prefixes to {@link StepHandler}s.
 *
 * <h3>Resolution</h3>
 * <p>A step's kind (its {@code kind} field, or its id when no kind is given) is trimmed,
 * lower-cased and matched against the registered prefixes; the longest matching prefix wins, so
 * {@code nxt_linear} resolves to the handler registered for {@code nxt} and
 * {@code star_recombine} is not mistaken for {@code star_removal}. Unknown kinds resolve to
 * a {@link NoOpStepHandler} at run time and are reported as configuration problems at load
 * time, through the {@link SchemaResolver} view of this registry.</p>
 *
 * <h3>Built-in kinds</h3>
 * <ul>
 *   <li>{@code open}, {@code combine}: channel files into the {@code main} image</li>
 *   <li>{@code gradient}, {@code abe}, {@code gc}: gradient removal with candidate selection</li>
 *   <li>{@code process} and the process shortcuts {@code bxt}, {@code nxt}, {@code spcc},
 *       {@code scnr}, {@code curves}, {@code hdrmt}, {@code lhe}</li>
 *   <li>{@code sxt}, {@code star_removal}: star removal forking the {@code stars} branch</li>
 *   <li>{@code stretch}: auto or statistical stretch plus GHS passes</li>
 *   <li>{@code ha_inject}, {@code star_recombine}, {@code recombine}: branch merges</li>
 *   <li>{@code save}: write a branch to the output directory</li>
 * </ul>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * StepHandlerRegistry registry = StepHandlerRegistry.withDefaults();
 * registry.register("deconv", new ProcessStepHandler("Deconvolution"));
 * StepHandler handler = registry.getHandler("nxt_linear");  // NoiseXTerminator step
 * }</pre>
 *
 * <p>Registries are plain instances; the run loop and the configuration loader share the
 * one built by the entry point.</p>
 *
 * @see StepHandler
 */
public class StepHandlerRegistry implements SchemaResolver {
    private static final Logger logger = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<String, StepHandler> handlers = new LinkedHashMap<>();
    private final StepHandler noOp = new NoOpStepHandler();

    /**
     * Registry with the built-in step kinds.
     */
    public static StepHandlerRegistry withDefaults() {
        StepHandlerRegistry registry = new StepHandlerRegistry();
        StepHandler open = new OpenChannelsStepHandler();
        registry.register("open", open);
        registry.register("combine", open);

        StepHandler gradient = new GradientStepHandler();
        registry.register("gradient", gradient);
        registry.register("abe", gradient);
        registry.register("gc", gradient);

        registry.register("process", new ProcessStepHandler(null));
        registry.register("bxt", new ProcessStepHandler("BlurXTerminator"));
        registry.register("nxt", new ProcessStepHandler("NoiseXTerminator"));
        registry.register("spcc", new ProcessStepHandler("SpectrophotometricColorCalibration"));
        registry.register("scnr", new ProcessStepHandler("SCNR"));
        registry.register("curves", new ProcessStepHandler("CurvesTransformation"));
        registry.register("hdrmt", new ProcessStepHandler("HDRMultiscaleTransform"));
        registry.register("lhe", new ProcessStepHandler("LocalHistogramEqualization"));

        StepHandler starRemoval = new StarRemovalStepHandler();
        registry.register("sxt", starRemoval);
        registry.register("star_removal", starRemoval);

        registry.register("stretch", new StretchStepHandler());
        registry.register("ha_inject", new HaInjectionStepHandler());

        StepHandler recombine = new StarRecombineStepHandler();
        registry.register("star_recombine", recombine);
        registry.register("recombine", recombine);

        registry.register("save", new SaveStepHandler());
        logger.info("Step handler registry initialised with {} kinds", registry.handlers.size());
        return registry;
    }

    /**
     * Registers a handler for step kinds starting with {@code prefix}. Replaces any handler
     * already registered for the same prefix.
     */
    public void register(String prefix, StepHandler handler) {
        if (prefix == null || prefix.trim().isEmpty()) {
            logger.warn("Attempted to register handler with null or empty prefix - ignoring registration");
            return;
        }
        if (handler == null) {
            logger.warn("Attempted to register null handler for prefix '{}' - ignoring registration", prefix);
            return;
        }
        String normalized = prefix.toLowerCase(Locale.ROOT).trim();
        StepHandler existing = handlers.put(normalized, handler);
        if (existing != null) {
            logger.warn("Replaced handler for prefix '{}': {} -> {}", normalized,
                    existing.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            logger.debug("Registered step handler for prefix '{}': {}", normalized, handler.getClass().getSimpleName());
        }
    }

    /**
     * Handler for the longest registered prefix of {@code kind}, if any.
     */
    public Optional<StepHandler> find(String kind) {
        if (kind == null || kind.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = kind.toLowerCase(Locale.ROOT).trim();
        String bestPrefix = null;
        for (String prefix : handlers.keySet()) {
            if (normalized.startsWith(prefix) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                bestPrefix = prefix;
            }
        }
        return bestPrefix == null ? Optional.empty() : Optional.of(handlers.get(bestPrefix));
    }

    /**
     * Handler for a kind, or the no-op handler when nothing matches. Never null.
     */
    public StepHandler getHandler(String kind) {
        Optional<StepHandler> handler = find(kind);
        if (handler.isEmpty()) {
            logger.warn("No registered handler found for kind '{}' - returning no-op handler. Registered prefixes: {}",
                    kind, handlers.keySet());
        }
        return handler.orElse(noOp);
    }

    public StepHandler getHandler(Step step) {
        return getHandler(step.getKind());
    }

    @Override
    public Optional<ParamSchema> schemaFor(Step step) {
        return find(step.getKind()).map(StepHandler::schema);
    }

    public Set<String> getPrefixes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
