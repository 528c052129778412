package pixinsight.ext.pipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OrchestratorSettings
 *
 * <p>Loads the orchestrator's YAML settings and answers typed queries:
 *   - Parses nested YAML into a Map&lt;String,Object&gt;.
 *   - Falls back to the bundled {@code pipeline-defaults.yml} for any key the user file omits.
 *   - Offers type safe getters (getDouble, getSection, getList, etc.).
 *   - Validates that every required key resolves.
 */
public class OrchestratorSettings {
    private static final Logger logger = LoggerFactory.getLogger(OrchestratorSettings.class);

    static final String DEFAULTS_RESOURCE = "/pipeline-defaults.yml";

    private final Map<String, Object> userData;
    private final Map<String, Object> defaultData;
    private final String source;

    private OrchestratorSettings(Map<String, Object> userData, Map<String, Object> defaultData, String source) {
        this.userData = userData;
        this.defaultData = defaultData;
        this.source = source;
    }

    /**
     * Settings consisting of the bundled defaults only.
     */
    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(new LinkedHashMap<>(), loadDefaults(), "defaults");
    }

    /**
     * Loads a user settings file on top of the bundled defaults.
     *
     * @param path YAML file
     * @throws IOException if the file cannot be read or its root is not a map
     */
    public static OrchestratorSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Settings file not found: " + path);
        }
        Map<String, Object> data;
        try (InputStream in = Files.newInputStream(path)) {
            data = parse(in, path.toString());
        }
        logger.info("Loaded orchestrator settings from {}", path);
        return new OrchestratorSettings(data, loadDefaults(), path.toString());
    }

    /**
     * Builds settings from YAML text, mainly for tests.
     */
    public static OrchestratorSettings fromYaml(String yamlText) throws IOException {
        try (InputStream in = new ByteArrayInputStream(yamlText.getBytes(StandardCharsets.UTF_8))) {
            return new OrchestratorSettings(parse(in, "<inline>"), loadDefaults(), "<inline>");
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String name) throws IOException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new IOException("Error parsing YAML: " + name, e);
        }
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map)) {
            throw new IOException("YAML root is not a map: " + name);
        }
        return new LinkedHashMap<>((Map<String, Object>) loaded);
    }

    private static Map<String, Object> loadDefaults() {
        try (InputStream in = OrchestratorSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Bundled defaults {} not found on classpath", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            return parse(in, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            logger.error("Could not read bundled defaults {}", DEFAULTS_RESOURCE, e);
            return new LinkedHashMap<>();
        }
    }

    public String getSource() {
        return source;
    }

    /**
     * Retrieve a nested value, from the user file if it defines it, else from the defaults.
     *
     * @param keys Sequence of keys (e.g., "bridge", "pollIntervalMs").
     * @return The value at the end of the key path, or null if not found.
     */
    public Object getConfigItem(String... keys) {
        Object v = lookup(userData, keys);
        if (v == null) {
            v = lookup(defaultData, keys);
        }
        if (v == null) {
            logger.debug("Setting {} not found", Arrays.toString(keys));
        }
        return v;
    }

    private static Object lookup(Map<String, Object> root, String... keys) {
        Object current = root;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v != null) ? v.toString() : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Long getLong(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.longValue();
        try {
            return (v != null) ? Long.parseLong(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected long at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return v != null && Boolean.parseBoolean(v.toString());
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    // ---- typed accessors used by the entry point ----

    public Path getBridgeDir() {
        return expandHome(getString("bridge", "dir"));
    }

    public Path getCheckpointDir() {
        return expandHome(getString("checkpoints", "dir"));
    }

    public long getPollIntervalMs() {
        return orDefault(getLong("bridge", "pollIntervalMs"), 200L);
    }

    public int getShortAttempts() {
        return orDefault(getInteger("bridge", "shortAttempts"), 150);
    }

    public long getLongPollIntervalMs() {
        return orDefault(getLong("bridge", "longPollIntervalMs"), 500L);
    }

    public int getLongAttempts() {
        return orDefault(getInteger("bridge", "longAttempts"), 2400);
    }

    public long getStaleCommandAgeMs() {
        return orDefault(getLong("bridge", "staleCommandAgeMs"), 600_000L);
    }

    public Set<String> getDefaultCheckpointSteps() {
        List<Object> steps = getList("checkpoints", "defaultSteps");
        if (steps == null) {
            return Set.of();
        }
        return steps.stream().map(Object::toString).collect(Collectors.toUnmodifiableSet());
    }

    public long getMemoryWarnBytes() {
        return orDefault(getLong("memory", "warnBytes"), 18L << 30);
    }

    public long getMemoryAbortBytes() {
        return orDefault(getLong("memory", "abortBytes"), 24L << 30);
    }

    public String getMemoryProcessPattern() {
        String pattern = getString("memory", "processPattern");
        return pattern != null ? pattern : "PixInsight";
    }

    public int getStretchMaxIterations() {
        return orDefault(getInteger("stretch", "maxIterations"), 5);
    }

    public double getUniformityBoxFraction() {
        return orDefault(getDouble("uniformity", "boxFraction"), 0.1);
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static Path expandHome(String path) {
        if (path == null) {
            return null;
        }
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(1).replaceFirst("^/", ""));
        }
        return Paths.get(path);
    }

    /**
     * Checks that the keys the orchestrator cannot run without resolve and hold sane values.
     *
     * @return list of problems, empty when valid
     */
    public List<String> validateConfiguration() {
        List<String> missing = new ArrayList<>();

        String[][] required = {{"bridge", "dir"}, {"checkpoints", "dir"}};
        for (String[] path : required) {
            if (getString(path) == null) {
                missing.add(String.join(".", path));
            }
        }
        if (getMemoryWarnBytes() >= getMemoryAbortBytes()) {
            missing.add("memory.warnBytes must be below memory.abortBytes");
        }
        if (getPollIntervalMs() <= 0 || getShortAttempts() <= 0
                || getLongPollIntervalMs() <= 0 || getLongAttempts() <= 0) {
            missing.add("bridge polling values must be positive");
        }
        double box = getUniformityBoxFraction();
        if (box <= 0 || box > 0.5) {
            missing.add("uniformity.boxFraction must be in (0, 0.5]");
        }

        if (!missing.isEmpty()) {
            logger.error("Settings validation failed. Problems: {}", missing);
        } else {
            logger.info("Settings validation passed ({})", source);
        }
        return missing;
    }

    public Map<String, Object> getAllSettings() {
        return Collections.unmodifiableMap(userData);
    }
}
