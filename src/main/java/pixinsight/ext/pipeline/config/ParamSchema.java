package pixinsight.ext.pipeline.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter schema of one step kind.
 *
 * <p>Open schemas accept keys they do not declare; the generic process step uses
 * one because engine process properties are passed through verbatim.</p>
 */
public class ParamSchema {

    private final Map<String, ParamSpec> specs = new LinkedHashMap<>();
    private final boolean open;

    private ParamSchema(List<ParamSpec> specs, boolean open) {
        for (ParamSpec spec : specs) {
            this.specs.put(spec.name(), spec);
        }
        this.open = open;
    }

    public static ParamSchema of(ParamSpec... specs) {
        return new ParamSchema(List.of(specs), false);
    }

    public static ParamSchema open(ParamSpec... specs) {
        return new ParamSchema(List.of(specs), true);
    }

    public static ParamSchema empty() {
        return new ParamSchema(List.of(), false);
    }

    public boolean isOpen() {
        return open;
    }

    public Map<String, ParamSpec> getSpecs() {
        return specs;
    }

    /**
     * @return problems found, empty when the parameters conform
     */
    public List<String> validate(StepParams params) {
        List<String> problems = new ArrayList<>();
        for (ParamSpec spec : specs.values()) {
            String problem = spec.check(params.get(spec.name()));
            if (problem != null) {
                problems.add(problem);
            }
        }
        if (!open) {
            for (String key : params.asMap().keySet()) {
                if (!specs.containsKey(key)) {
                    problems.add("unknown parameter '" + key + "'");
                }
            }
        }
        return problems;
    }
}
