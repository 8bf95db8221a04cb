package io.sweepmesh.parameter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parameter of a run plan with its field configuration (possibly partial, defaults fill the rest).
 */
public record ParameterSweep(String parameter, Map<String, Object> config) {
    public ParameterSweep {
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("parameter name is required");
        }
        config = config == null ? Map.of() : new LinkedHashMap<>(config);
    }

    public static ParameterSweep of(String parameter) {
        return new ParameterSweep(parameter, Map.of());
    }
}
