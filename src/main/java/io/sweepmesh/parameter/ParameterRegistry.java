package io.sweepmesh.parameter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of parameters, resolved by name when a run is configured.
 */
public final class ParameterRegistry {
    private final Map<String, ParameterDefinition> parameters = new LinkedHashMap<>();

    public static ParameterRegistry standard() {
        ParameterRegistry registry = new ParameterRegistry();
        registry.register(new DeltaParameter());
        registry.register(new EntryTimeParameter());
        registry.register(new ProfitTargetParameter());
        registry.register(new StopLossParameter());
        return registry;
    }

    public void register(ParameterDefinition parameter) {
        if (parameters.putIfAbsent(parameter.name(), parameter) != null) {
            throw new IllegalStateException("Parameter already registered: " + parameter.name());
        }
    }

    public Optional<ParameterDefinition> find(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public ParameterDefinition require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown parameter: " + name + " (known: " + String.join(", ", parameters.keySet()) + ")"));
    }

    public Collection<ParameterDefinition> list() {
        return List.copyOf(parameters.values());
    }

    public List<Map<String, Object>> describe() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ParameterDefinition parameter : parameters.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", parameter.name());
            row.put("display_name", parameter.displayName());
            row.put("description", parameter.description());
            row.put("defaults", parameter.defaults());
            out.add(row);
        }
        return out;
    }
}
