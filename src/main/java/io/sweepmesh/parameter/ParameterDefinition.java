package io.sweepmesh.parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A sweepable parameter of the target: how it is configured, which values a sweep covers and how a
 * value is applied to the target's form.
 */
public interface ParameterDefinition {
    String name();

    String displayName();

    String description();

    List<ParameterField> fields();

    /**
     * Values to test for an already resolved configuration, in sweep order.
     */
    List<Object> generateValues(Map<String, Object> config);

    /**
     * Field instructions handed to the worker so it can set {@code value} on the target.
     */
    List<Map<String, Object>> applyToTarget(Object value, Map<String, Object> config);

    default Map<String, Object> defaults() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ParameterField field : fields()) {
            out.put(field.name(), field.defaultValue());
        }
        return out;
    }

    default List<String> validate(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        for (ParameterField field : fields()) {
            if (config.containsKey(field.name())) {
                if (!field.validate(config.get(field.name()))) {
                    errors.add("Invalid value for " + field.label() + ": " + config.get(field.name()));
                }
            } else if (field.required()) {
                errors.add(field.label() + " is required");
            }
        }
        return errors;
    }

    /**
     * Defaults overlaid with {@code overrides}, validated. Integer fields are normalized to ints.
     */
    default Map<String, Object> resolveConfig(Map<String, Object> overrides) {
        Map<String, Object> merged = defaults();
        if (overrides != null) {
            for (Map.Entry<String, Object> entry : overrides.entrySet()) {
                if (!merged.containsKey(entry.getKey())) {
                    throw new IllegalArgumentException("Unknown field '" + entry.getKey() + "' for parameter " + name());
                }
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        List<String> errors = validate(merged);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid " + name() + " configuration: " + String.join("; ", errors));
        }
        for (ParameterField field : fields()) {
            if (field.kind() == ParameterField.Kind.INT) {
                merged.put(field.name(), ParameterField.toInt(merged.get(field.name())));
            }
        }
        return merged;
    }
}
