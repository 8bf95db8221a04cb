package io.sweepmesh.parameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Integer parameter swept from {@code start} to {@code end} inclusive by {@code step}.
 */
abstract class RangeParameter implements ParameterDefinition {

    @Override
    public List<Object> generateValues(Map<String, Object> config) {
        int start = intValue(config, "start");
        int end = intValue(config, "end");
        int step = intValue(config, "step");
        if (step <= 0) {
            throw new IllegalArgumentException(name() + " step must be > 0: " + step);
        }
        List<Object> values = new ArrayList<>();
        for (int current = start; current <= end; current += step) {
            values.add(current);
        }
        return values;
    }

    static int intValue(Map<String, Object> config, String field) {
        Integer value = ParameterField.toInt(config.get(field));
        if (value == null) {
            throw new IllegalArgumentException("Field '" + field + "' must be an integer: " + config.get(field));
        }
        return value;
    }
}
