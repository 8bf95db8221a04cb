package io.sweepmesh.parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ProfitTargetParameter extends RangeParameter {
    public static final String NAME = "profit_target";
    private static final List<ParameterField> FIELDS = List.of(
            ParameterField.intField("start", "Start", "First profit target", 10, 1, 500),
            ParameterField.intField("end", "End", "Last profit target", 100, 1, 500),
            ParameterField.intField("step", "Step", "Increment between values", 10, 1, 100),
            ParameterField.choiceField("unit", "Unit", "Percent of premium or dollars", List.of("%", "$"), "%")
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Profit Target";
    }

    @Override
    public String description() {
        return "Profit target for closing positions";
    }

    @Override
    public List<ParameterField> fields() {
        return FIELDS;
    }

    @Override
    public List<Map<String, Object>> applyToTarget(Object value, Map<String, Object> config) {
        Map<String, Object> instruction = new LinkedHashMap<>();
        instruction.put("field", NAME);
        instruction.put("value", value);
        instruction.put("unit", config.getOrDefault("unit", "%"));
        return List.of(instruction);
    }
}
