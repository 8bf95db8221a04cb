package io.sweepmesh.parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class StopLossParameter extends RangeParameter {
    public static final String NAME = "stop_loss";
    private static final List<ParameterField> FIELDS = List.of(
            ParameterField.intField("start", "Start", "First stop loss", 50, 1, 1000),
            ParameterField.intField("end", "End", "Last stop loss", 200, 1, 1000),
            ParameterField.intField("step", "Step", "Increment between values", 25, 1, 100),
            ParameterField.choiceField("unit", "Unit", "Percent of premium or dollars", List.of("%", "$"), "%")
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Stop Loss";
    }

    @Override
    public String description() {
        return "Stop loss for limiting losses";
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
