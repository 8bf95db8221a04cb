package io.sweepmesh.parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DeltaParameter extends RangeParameter {
    public static final String NAME = "delta";
    private static final List<ParameterField> FIELDS = List.of(
            ParameterField.intField("start", "Start Delta", "Starting delta value", 5, 1, 100),
            ParameterField.intField("end", "End Delta", "Ending delta value", 50, 1, 100),
            ParameterField.intField("step", "Step", "Increment between values", 1, 1, 50),
            ParameterField.choiceField("apply_to", "Apply To", "Which legs receive the delta",
                    List.of("both", "put_only", "call_only"), "both")
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Delta";
    }

    @Override
    public String description() {
        return "Options delta used for put/call leg selection";
    }

    @Override
    public List<ParameterField> fields() {
        return FIELDS;
    }

    @Override
    public List<Map<String, Object>> applyToTarget(Object value, Map<String, Object> config) {
        String applyTo = String.valueOf(config.getOrDefault("apply_to", "both"));
        List<Map<String, Object>> out = new ArrayList<>();
        if (!"call_only".equals(applyTo)) {
            out.add(legInstruction("put", value));
        }
        if (!"put_only".equals(applyTo)) {
            out.add(legInstruction("call", value));
        }
        return out;
    }

    private Map<String, Object> legInstruction(String leg, Object value) {
        Map<String, Object> instruction = new LinkedHashMap<>();
        instruction.put("field", NAME);
        instruction.put("leg", leg);
        instruction.put("value", value);
        return instruction;
    }
}
