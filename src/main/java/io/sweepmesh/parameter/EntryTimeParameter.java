package io.sweepmesh.parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time of day trades are entered, swept at a fixed interval and rendered as {@code HH:MM}.
 */
public final class EntryTimeParameter implements ParameterDefinition {
    public static final String NAME = "entry_time";
    private static final List<ParameterField> FIELDS = List.of(
            ParameterField.intField("start_hour", "Start Hour", "", 9, 0, 23),
            ParameterField.intField("start_minute", "Start Minute", "", 30, 0, 59),
            ParameterField.intField("end_hour", "End Hour", "", 15, 0, 23),
            ParameterField.intField("end_minute", "End Minute", "", 0, 0, 59),
            ParameterField.intField("interval_minutes", "Interval (minutes)", "", 30, 5, 120)
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Entry Time";
    }

    @Override
    public String description() {
        return "Time of day to enter trades";
    }

    @Override
    public List<ParameterField> fields() {
        return FIELDS;
    }

    @Override
    public List<Object> generateValues(Map<String, Object> config) {
        int current = RangeParameter.intValue(config, "start_hour") * 60 + RangeParameter.intValue(config, "start_minute");
        int end = RangeParameter.intValue(config, "end_hour") * 60 + RangeParameter.intValue(config, "end_minute");
        int interval = RangeParameter.intValue(config, "interval_minutes");
        List<Object> values = new ArrayList<>();
        for (; current <= end; current += interval) {
            values.add(String.format("%02d:%02d", current / 60, current % 60));
        }
        return values;
    }

    @Override
    public List<Map<String, Object>> applyToTarget(Object value, Map<String, Object> config) {
        Map<String, Object> instruction = new LinkedHashMap<>();
        instruction.put("field", NAME);
        instruction.put("value", String.valueOf(value));
        return List.of(instruction);
    }
}
