package io.sweepmesh.parameter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class ParameterDefinitionTest {

    @Test
    void deltaRangeAndLegInstructions() {
        DeltaParameter delta = new DeltaParameter();
        Map<String, Object> config = delta.resolveConfig(Map.of("start", "10", "end", 14, "step", 2));

        Assertions.assertEquals(List.of(10, 12, 14), delta.generateValues(config));
        Assertions.assertEquals(46, delta.generateValues(delta.resolveConfig(Map.of())).size());

        List<Map<String, Object>> both = delta.applyToTarget(12, config);
        Assertions.assertEquals(2, both.size());
        Assertions.assertEquals("put", both.get(0).get("leg"));
        Assertions.assertEquals("call", both.get(1).get("leg"));
        Assertions.assertEquals(12, both.get(1).get("value"));

        List<Map<String, Object>> putOnly = delta.applyToTarget(12, delta.resolveConfig(Map.of("apply_to", "put_only")));
        Assertions.assertEquals(1, putOnly.size());
        Assertions.assertEquals("put", putOnly.get(0).get("leg"));
    }

    @Test
    void invalidConfigurationIsRejected() {
        DeltaParameter delta = new DeltaParameter();
        IllegalArgumentException outOfRange = Assertions.assertThrows(IllegalArgumentException.class,
                () -> delta.resolveConfig(Map.of("end", 150)));
        Assertions.assertTrue(outOfRange.getMessage().contains("End Delta"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> delta.resolveConfig(Map.of("apply_to", "wings")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> delta.resolveConfig(Map.of("colour", "red")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> delta.resolveConfig(Map.of("step", 1.5)));
    }

    @Test
    void entryTimeRendersClockValues() {
        EntryTimeParameter entry = new EntryTimeParameter();
        List<Object> defaults = entry.generateValues(entry.resolveConfig(Map.of()));
        Assertions.assertEquals(12, defaults.size());
        Assertions.assertEquals("09:30", defaults.get(0));
        Assertions.assertEquals("15:00", defaults.get(defaults.size() - 1));

        List<Object> hourly = entry.generateValues(entry.resolveConfig(Map.of(
                "start_hour", 10, "start_minute", 0, "end_hour", 12, "end_minute", 30, "interval_minutes", 60)));
        Assertions.assertEquals(List.of("10:00", "11:00", "12:00"), hourly);
        Assertions.assertEquals("11:00", entry.applyToTarget("11:00", Map.of()).get(0).get("value"));
    }

    @Test
    void exitParametersCarryTheirUnit() {
        ProfitTargetParameter profit = new ProfitTargetParameter();
        Assertions.assertEquals(10, profit.generateValues(profit.resolveConfig(Map.of())).size());
        Map<String, Object> dollars = profit.resolveConfig(Map.of("unit", "$"));
        Assertions.assertEquals("$", profit.applyToTarget(50, dollars).get(0).get("unit"));

        StopLossParameter stop = new StopLossParameter();
        Assertions.assertEquals(List.of(50, 75, 100, 125, 150, 175, 200), stop.generateValues(stop.resolveConfig(Map.of())));
        Assertions.assertEquals("%", stop.applyToTarget(75, stop.resolveConfig(Map.of())).get(0).get("unit"));
    }

    @Test
    void registryResolvesByName() {
        ParameterRegistry registry = ParameterRegistry.standard();
        Assertions.assertTrue(registry.find("delta").isPresent());
        Assertions.assertTrue(registry.find("gamma").isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.require("gamma"));
        Assertions.assertEquals(4, registry.list().size());
        Assertions.assertEquals(4, registry.describe().size());
    }
}
