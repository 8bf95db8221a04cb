package io.sweepmesh.parameter;

import io.sweepmesh.model.RunMode;
import io.sweepmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class CombinationGeneratorTest {
    private final CombinationGenerator generator = new CombinationGenerator(ParameterRegistry.standard());

    @Test
    void sweepUsesTheSingleParameter() {
        List<Map<String, Object>> combos = generator.generate(
                RunPlan.sweep("delta", Map.of("start", 5, "end", 7, "step", 1)));

        Assertions.assertEquals(List.of(Map.of("delta", 5), Map.of("delta", 6), Map.of("delta", 7)), combos);
    }

    @Test
    void sweepRejectsSeveralParameters() {
        RunPlan plan = new RunPlan(RunMode.SWEEP, List.of(ParameterSweep.of("delta"), ParameterSweep.of("stop_loss")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> generator.generate(plan));
    }

    @Test
    void gridIsCartesianProductInParameterOrder() {
        RunPlan plan = new RunPlan(RunMode.GRID, List.of(
                new ParameterSweep("delta", Map.of("start", 5, "end", 6, "step", 1)),
                new ParameterSweep("profit_target", Map.of("start", 10, "end", 30, "step", 10))));

        List<Map<String, Object>> combos = generator.generate(plan);

        Assertions.assertEquals(6, combos.size());
        Assertions.assertEquals(Map.of("delta", 5, "profit_target", 10), combos.get(0));
        Assertions.assertEquals(Map.of("delta", 5, "profit_target", 20), combos.get(1));
        Assertions.assertEquals(Map.of("delta", 6, "profit_target", 30), combos.get(5));
        Assertions.assertEquals(List.of("delta", "profit_target"), List.copyOf(combos.get(0).keySet()));
    }

    @Test
    void stagedGeneratesFirstStageOnly() {
        RunPlan plan = new RunPlan(RunMode.STAGED, List.of(
                new ParameterSweep("stop_loss", Map.of("start", 50, "end", 100, "step", 50)),
                ParameterSweep.of("delta")));

        Assertions.assertEquals(List.of(Map.of("stop_loss", 50), Map.of("stop_loss", 100)), generator.generate(plan));
    }

    @Test
    void planSurvivesConfigBlobAndDrivesInstructions() {
        RunPlan resolved = generator.resolve(new RunPlan(RunMode.GRID, List.of(
                new ParameterSweep("delta", Map.of("apply_to", "call_only")),
                ParameterSweep.of("stop_loss"))));
        String blob = Jsons.toCompactJson(resolved.toConfig());

        RunPlan restored = RunPlan.fromConfigJson(blob);

        Assertions.assertEquals(RunMode.GRID, restored.mode());
        Assertions.assertEquals(resolved, restored);
        List<Map<String, Object>> instructions = generator.instructions(restored, Map.of("delta", 20, "stop_loss", 75));
        Assertions.assertEquals(2, instructions.size());
        Assertions.assertEquals("call", instructions.get(0).get("leg"));
        Assertions.assertEquals("stop_loss", instructions.get(1).get("field"));
        Assertions.assertTrue(RunPlan.fromConfigJson("{}").sweeps().isEmpty());
    }
}
