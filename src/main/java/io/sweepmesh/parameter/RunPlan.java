package io.sweepmesh.parameter;

import io.sweepmesh.model.RunMode;
import io.sweepmesh.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a run sweeps: the mode and the ordered parameter list. In staged mode each entry is one stage.
 */
public record RunPlan(RunMode mode, List<ParameterSweep> sweeps) {
    public RunPlan {
        mode = mode == null ? RunMode.SWEEP : mode;
        sweeps = sweeps == null ? List.of() : List.copyOf(sweeps);
    }

    public static RunPlan sweep(String parameter, Map<String, Object> config) {
        return new RunPlan(RunMode.SWEEP, List.of(new ParameterSweep(parameter, config)));
    }

    public Map<String, Object> toConfig() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("mode", mode.wireName());
        List<Map<String, Object>> parameters = new ArrayList<>();
        for (ParameterSweep sweep : sweeps) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("parameter", sweep.parameter());
            row.put("config", sweep.config());
            parameters.add(row);
        }
        out.put("parameters", parameters);
        return out;
    }

    /**
     * Reads the plan back from a run's configuration blob. A blob without parameters yields an empty plan.
     */
    @SuppressWarnings("unchecked")
    public static RunPlan fromConfigJson(String configJson) {
        Map<String, Object> config = Jsons.toMap(configJson);
        RunMode mode = RunMode.fromString(config.get("mode") == null ? null : String.valueOf(config.get("mode")));
        List<ParameterSweep> sweeps = new ArrayList<>();
        Object parameters = config.get("parameters");
        if (parameters instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> row) || row.get("parameter") == null) {
                    throw new IllegalArgumentException("Malformed parameter entry in run config: " + item);
                }
                Object rowConfig = row.get("config");
                sweeps.add(new ParameterSweep(
                        String.valueOf(row.get("parameter")),
                        rowConfig instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of()));
            }
        }
        return new RunPlan(mode, sweeps);
    }
}
