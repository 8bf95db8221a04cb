package io.sweepmesh.parameter;

import io.sweepmesh.model.RunMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a run plan into the task list and maps a task's parameters back to worker instructions.
 * <ul>
 *     <li>sweep: the values of the single parameter</li>
 *     <li>grid: cartesian product in parameter order, last parameter varying fastest</li>
 *     <li>staged: the first stage only; later stages are planned from its results</li>
 * </ul>
 */
public final class CombinationGenerator {
    private final ParameterRegistry registry;

    public CombinationGenerator(ParameterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Same plan with every sweep's configuration resolved against its parameter's defaults.
     */
    public RunPlan resolve(RunPlan plan) {
        List<ParameterSweep> resolved = new ArrayList<>();
        for (ParameterSweep sweep : plan.sweeps()) {
            ParameterDefinition parameter = registry.require(sweep.parameter());
            resolved.add(new ParameterSweep(sweep.parameter(), parameter.resolveConfig(sweep.config())));
        }
        return new RunPlan(plan.mode(), resolved);
    }

    public List<Map<String, Object>> generate(RunPlan plan) {
        RunPlan resolved = resolve(plan);
        if (resolved.sweeps().isEmpty()) {
            return List.of();
        }
        if (resolved.mode() == RunMode.SWEEP) {
            if (resolved.sweeps().size() != 1) {
                throw new IllegalArgumentException("sweep mode takes exactly one parameter, got " + resolved.sweeps().size());
            }
            return singleParameter(resolved.sweeps().get(0));
        }
        if (resolved.mode() == RunMode.STAGED) {
            return singleParameter(resolved.sweeps().get(0));
        }
        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (ParameterSweep sweep : resolved.sweeps()) {
            List<Object> values = valuesOf(sweep);
            List<Map<String, Object>> next = new ArrayList<>();
            for (Map<String, Object> prefix : combinations) {
                for (Object value : values) {
                    Map<String, Object> combo = new LinkedHashMap<>(prefix);
                    combo.put(sweep.parameter(), value);
                    next.add(combo);
                }
            }
            combinations = next;
        }
        return combinations;
    }

    /**
     * Instructions for every parameter of {@code params} that the plan configures; others are ignored.
     */
    public List<Map<String, Object>> instructions(RunPlan plan, Map<String, Object> params) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ParameterSweep sweep : plan.sweeps()) {
            if (!params.containsKey(sweep.parameter())) {
                continue;
            }
            ParameterDefinition parameter = registry.require(sweep.parameter());
            out.addAll(parameter.applyToTarget(params.get(sweep.parameter()), parameter.resolveConfig(sweep.config())));
        }
        return out;
    }

    private List<Map<String, Object>> singleParameter(ParameterSweep sweep) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object value : valuesOf(sweep)) {
            Map<String, Object> combo = new LinkedHashMap<>();
            combo.put(sweep.parameter(), value);
            out.add(combo);
        }
        return out;
    }

    private List<Object> valuesOf(ParameterSweep sweep) {
        return registry.require(sweep.parameter()).generateValues(sweep.config());
    }
}
