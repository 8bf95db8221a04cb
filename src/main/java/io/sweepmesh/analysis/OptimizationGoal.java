package io.sweepmesh.analysis;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Weighting of the scored metrics for one optimization goal. Weights of a goal sum to 1.
 */
public enum OptimizationGoal {
    BALANCED(0.30, 0.25, 0.20, 0.15, 0.10),
    MAXIMIZE_RETURNS(0.20, 0.40, 0.15, 0.15, 0.10),
    PROTECT_CAPITAL(0.20, 0.15, 0.25, 0.10, 0.30);

    private final Map<ScoredMetric, Double> weights;

    OptimizationGoal(double mar, double cagr, double winPercentage, double kelly, double maxDrawdown) {
        Map<ScoredMetric, Double> out = new LinkedHashMap<>();
        out.put(ScoredMetric.MAR, mar);
        out.put(ScoredMetric.CAGR, cagr);
        out.put(ScoredMetric.WIN_PERCENTAGE, winPercentage);
        out.put(ScoredMetric.KELLY, kelly);
        out.put(ScoredMetric.MAX_DRAWDOWN, maxDrawdown);
        this.weights = Map.copyOf(out);
    }

    public Map<ScoredMetric, Double> weights() {
        return weights;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OptimizationGoal fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BALANCED;
        }
        for (OptimizationGoal value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim().replace('-', '_'))) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown optimization goal: " + raw);
    }
}
