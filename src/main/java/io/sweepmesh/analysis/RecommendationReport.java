package io.sweepmesh.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of ranking a run's results: the best scoring candidate, up to five other Pareto-optimal
 * candidates by descending score, and up to three dominated candidates, worst first.
 */
public record RecommendationReport(
        @JsonProperty("goal") String goal,
        @JsonProperty("top_pick") ScoredCandidate topPick,
        @JsonProperty("alternatives") List<ScoredCandidate> alternatives,
        @JsonProperty("avoid") List<ScoredCandidate> avoid
) {
    public static RecommendationReport empty(OptimizationGoal goal) {
        return new RecommendationReport(goal.wireName(), null, List.of(), List.of());
    }
}
