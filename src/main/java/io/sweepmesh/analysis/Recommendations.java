package io.sweepmesh.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks the measured combinations of a run. Each scored metric is min-max normalized across the
 * candidates, lower-is-better metrics inverted, and the weighted sum for the goal is scaled to 0..100.
 * A candidate missing a metric gets the worst normalized value for it.
 */
public final class Recommendations {
    static final int MAX_ALTERNATIVES = 5;
    static final int MAX_AVOID = 3;

    private Recommendations() {
    }

    public static RecommendationReport recommend(List<Candidate> candidates, OptimizationGoal goal) {
        OptimizationGoal effective = goal == null ? OptimizationGoal.BALANCED : goal;
        if (candidates == null || candidates.isEmpty()) {
            return RecommendationReport.empty(effective);
        }
        double[] scores = scores(candidates, effective);
        boolean[] front = paretoFront(candidates);

        List<ScoredCandidate> ranked = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            ranked.add(new ScoredCandidate(candidates.get(i), scores[i], front[i]));
        }
        // stable: equal scores keep task order
        ranked.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());

        ScoredCandidate top = ranked.get(0);
        List<ScoredCandidate> alternatives = new ArrayList<>();
        List<ScoredCandidate> dominated = new ArrayList<>();
        for (ScoredCandidate scored : ranked) {
            if (scored == top) {
                continue;
            }
            if (scored.paretoOptimal()) {
                if (alternatives.size() < MAX_ALTERNATIVES) {
                    alternatives.add(scored);
                }
            } else {
                dominated.add(scored);
            }
        }
        List<ScoredCandidate> avoid = new ArrayList<>();
        for (int i = dominated.size() - 1; i >= 0 && avoid.size() < MAX_AVOID; i--) {
            avoid.add(dominated.get(i));
        }
        return new RecommendationReport(effective.wireName(), top, List.copyOf(alternatives), List.copyOf(avoid));
    }

    /**
     * @return one 0..100 score per candidate, in input order
     */
    public static double[] scores(List<Candidate> candidates, OptimizationGoal goal) {
        double[] scores = new double[candidates.size()];
        for (Map.Entry<ScoredMetric, Double> entry : goal.weights().entrySet()) {
            double[] normalized = normalize(candidates, entry.getKey());
            for (int i = 0; i < scores.length; i++) {
                scores[i] += normalized[i] * entry.getValue();
            }
        }
        for (int i = 0; i < scores.length; i++) {
            scores[i] *= 100.0;
        }
        return scores;
    }

    /**
     * Min-max normalization of the oriented metric. When every present value is equal each of them maps
     * to 0.5; a missing value maps to 0.
     */
    static double[] normalize(List<Candidate> candidates, ScoredMetric metric) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        Double[] values = new Double[candidates.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = metric.oriented(candidates.get(i).metrics());
            if (values[i] != null) {
                min = Math.min(min, values[i]);
                max = Math.max(max, values[i]);
            }
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                out[i] = 0.0;
            } else if (max == min) {
                out[i] = 0.5;
            } else {
                out[i] = (values[i] - min) / (max - min);
            }
        }
        return out;
    }

    /**
     * @return per candidate, whether no other candidate dominates it
     */
    public static boolean[] paretoFront(List<Candidate> candidates) {
        boolean[] front = new boolean[candidates.size()];
        for (int i = 0; i < front.length; i++) {
            front[i] = true;
            for (int j = 0; j < front.length; j++) {
                if (i != j && dominates(candidates.get(j), candidates.get(i))) {
                    front[i] = false;
                    break;
                }
            }
        }
        return front;
    }

    /**
     * {@code a} dominates {@code b} when it is at least as good on every scored metric and strictly
     * better on one. A missing metric is worse than any value.
     */
    static boolean dominates(Candidate a, Candidate b) {
        boolean strictlyBetter = false;
        for (ScoredMetric metric : ScoredMetric.values()) {
            double left = orWorst(metric.oriented(a.metrics()));
            double right = orWorst(metric.oriented(b.metrics()));
            if (left < right) {
                return false;
            }
            if (left > right) {
                strictlyBetter = true;
            }
        }
        return strictlyBetter;
    }

    private static double orWorst(Double value) {
        return value == null ? Double.NEGATIVE_INFINITY : value;
    }
}
