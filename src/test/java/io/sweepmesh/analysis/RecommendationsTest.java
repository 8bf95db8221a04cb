package io.sweepmesh.analysis;

import io.sweepmesh.model.Metrics;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class RecommendationsTest {

    @Test
    void dominantCandidateScoresHundredAndWorstScoresZero() {
        Candidate best = candidate(1, metrics(30.0, -5.0, 6.0, 70.0, 14));
        Candidate worst = candidate(2, metrics(10.0, -20.0, 0.5, 40.0, 8));

        double[] scores = Recommendations.scores(List.of(best, worst), OptimizationGoal.BALANCED);

        Assertions.assertEquals(100.0, scores[0], 1e-9);
        Assertions.assertEquals(0.0, scores[1], 1e-9);
        RecommendationReport report = Recommendations.recommend(List.of(worst, best), OptimizationGoal.BALANCED);
        Assertions.assertEquals(1L, report.topPick().candidate().taskId());
        Assertions.assertTrue(report.topPick().paretoOptimal());
        Assertions.assertTrue(report.alternatives().isEmpty());
        Assertions.assertEquals(List.of(2L), report.avoid().stream().map(s -> s.candidate().taskId()).toList());
        Assertions.assertEquals("balanced", report.goal());
    }

    @Test
    void identicalResultsScoreFifty() {
        Metrics same = metrics(12.0, -8.0, 1.5, 60.0, 12);
        double[] scores = Recommendations.scores(List.of(candidate(1, same), candidate(2, same)), OptimizationGoal.PROTECT_CAPITAL);

        Assertions.assertEquals(50.0, scores[0], 1e-9);
        Assertions.assertEquals(50.0, scores[1], 1e-9);
        Assertions.assertArrayEquals(new boolean[]{true, true},
                Recommendations.paretoFront(List.of(candidate(1, same), candidate(2, same))));
    }

    @Test
    void goalDecidesBetweenReturnsAndDrawdown() {
        Candidate aggressive = candidate(1, metrics(40.0, -30.0, 1.5, 60.0, 12));
        Candidate defensive = candidate(2, metrics(10.0, -4.0, 1.5, 60.0, 12));
        List<Candidate> both = List.of(aggressive, defensive);

        RecommendationReport balanced = Recommendations.recommend(both, OptimizationGoal.BALANCED);
        Assertions.assertEquals(1L, balanced.topPick().candidate().taskId());
        Assertions.assertEquals(57.5, balanced.topPick().score(), 1e-9);

        RecommendationReport safe = Recommendations.recommend(both, OptimizationGoal.PROTECT_CAPITAL);
        Assertions.assertEquals(2L, safe.topPick().candidate().taskId());
        Assertions.assertEquals(57.5, safe.topPick().score(), 1e-9);
        Assertions.assertEquals(List.of(1L), safe.alternatives().stream().map(s -> s.candidate().taskId()).toList());
        Assertions.assertTrue(safe.avoid().isEmpty());

        RecommendationReport returns = Recommendations.recommend(both, OptimizationGoal.MAXIMIZE_RETURNS);
        Assertions.assertEquals(65.0, returns.topPick().score(), 1e-9);
    }

    @Test
    void avoidListsWorstDominatedFirst() {
        List<Candidate> candidates = List.of(
                candidate(1, metrics(30.0, -5.0, 6.0, 70.0, 14)),
                candidate(2, metrics(20.0, -10.0, 2.0, 60.0, 12)),
                candidate(3, metrics(10.0, -15.0, 0.7, 55.0, 11)),
                candidate(4, metrics(5.0, -20.0, 0.25, 50.0, 10)),
                candidate(5, metrics(1.0, -30.0, 0.03, 40.0, 8))
        );

        RecommendationReport report = Recommendations.recommend(candidates, OptimizationGoal.BALANCED);

        Assertions.assertEquals(1L, report.topPick().candidate().taskId());
        Assertions.assertTrue(report.alternatives().isEmpty());
        Assertions.assertEquals(List.of(5L, 4L, 3L), report.avoid().stream().map(s -> s.candidate().taskId()).toList());
        Assertions.assertTrue(report.avoid().stream().noneMatch(ScoredCandidate::paretoOptimal));
    }

    @Test
    void missingMetricCountsAsWorst() {
        Metrics measured = metrics(15.0, -10.0, 1.5, 60.0, 12);
        Metrics noCagr = new Metrics(null, null, -10.0, 1.5, 60.0, null, null, null, null,
                20, 12, null, 200.0, -100.0, null, null, null);
        Candidate full = candidate(1, measured);
        Candidate partial = candidate(2, noCagr);

        Assertions.assertTrue(Recommendations.dominates(full, partial));
        Assertions.assertFalse(Recommendations.dominates(partial, full));
        Assertions.assertArrayEquals(new double[]{0.5, 0.0}, Recommendations.normalize(List.of(full, partial), ScoredMetric.CAGR), 1e-9);
    }

    @Test
    void kellyFractionUsesWinRateAndPayoff() {
        Assertions.assertEquals(0.4, ScoredMetric.kellyFraction(metrics(10.0, -5.0, 2.0, 60.0, 12)), 1e-9);

        Metrics percentOnly = new Metrics(null, null, null, null, 50.0, null, null, null, null,
                null, null, null, 100.0, -100.0, null, null, null);
        Assertions.assertEquals(0.0, ScoredMetric.kellyFraction(percentOnly), 1e-9);
        Assertions.assertNull(ScoredMetric.KELLY.value(Metrics.empty()));
        Assertions.assertEquals(-12.0, ScoredMetric.MAX_DRAWDOWN.oriented(metrics(1.0, -12.0, 1.0, 50.0, 10)));
    }

    @Test
    void emptyInputHasNoPick() {
        RecommendationReport report = Recommendations.recommend(List.of(), null);

        Assertions.assertNull(report.topPick());
        Assertions.assertTrue(report.alternatives().isEmpty());
        Assertions.assertEquals("balanced", report.goal());
        Assertions.assertEquals(OptimizationGoal.MAXIMIZE_RETURNS, OptimizationGoal.fromString("maximize-returns"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> OptimizationGoal.fromString("yolo"));
    }

    private static Candidate candidate(long taskId, Metrics metrics) {
        return new Candidate(taskId, Map.of("delta", (int) taskId), metrics);
    }

    /**
     * Twenty trades with an average winner twice the average loser.
     */
    private static Metrics metrics(double cagr, double maxDrawdown, double mar, double winPercentage, int winners) {
        return new Metrics(null, cagr, maxDrawdown, mar, winPercentage, null, null, null, null,
                20, winners, null, 200.0, -100.0, null, null, null);
    }
}
