package io.sweepmesh.analysis;

import io.sweepmesh.model.Metrics;

import java.util.function.Function;

/**
 * Metrics that take part in scoring and Pareto comparison. {@link #oriented(Metrics)} flips
 * lower-is-better metrics so that a larger oriented value is always better.
 */
public enum ScoredMetric {
    MAR(true, Metrics::mar),
    CAGR(true, Metrics::cagr),
    WIN_PERCENTAGE(true, Metrics::winPercentage),
    KELLY(true, ScoredMetric::kellyFraction),
    /** Reported as a signed percentage; only its magnitude is compared. */
    MAX_DRAWDOWN(false, metrics -> metrics.maxDrawdown() == null ? null : Math.abs(metrics.maxDrawdown()));

    private final boolean higherIsBetter;
    private final Function<Metrics, Double> extractor;

    ScoredMetric(boolean higherIsBetter, Function<Metrics, Double> extractor) {
        this.higherIsBetter = higherIsBetter;
        this.extractor = extractor;
    }

    public boolean higherIsBetter() {
        return higherIsBetter;
    }

    public Double value(Metrics metrics) {
        if (metrics == null) {
            return null;
        }
        Double value = extractor.apply(metrics);
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }

    /**
     * @return the value with lower-is-better metrics negated, or null when the metric is missing
     */
    public Double oriented(Metrics metrics) {
        Double value = value(metrics);
        if (value == null) {
            return null;
        }
        return higherIsBetter ? value : -value;
    }

    /**
     * Kelly fraction {@code W - (1 - W) / R} from the win rate and the average winner to average loser
     * ratio.
     */
    static Double kellyFraction(Metrics metrics) {
        Double winRate = null;
        if (metrics.totalTrades() != null && metrics.totalTrades() > 0 && metrics.winners() != null) {
            winRate = metrics.winners() / (double) metrics.totalTrades();
        } else if (metrics.winPercentage() != null) {
            winRate = metrics.winPercentage() / 100.0;
        }
        if (winRate == null || metrics.avgWinner() == null || metrics.avgLoser() == null
                || metrics.avgLoser() == 0.0 || metrics.avgWinner() <= 0.0) {
            return null;
        }
        double payoff = metrics.avgWinner() / Math.abs(metrics.avgLoser());
        return winRate - (1.0 - winRate) / payoff;
    }
}
