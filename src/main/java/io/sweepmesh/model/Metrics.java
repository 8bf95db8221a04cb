package io.sweepmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed metrics scraped from one result. Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Metrics(
        @JsonProperty("pl") Double pl,
        @JsonProperty("cagr") Double cagr,
        @JsonProperty("max_drawdown") Double maxDrawdown,
        @JsonProperty("mar") Double mar,
        @JsonProperty("win_percentage") Double winPercentage,
        @JsonProperty("total_premium") Double totalPremium,
        @JsonProperty("capture_rate") Double captureRate,
        @JsonProperty("starting_capital") Double startingCapital,
        @JsonProperty("ending_capital") Double endingCapital,
        @JsonProperty("total_trades") Integer totalTrades,
        @JsonProperty("winners") Integer winners,
        @JsonProperty("avg_per_trade") Double avgPerTrade,
        @JsonProperty("avg_winner") Double avgWinner,
        @JsonProperty("avg_loser") Double avgLoser,
        @JsonProperty("max_winner") Double maxWinner,
        @JsonProperty("max_loser") Double maxLoser,
        @JsonProperty("avg_minutes_in_trade") Double avgMinutesInTrade
) {
    public static Metrics empty() {
        return new Metrics(null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }
}
