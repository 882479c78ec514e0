package com.fxpipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Market-wide snapshot derived from the currency summaries.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"generated_at", "total_currencies", "observation_period", "market_sentiment",
        "volatility_distribution", "top_performers", "major_currencies"})
public class MarketOverview {

    @JsonProperty("generated_at")
    LocalDateTime generatedAt;

    @JsonProperty("total_currencies")
    int totalCurrencies;

    @JsonProperty("observation_period")
    ObservationPeriod observationPeriod;

    @JsonProperty("market_sentiment")
    MarketSentiment marketSentiment;

    @JsonProperty("volatility_distribution")
    VolatilityDistribution volatilityDistribution;

    @JsonProperty("top_performers")
    TopPerformers topPerformers;

    @JsonProperty("major_currencies")
    List<MajorCurrency> majorCurrencies;

    public record ObservationPeriod(
            @JsonProperty("start") LocalDate start,
            @JsonProperty("end") LocalDate end,
            @JsonProperty("total_days") long totalDays
    ) {}

    public record MarketSentiment(
            @JsonProperty("currencies_up") int currenciesUp,
            @JsonProperty("currencies_down") int currenciesDown,
            @JsonProperty("currencies_stable") int currenciesStable
    ) {}

    public record VolatilityDistribution(
            @JsonProperty("low") int low,
            @JsonProperty("moderate") int moderate,
            @JsonProperty("high") int high,
            @JsonProperty("very_high") int veryHigh
    ) {}

    public record Extreme(
            @JsonProperty("currency") String currency,
            @JsonProperty("value") double value
    ) {}

    public record TopPerformers(
            @JsonProperty("biggest_gainer") Extreme biggestGainer,
            @JsonProperty("biggest_loser") Extreme biggestLoser,
            @JsonProperty("most_volatile") Extreme mostVolatile,
            @JsonProperty("most_stable") Extreme mostStable
    ) {}

    public record MajorCurrency(
            @JsonProperty("currency") String currency,
            @JsonProperty("current_rate") double currentRate,
            @JsonProperty("last_daily_change") double lastDailyChange,
            @JsonProperty("total_change_pct") double totalChangePct,
            @JsonProperty("volatility_class") String volatilityClass,
            @JsonProperty("trend_class") String trendClass
    ) {}
}
