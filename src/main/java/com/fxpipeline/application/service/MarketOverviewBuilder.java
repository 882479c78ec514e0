package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.MarketOverview;
import com.fxpipeline.domain.model.MarketOverview.Extreme;
import com.fxpipeline.domain.model.MarketOverview.MajorCurrency;
import com.fxpipeline.domain.model.MarketOverview.MarketSentiment;
import com.fxpipeline.domain.model.MarketOverview.ObservationPeriod;
import com.fxpipeline.domain.model.MarketOverview.TopPerformers;
import com.fxpipeline.domain.model.MarketOverview.VolatilityDistribution;
import com.fxpipeline.domain.model.VolatilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Builds the market-wide overview from currency summaries.
 * Extremes resolve to the first row achieving them, so the summary order breaks ties.
 */
@Slf4j
public class MarketOverviewBuilder {

    static final double STABLE_BAND_PCT = 0.1;
    static final int MAJOR_CURRENCY_COUNT = 10;

    private final Clock clock;

    public MarketOverviewBuilder() {
        this(Clock.systemUTC());
    }

    public MarketOverviewBuilder(Clock clock) {
        this.clock = clock;
    }

    public MarketOverview build(List<CurrencySummary> summaries) {
        if (summaries.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a market overview without currency summaries");
        }

        MarketOverview overview = MarketOverview.builder()
                .generatedAt(LocalDateTime.now(clock))
                .totalCurrencies(summaries.size())
                .observationPeriod(observationPeriod(summaries))
                .marketSentiment(sentiment(summaries))
                .volatilityDistribution(volatilityDistribution(summaries))
                .topPerformers(topPerformers(summaries))
                .majorCurrencies(majorCurrencies(summaries))
                .build();

        log.info("Market overview created: currencies={}, up={}, down={}, gainer={}, loser={}",
                overview.getTotalCurrencies(),
                overview.getMarketSentiment().currenciesUp(),
                overview.getMarketSentiment().currenciesDown(),
                overview.getTopPerformers().biggestGainer().currency(),
                overview.getTopPerformers().biggestLoser().currency());
        return overview;
    }

    private ObservationPeriod observationPeriod(List<CurrencySummary> summaries) {
        LocalDate start = summaries.stream().map(CurrencySummary::getFirstDate).min(LocalDate::compareTo).orElseThrow();
        LocalDate end = summaries.stream().map(CurrencySummary::getLastDate).max(LocalDate::compareTo).orElseThrow();
        return new ObservationPeriod(start, end, ChronoUnit.DAYS.between(start, end) + 1);
    }

    // Buckets are independent: a small positive change counts as both up and stable
    private MarketSentiment sentiment(List<CurrencySummary> summaries) {
        int up = 0;
        int down = 0;
        int stable = 0;
        for (CurrencySummary summary : summaries) {
            double change = summary.getLastDailyChange();
            if (change > 0) {
                up++;
            }
            if (change < 0) {
                down++;
            }
            if (Math.abs(change) <= STABLE_BAND_PCT) {
                stable++;
            }
        }
        return new MarketSentiment(up, down, stable);
    }

    private VolatilityDistribution volatilityDistribution(List<CurrencySummary> summaries) {
        Map<VolatilityClass, Integer> counts = new EnumMap<>(VolatilityClass.class);
        for (VolatilityClass volatilityClass : VolatilityClass.values()) {
            counts.put(volatilityClass, 0);
        }
        summaries.forEach(summary -> counts.merge(summary.getVolatilityClass(), 1, Integer::sum));
        return new VolatilityDistribution(
                counts.get(VolatilityClass.LOW),
                counts.get(VolatilityClass.MODERATE),
                counts.get(VolatilityClass.HIGH),
                counts.get(VolatilityClass.VERY_HIGH));
    }

    private TopPerformers topPerformers(List<CurrencySummary> summaries) {
        return new TopPerformers(
                extreme(summaries, CurrencySummary::getTotalChangePct, true),
                extreme(summaries, CurrencySummary::getTotalChangePct, false),
                extreme(summaries, CurrencySummary::getAvgVolatility7d, true),
                extreme(summaries, CurrencySummary::getAvgVolatility7d, false));
    }

    private Extreme extreme(List<CurrencySummary> summaries, ToDoubleFunction<CurrencySummary> field, boolean max) {
        CurrencySummary best = summaries.get(0);
        double bestValue = field.applyAsDouble(best);
        for (CurrencySummary summary : summaries) {
            double value = field.applyAsDouble(summary);
            if (max ? value > bestValue : value < bestValue) {
                best = summary;
                bestValue = value;
            }
        }
        return new Extreme(best.getCurrency(), bestValue);
    }

    private List<MajorCurrency> majorCurrencies(List<CurrencySummary> summaries) {
        return summaries.stream()
                .limit(MAJOR_CURRENCY_COUNT)
                .map(summary -> new MajorCurrency(
                        summary.getCurrency(),
                        summary.getCurrentRate(),
                        summary.getLastDailyChange(),
                        summary.getTotalChangePct(),
                        summary.getVolatilityClass().getValue(),
                        summary.getTrendClass().getValue()))
                .toList();
    }
}
