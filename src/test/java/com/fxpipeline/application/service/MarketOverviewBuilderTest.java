package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.MarketOverview;
import com.fxpipeline.domain.model.TrendClass;
import com.fxpipeline.domain.model.VolatilityClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketOverviewBuilder
 */
class MarketOverviewBuilderTest {

    private static final Instant NOW = Instant.parse("2024-03-15T06:00:00Z");
    private static final LocalDate FIRST = LocalDate.of(2024, 2, 15);
    private static final LocalDate LAST = LocalDate.of(2024, 3, 15);

    private MarketOverviewBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new MarketOverviewBuilder(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testOverviewCounts() {
        MarketOverview overview = builder.build(List.of(
                summary("EUR", 0.05, 1.5, 0.4),
                summary("JPY", -1.2, -3.0, 1.5),
                summary("GBP", 0.0, 0.2, 2.5),
                summary("BRL", 0.8, 4.0, 7.0)));

        assertEquals(LocalDateTime.of(2024, 3, 15, 6, 0), overview.getGeneratedAt());
        assertEquals(4, overview.getTotalCurrencies());
        assertEquals(FIRST, overview.getObservationPeriod().start());
        assertEquals(LAST, overview.getObservationPeriod().end());
        assertEquals(30, overview.getObservationPeriod().totalDays());

        // EUR counts as both up and stable
        assertEquals(2, overview.getMarketSentiment().currenciesUp());
        assertEquals(1, overview.getMarketSentiment().currenciesDown());
        assertEquals(2, overview.getMarketSentiment().currenciesStable());

        assertEquals(new MarketOverview.VolatilityDistribution(1, 1, 1, 1), overview.getVolatilityDistribution());
    }

    @Test
    void testTopPerformers() {
        MarketOverview overview = builder.build(List.of(
                summary("EUR", 0.05, 1.5, 0.4),
                summary("JPY", -1.2, -3.0, 1.5),
                summary("BRL", 0.8, 4.0, 7.0)));

        MarketOverview.TopPerformers top = overview.getTopPerformers();
        assertEquals(new MarketOverview.Extreme("BRL", 4.0), top.biggestGainer());
        assertEquals(new MarketOverview.Extreme("JPY", -3.0), top.biggestLoser());
        assertEquals(new MarketOverview.Extreme("BRL", 7.0), top.mostVolatile());
        assertEquals(new MarketOverview.Extreme("EUR", 0.4), top.mostStable());
    }

    @Test
    void testTiesResolveToFirstRow() {
        MarketOverview overview = builder.build(List.of(
                summary("CHF", 0.0, 0.0, 0.0),
                summary("EUR", 0.0, 0.0, 0.0)));

        assertEquals("CHF", overview.getTopPerformers().biggestGainer().currency());
        assertEquals("CHF", overview.getTopPerformers().biggestLoser().currency());
        assertEquals("CHF", overview.getTopPerformers().mostStable().currency());
    }

    @Test
    void testMajorCurrenciesLimitedToTen() {
        List<CurrencySummary> summaries = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            summaries.add(summary("C" + (char) ('A' + i) + "X", 0.0, 0.0, 0.1));
        }

        MarketOverview overview = builder.build(summaries);

        assertEquals(10, overview.getMajorCurrencies().size());
        MarketOverview.MajorCurrency first = overview.getMajorCurrencies().get(0);
        assertEquals("CAX", first.currency());
        assertEquals("Low", first.volatilityClass());
        assertEquals("Stable", first.trendClass());
    }

    @Test
    void testEmptySummariesRejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of()));
    }

    private static CurrencySummary summary(String currency, double lastDailyChange, double totalChange,
                                           double avgVolatility) {
        return CurrencySummary.builder()
                .currency(currency)
                .currentRate(1.0)
                .lastDailyChange(lastDailyChange)
                .totalChangePct(totalChange)
                .avgVolatility7d(avgVolatility)
                .firstDate(FIRST)
                .lastDate(LAST)
                .totalObservations(20)
                .volatilityClass(VolatilityClass.classify(avgVolatility))
                .trendClass(TrendClass.classify(lastDailyChange))
                .build();
    }
}
