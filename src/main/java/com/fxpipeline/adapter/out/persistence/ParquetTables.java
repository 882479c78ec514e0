package com.fxpipeline.adapter.out.persistence;

import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.TrendClass;
import com.fxpipeline.domain.model.TrendPoint;
import com.fxpipeline.domain.model.VolatilityClass;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;

import static com.fxpipeline.adapter.out.persistence.ParquetTable.appendTimestamp;
import static com.fxpipeline.adapter.out.persistence.ParquetTable.fromEpochDay;
import static com.fxpipeline.adapter.out.persistence.ParquetTable.fromMicros;
import static com.fxpipeline.adapter.out.persistence.ParquetTable.readTimestamp;
import static com.fxpipeline.adapter.out.persistence.ParquetTable.toEpochDay;
import static com.fxpipeline.adapter.out.persistence.ParquetTable.toMicros;

/**
 * Parquet schemas of the validated and aggregated tables.
 */
public final class ParquetTables {

    private static final LogicalTypeAnnotation STRING = LogicalTypeAnnotation.stringType();
    private static final LogicalTypeAnnotation DATE = LogicalTypeAnnotation.dateType();
    private static final LogicalTypeAnnotation TIMESTAMP =
            LogicalTypeAnnotation.timestampType(false, LogicalTypeAnnotation.TimeUnit.MICROS);

    public static final ParquetTable<RateObservation> RATE_OBSERVATIONS = new RateObservationTable();
    public static final ParquetTable<DailyMetric> DAILY_METRICS = new DailyMetricTable();
    public static final ParquetTable<TrendPoint> TRENDS = new TrendPointTable();
    public static final ParquetTable<CurrencySummary> CURRENCY_SUMMARIES = new CurrencySummaryTable();
    public static final ParquetTable<ConsolidatedRow> CONSOLIDATED = new ConsolidatedTable();

    private ParquetTables() {
    }

    private static final class RateObservationTable implements ParquetTable<RateObservation> {

        private static final MessageType SCHEMA = Types.buildMessage()
                .required(PrimitiveTypeName.BINARY).as(STRING).named("base_currency")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("target_currency")
                .required(PrimitiveTypeName.DOUBLE).named("exchange_rate")
                .required(PrimitiveTypeName.INT64).as(TIMESTAMP).named("last_update_timestamp")
                .required(PrimitiveTypeName.INT64).as(TIMESTAMP).named("collection_timestamp")
                .required(PrimitiveTypeName.INT32).as(DATE).named("collection_date")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("pipeline_version")
                .named("rate_observation");

        @Override
        public MessageType schema() {
            return SCHEMA;
        }

        @Override
        public Group toGroup(SimpleGroupFactory factory, RateObservation row) {
            return factory.newGroup()
                    .append("base_currency", row.getBaseCurrency())
                    .append("target_currency", row.getTargetCurrency())
                    .append("exchange_rate", row.getRate())
                    .append("last_update_timestamp", toMicros(row.getObservedAt()))
                    .append("collection_timestamp", toMicros(row.getCollectedAt()))
                    .append("collection_date", toEpochDay(row.getCollectionDate()))
                    .append("pipeline_version", row.getPipelineVersion());
        }

        @Override
        public RateObservation fromGroup(Group group) {
            return RateObservation.builder()
                    .baseCurrency(group.getString("base_currency", 0))
                    .targetCurrency(group.getString("target_currency", 0))
                    .rate(group.getDouble("exchange_rate", 0))
                    .observedAt(fromMicros(group.getLong("last_update_timestamp", 0)))
                    .collectedAt(fromMicros(group.getLong("collection_timestamp", 0)))
                    .collectionDate(fromEpochDay(group.getInteger("collection_date", 0)))
                    .pipelineVersion(group.getString("pipeline_version", 0))
                    .build();
        }
    }

    private static final class DailyMetricTable implements ParquetTable<DailyMetric> {

        private static final MessageType SCHEMA = Types.buildMessage()
                .required(PrimitiveTypeName.INT32).as(DATE).named("date")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("currency")
                .required(PrimitiveTypeName.DOUBLE).named("rate_mean")
                .required(PrimitiveTypeName.DOUBLE).named("rate_std")
                .required(PrimitiveTypeName.DOUBLE).named("rate_min")
                .required(PrimitiveTypeName.DOUBLE).named("rate_max")
                .required(PrimitiveTypeName.INT32).named("observation_count")
                .required(PrimitiveTypeName.DOUBLE).named("rate_range")
                .required(PrimitiveTypeName.DOUBLE).named("coefficient_of_variation")
                .optional(PrimitiveTypeName.INT64).as(TIMESTAMP).named("last_update")
                .named("daily_metric");

        @Override
        public MessageType schema() {
            return SCHEMA;
        }

        @Override
        public Group toGroup(SimpleGroupFactory factory, DailyMetric row) {
            return appendMetric(factory.newGroup(), row);
        }

        @Override
        public DailyMetric fromGroup(Group group) {
            return readMetric(group);
        }
    }

    private static final class TrendPointTable implements ParquetTable<TrendPoint> {

        private static final MessageType SCHEMA = Types.buildMessage()
                .addFields(DailyMetricTable.SCHEMA.getFields().toArray(new org.apache.parquet.schema.Type[0]))
                .required(PrimitiveTypeName.DOUBLE).named("daily_change_pct")
                .required(PrimitiveTypeName.DOUBLE).named("cumulative_change_pct")
                .required(PrimitiveTypeName.DOUBLE).named("moving_avg_7d")
                .required(PrimitiveTypeName.DOUBLE).named("volatility_7d")
                .required(PrimitiveTypeName.DOUBLE).named("max_30d")
                .required(PrimitiveTypeName.DOUBLE).named("min_30d")
                .required(PrimitiveTypeName.DOUBLE).named("relative_position_pct")
                .named("trend_point");

        @Override
        public MessageType schema() {
            return SCHEMA;
        }

        @Override
        public Group toGroup(SimpleGroupFactory factory, TrendPoint row) {
            return appendMetric(factory.newGroup(), row.getMetric())
                    .append("daily_change_pct", row.getDailyChangePct())
                    .append("cumulative_change_pct", row.getCumulativeChangePct())
                    .append("moving_avg_7d", row.getMovingAvg7d())
                    .append("volatility_7d", row.getVolatility7d())
                    .append("max_30d", row.getMax30d())
                    .append("min_30d", row.getMin30d())
                    .append("relative_position_pct", row.getRelativePositionPct());
        }

        @Override
        public TrendPoint fromGroup(Group group) {
            return TrendPoint.builder()
                    .metric(readMetric(group))
                    .dailyChangePct(group.getDouble("daily_change_pct", 0))
                    .cumulativeChangePct(group.getDouble("cumulative_change_pct", 0))
                    .movingAvg7d(group.getDouble("moving_avg_7d", 0))
                    .volatility7d(group.getDouble("volatility_7d", 0))
                    .max30d(group.getDouble("max_30d", 0))
                    .min30d(group.getDouble("min_30d", 0))
                    .relativePositionPct(group.getDouble("relative_position_pct", 0))
                    .build();
        }
    }

    private static final class CurrencySummaryTable implements ParquetTable<CurrencySummary> {

        private static final MessageType SCHEMA = Types.buildMessage()
                .required(PrimitiveTypeName.BINARY).as(STRING).named("currency")
                .required(PrimitiveTypeName.DOUBLE).named("current_rate")
                .required(PrimitiveTypeName.DOUBLE).named("moving_avg_7d")
                .required(PrimitiveTypeName.DOUBLE).named("volatility_7d")
                .required(PrimitiveTypeName.DOUBLE).named("relative_position_pct")
                .optional(PrimitiveTypeName.INT64).as(TIMESTAMP).named("last_update")
                .required(PrimitiveTypeName.DOUBLE).named("last_daily_change")
                .required(PrimitiveTypeName.DOUBLE).named("total_change_pct")
                .required(PrimitiveTypeName.DOUBLE).named("historical_min")
                .required(PrimitiveTypeName.DOUBLE).named("historical_max")
                .required(PrimitiveTypeName.DOUBLE).named("historical_avg")
                .required(PrimitiveTypeName.DOUBLE).named("avg_volatility_7d")
                .required(PrimitiveTypeName.DOUBLE).named("avg_daily_volatility")
                .required(PrimitiveTypeName.DOUBLE).named("max_daily_drop")
                .required(PrimitiveTypeName.DOUBLE).named("max_daily_gain")
                .required(PrimitiveTypeName.INT32).as(DATE).named("first_date")
                .required(PrimitiveTypeName.INT32).as(DATE).named("last_date")
                .required(PrimitiveTypeName.INT32).named("total_observations")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("volatility_class")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("trend_class")
                .named("currency_summary");

        @Override
        public MessageType schema() {
            return SCHEMA;
        }

        @Override
        public Group toGroup(SimpleGroupFactory factory, CurrencySummary row) {
            Group group = factory.newGroup()
                    .append("currency", row.getCurrency())
                    .append("current_rate", row.getCurrentRate())
                    .append("moving_avg_7d", row.getMovingAvg7d())
                    .append("volatility_7d", row.getVolatility7d())
                    .append("relative_position_pct", row.getRelativePositionPct());
            appendTimestamp(group, "last_update", row.getLastUpdate());
            return group
                    .append("last_daily_change", row.getLastDailyChange())
                    .append("total_change_pct", row.getTotalChangePct())
                    .append("historical_min", row.getHistoricalMin())
                    .append("historical_max", row.getHistoricalMax())
                    .append("historical_avg", row.getHistoricalAvg())
                    .append("avg_volatility_7d", row.getAvgVolatility7d())
                    .append("avg_daily_volatility", row.getAvgDailyVolatility())
                    .append("max_daily_drop", row.getMaxDailyDrop())
                    .append("max_daily_gain", row.getMaxDailyGain())
                    .append("first_date", toEpochDay(row.getFirstDate()))
                    .append("last_date", toEpochDay(row.getLastDate()))
                    .append("total_observations", row.getTotalObservations())
                    .append("volatility_class", row.getVolatilityClass().getValue())
                    .append("trend_class", row.getTrendClass().getValue());
        }

        @Override
        public CurrencySummary fromGroup(Group group) {
            return CurrencySummary.builder()
                    .currency(group.getString("currency", 0))
                    .currentRate(group.getDouble("current_rate", 0))
                    .movingAvg7d(group.getDouble("moving_avg_7d", 0))
                    .volatility7d(group.getDouble("volatility_7d", 0))
                    .relativePositionPct(group.getDouble("relative_position_pct", 0))
                    .lastUpdate(readTimestamp(group, "last_update"))
                    .lastDailyChange(group.getDouble("last_daily_change", 0))
                    .totalChangePct(group.getDouble("total_change_pct", 0))
                    .historicalMin(group.getDouble("historical_min", 0))
                    .historicalMax(group.getDouble("historical_max", 0))
                    .historicalAvg(group.getDouble("historical_avg", 0))
                    .avgVolatility7d(group.getDouble("avg_volatility_7d", 0))
                    .avgDailyVolatility(group.getDouble("avg_daily_volatility", 0))
                    .maxDailyDrop(group.getDouble("max_daily_drop", 0))
                    .maxDailyGain(group.getDouble("max_daily_gain", 0))
                    .firstDate(fromEpochDay(group.getInteger("first_date", 0)))
                    .lastDate(fromEpochDay(group.getInteger("last_date", 0)))
                    .totalObservations(group.getInteger("total_observations", 0))
                    .volatilityClass(VolatilityClass.fromValue(group.getString("volatility_class", 0)))
                    .trendClass(TrendClass.fromValue(group.getString("trend_class", 0)))
                    .build();
        }
    }

    private static final class ConsolidatedTable implements ParquetTable<ConsolidatedRow> {

        private static final MessageType SCHEMA = Types.buildMessage()
                .required(PrimitiveTypeName.BINARY).as(STRING).named("currency")
                .required(PrimitiveTypeName.DOUBLE).named("current_rate")
                .required(PrimitiveTypeName.DOUBLE).named("last_daily_change")
                .required(PrimitiveTypeName.DOUBLE).named("total_change_pct")
                .required(PrimitiveTypeName.DOUBLE).named("moving_avg_7d")
                .required(PrimitiveTypeName.DOUBLE).named("volatility_7d")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("trend_class")
                .required(PrimitiveTypeName.BINARY).as(STRING).named("volatility_class")
                .named("consolidated");

        @Override
        public MessageType schema() {
            return SCHEMA;
        }

        @Override
        public Group toGroup(SimpleGroupFactory factory, ConsolidatedRow row) {
            return factory.newGroup()
                    .append("currency", row.currency())
                    .append("current_rate", row.currentRate())
                    .append("last_daily_change", row.lastDailyChange())
                    .append("total_change_pct", row.totalChangePct())
                    .append("moving_avg_7d", row.movingAvg7d())
                    .append("volatility_7d", row.volatility7d())
                    .append("trend_class", row.trendClass())
                    .append("volatility_class", row.volatilityClass());
        }

        @Override
        public ConsolidatedRow fromGroup(Group group) {
            return new ConsolidatedRow(
                    group.getString("currency", 0),
                    group.getDouble("current_rate", 0),
                    group.getDouble("last_daily_change", 0),
                    group.getDouble("total_change_pct", 0),
                    group.getDouble("moving_avg_7d", 0),
                    group.getDouble("volatility_7d", 0),
                    group.getString("trend_class", 0),
                    group.getString("volatility_class", 0));
        }
    }

    private static Group appendMetric(Group group, DailyMetric metric) {
        group.append("date", toEpochDay(metric.getDate()))
                .append("currency", metric.getCurrency())
                .append("rate_mean", metric.getRateMean())
                .append("rate_std", metric.getRateStd())
                .append("rate_min", metric.getRateMin())
                .append("rate_max", metric.getRateMax())
                .append("observation_count", metric.getObservationCount())
                .append("rate_range", metric.getRateRange())
                .append("coefficient_of_variation", metric.getCoefficientOfVariation());
        appendTimestamp(group, "last_update", metric.getLastUpdate());
        return group;
    }

    private static DailyMetric readMetric(Group group) {
        return DailyMetric.builder()
                .date(fromEpochDay(group.getInteger("date", 0)))
                .currency(group.getString("currency", 0))
                .rateMean(group.getDouble("rate_mean", 0))
                .rateStd(group.getDouble("rate_std", 0))
                .rateMin(group.getDouble("rate_min", 0))
                .rateMax(group.getDouble("rate_max", 0))
                .observationCount(group.getInteger("observation_count", 0))
                .rateRange(group.getDouble("rate_range", 0))
                .coefficientOfVariation(group.getDouble("coefficient_of_variation", 0))
                .lastUpdate(readTimestamp(group, "last_update"))
                .build();
    }
}
