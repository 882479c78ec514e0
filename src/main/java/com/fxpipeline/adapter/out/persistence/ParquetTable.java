package com.fxpipeline.adapter.out.persistence;

import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.schema.MessageType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Mapping between a row type and its Parquet schema.
 */
public interface ParquetTable<T> {

    MessageType schema();

    Group toGroup(SimpleGroupFactory factory, T row);

    T fromGroup(Group group);

    // Timestamps are stored as UTC microseconds, dates as days since epoch

    static long toMicros(LocalDateTime timestamp) {
        return Math.addExact(
                Math.multiplyExact(timestamp.toEpochSecond(ZoneOffset.UTC), 1_000_000L),
                timestamp.getNano() / 1_000L);
    }

    static LocalDateTime fromMicros(long micros) {
        long seconds = Math.floorDiv(micros, 1_000_000L);
        long microsOfSecond = Math.floorMod(micros, 1_000_000L);
        return LocalDateTime.ofEpochSecond(seconds, (int) (microsOfSecond * 1_000L), ZoneOffset.UTC);
    }

    static int toEpochDay(LocalDate date) {
        return (int) date.toEpochDay();
    }

    static LocalDate fromEpochDay(int epochDay) {
        return LocalDate.ofEpochDay(epochDay);
    }

    static void appendTimestamp(Group group, String field, LocalDateTime timestamp) {
        if (timestamp != null) {
            group.append(field, toMicros(timestamp));
        }
    }

    static LocalDateTime readTimestamp(Group group, String field) {
        if (group.getFieldRepetitionCount(field) == 0) {
            return null;
        }
        return fromMicros(group.getLong(field, 0));
    }
}
