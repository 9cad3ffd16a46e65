package com.di.tablerecon.profile;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Record counts per calendar period of a date column. NULL dates are excluded.
 */
@Value
@Builder
public class DateDistribution {

    String datasetName;
    String columnName;
    DatePart datePart;
    List<Bucket> buckets;

    int uniquePeriods;
    long totalRecords;
    long minPeriodCount;
    long maxPeriodCount;
    Double avgPeriodCount;
    /** Label of the earliest period, null when there are no buckets. */
    String minPeriod;
    /** Label of the latest period, null when there are no buckets. */
    String maxPeriod;

    public record Bucket(LocalDate periodStart, String label, long recordCount) {}

    static DateDistribution of(String datasetName, String columnName, DatePart datePart, List<Bucket> buckets) {
        long total = buckets.stream().mapToLong(Bucket::recordCount).sum();
        return DateDistribution.builder()
                .datasetName(datasetName)
                .columnName(columnName)
                .datePart(datePart)
                .buckets(List.copyOf(buckets))
                .uniquePeriods(buckets.size())
                .totalRecords(total)
                .minPeriodCount(buckets.stream().mapToLong(Bucket::recordCount).min().orElse(0))
                .maxPeriodCount(buckets.stream().mapToLong(Bucket::recordCount).max().orElse(0))
                .avgPeriodCount(buckets.isEmpty() ? null : (double) total / buckets.size())
                .minPeriod(buckets.isEmpty() ? null : buckets.get(0).label())
                .maxPeriod(buckets.isEmpty() ? null : buckets.get(buckets.size() - 1).label())
                .build();
    }
}
