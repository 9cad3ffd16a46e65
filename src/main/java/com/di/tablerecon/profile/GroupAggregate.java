package com.di.tablerecon.profile;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One group of an {@code aggregateBy} result.
 */
@Value
@Builder
public class GroupAggregate {
    Object groupValue;
    long rowCount;
    /** Rows of the group whose measure is NULL. */
    long nullCount;
    Double nullPercentage;
    /** Requested statistics in request order; numeric results as Double, COUNT variants as Long. */
    Map<AggregateStat, Object> values;
}
