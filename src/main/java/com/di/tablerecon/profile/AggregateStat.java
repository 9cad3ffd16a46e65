package com.di.tablerecon.profile;

import java.util.Locale;

/**
 * Per-group statistic over the measure column.
 */
public enum AggregateStat {
    SUM("SUM(%s)"),
    AVG("AVG(%s)"),
    MIN("MIN(%s)"),
    MAX("MAX(%s)"),
    STDDEV("STDDEV_SAMP(%s)"),
    COUNT("COUNT(%s)"),
    COUNT_DISTINCT("COUNT(DISTINCT %s)"),
    MEDIAN("PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY %s)");

    private final String template;

    AggregateStat(String template) {
        this.template = template;
    }

    public String sql(String column) {
        return String.format(template, column);
    }

    /** Result column alias. */
    public String alias() {
        return "stat_" + name().toLowerCase(Locale.ROOT);
    }
}
