package com.di.tablerecon.report;

/**
 * Overall outcome of a run.
 */
public enum ReportStatus {
    /** Every comparison completed and found nothing. */
    OK,
    /** Every comparison completed; data-quality findings exist. */
    WARNING,
    /** At least one comparison could not be completed. */
    ERROR
}
