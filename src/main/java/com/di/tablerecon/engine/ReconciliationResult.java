package com.di.tablerecon.engine;

import com.di.tablerecon.report.ReconciliationReport;

import java.util.List;

/**
 * A finished report plus the log lines derived from it.
 */
public record ReconciliationResult(ReconciliationReport report, List<String> logLines) {

    public ReconciliationResult {
        logLines = List.copyOf(logLines);
    }
}
