package com.di.tablerecon.engine;

import com.di.tablerecon.report.ComparisonFailure;

/**
 * Immutable partial result of one concurrent step: a value or the failure that replaced it.
 */
record StepOutcome<T>(T value, ComparisonFailure failure) {

    static <T> StepOutcome<T> success(T value) {
        return new StepOutcome<>(value, null);
    }

    static <T> StepOutcome<T> failed(ComparisonFailure failure) {
        return new StepOutcome<>(null, failure);
    }

    boolean succeeded() {
        return failure == null;
    }
}
