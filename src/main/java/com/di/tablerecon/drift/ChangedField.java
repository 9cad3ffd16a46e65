package com.di.tablerecon.drift;

/**
 * Attribute of a column that differs between two snapshots.
 */
public enum ChangedField {
    TYPE,
    LENGTH,
    NULLABLE
}
