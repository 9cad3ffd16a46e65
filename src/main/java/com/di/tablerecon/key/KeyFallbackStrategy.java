package com.di.tablerecon.key;

/**
 * What key inference does when no common column matches a key pattern.
 */
public enum KeyFallbackStrategy {
    /** Use the first common column (ordinal order of the first schema) as a single-column key. */
    FIRST_COMMON_COLUMN,
    /** Use every common column as a composite key. */
    ALL_COMMON_COLUMNS
}
