package com.di.tablerecon.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Input validation for identifiers that end up quoted into warehouse SQL
 * (schema, dataset and column names) and for numeric request bounds.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Identifier Validation Patterns
    // ============================================================================

    /**
     * Valid identifier:
     * - Starts with letter or underscore
     * - Followed by letters, digits, underscores, or dollar signs
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]*$"
    );

    /**
     * Statement terminators, comments and quotes. Identifiers are quoted when rendered,
     * so these are the only characters that could break out of the quoting.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(--|/\\*|\\*/|;|'|\")"
    );

    /** Redshift allows 127 bytes; PostgreSQL truncates at 63. */
    private static final int MAX_IDENTIFIER_LENGTH = 127;

    private static final int MIN_SAMPLE_LIMIT = 0;
    private static final int MAX_SAMPLE_LIMIT = 1_000;

    // ============================================================================
    // SQL Identifier Validation
    // ============================================================================

    /**
     * Validates an identifier (dataset name, schema name, column name).
     *
     * @param identifier     The identifier to validate
     * @param identifierType Type of identifier for error messages (e.g., "dataset name", "column name")
     * @return The validated identifier (trimmed)
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }

        String trimmed = identifier.trim();

        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }

        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }

        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns. " +
                            "Only alphanumeric characters, underscores, and dollar signs are allowed.",
                            identifierType));
        }

        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. " +
                            "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                            identifierType, trimmed));
        }

        return trimmed;
    }

    /**
     * Validates a column name.
     */
    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "Column name");
    }

    // ============================================================================
    // Numeric Input Validation
    // ============================================================================

    /**
     * Validates the number of sample rows requested for a finding.
     */
    public static int validateSampleLimit(int sampleLimit) {
        if (sampleLimit < MIN_SAMPLE_LIMIT) {
            throw new IllegalArgumentException(
                    String.format("Sample limit cannot be negative, got: %d", sampleLimit));
        }
        if (sampleLimit > MAX_SAMPLE_LIMIT) {
            throw new IllegalArgumentException(
                    String.format("Sample limit exceeds maximum of %d, got: %d", MAX_SAMPLE_LIMIT, sampleLimit));
        }
        return sampleLimit;
    }

    // ============================================================================
    // Utility Methods
    // ============================================================================

    /**
     * Sanitizes a string for logging (removes sensitive information).
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        if (input.contains("password=")) {
            return input.replaceAll("password=[^;&]+", "password=***");
        }
        return input;
    }
}
