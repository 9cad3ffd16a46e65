package com.di.tablerecon.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Root-cause categories attached to reported failures and REST error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error (e.g. unknown column)"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to read the dataset or catalog"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    DATA_ERROR("Data error", "Dataset content or structure does not allow the comparison"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(t -> t instanceof PermissionDeniedDataAccessException, PERMISSION_ERROR);
        MATCHERS.put(t -> t instanceof BadSqlGrammarException, SQL_SYNTAX_ERROR);
        MATCHERS.put(t -> t instanceof DataAccessResourceFailureException, CONNECTION_ERROR);
        MATCHERS.put(ErrorCategory::isDataError, DATA_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    /**
     * Categorizes an exception, looking through engine and Spring wrappers to the SQL cause
     * when there is one.
     */
    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof QueryExecutionException qe && qe.isTimedOut()) {
            return TIMEOUT_ERROR;
        }
        SQLException sqlCause = findSqlException(exception);
        if (sqlCause != null && !(exception instanceof QueryTimeoutException)) {
            return categorizeSqlException(sqlCause);
        }
        Throwable current = exception;
        while (current != null) {
            for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
                if (e.getKey().test(current)) {
                    return e.getValue();
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return APPLICATION_ERROR;
    }

    private static SQLException findSqlException(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof SQLException sql) {
                return sql;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            if ("42501".equals(sqlState)) {
                return PERMISSION_ERROR;
            }
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase(Locale.ROOT);
            if (containsAny(lower, "timeout", "timed out", "canceling statement")) return TIMEOUT_ERROR;
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "unauthorized", "forbidden")) return PERMISSION_ERROR;
            if (containsAny(lower, "syntax", "parser error", "binder error", "does not exist", "not found")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "57", TIMEOUT_ERROR,
            "22", DATA_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof QueryTimeoutException
                || t instanceof java.net.SocketTimeoutException
                || (t instanceof QueryExecutionException qe && qe.isTimedOut());
    }

    private static boolean isDataError(Throwable t) {
        return t instanceof NoCommonKeyException
                || t instanceof KeyColumnNotFoundException
                || t instanceof ColumnNotFoundException
                || t instanceof EmptyKeySetException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
