package com.di.tablerecon.key;

import com.di.tablerecon.exception.NoCommonKeyException;
import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Infers a join key from the columns shared by every dataset.
 * <p>
 * Common columns are the case-insensitive intersection of all schemas, in the ordinal order of
 * the first schema. Every common column whose name contains one of the key patterns joins the
 * key once, in that order. When no column matches, the configured {@link KeyFallbackStrategy}
 * applies. Key uniqueness is never checked here.
 */
@Slf4j
public class KeyInferenceEngine {

    public static final List<String> DEFAULT_KEY_PATTERNS = List.of("id", "key", "pk", "primary_key");

    private final List<String> keyPatterns;
    private final KeyFallbackStrategy defaultFallback;

    public KeyInferenceEngine() {
        this(DEFAULT_KEY_PATTERNS, KeyFallbackStrategy.FIRST_COMMON_COLUMN);
    }

    public KeyInferenceEngine(List<String> keyPatterns, KeyFallbackStrategy defaultFallback) {
        this.keyPatterns = (keyPatterns == null || keyPatterns.isEmpty() ? DEFAULT_KEY_PATTERNS : keyPatterns)
                .stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .toList();
        this.defaultFallback = defaultFallback == null ? KeyFallbackStrategy.FIRST_COMMON_COLUMN : defaultFallback;
    }

    public KeySet inferKeys(List<SchemaSnapshot> schemas) {
        return inferKeys(schemas, defaultFallback);
    }

    /**
     * @throws NoCommonKeyException when the schemas share no column
     */
    public KeySet inferKeys(List<SchemaSnapshot> schemas, KeyFallbackStrategy fallback) {
        if (schemas == null || schemas.isEmpty()) {
            throw new IllegalArgumentException("At least one schema is required for key inference");
        }
        KeyFallbackStrategy strategy = fallback == null ? defaultFallback : fallback;

        List<String> common = commonColumns(schemas);
        if (common.isEmpty()) {
            throw new NoCommonKeyException(schemas.stream()
                    .map(s -> s.dataset().qualifiedName())
                    .toList());
        }

        List<String> matched = common.stream()
                .filter(this::looksLikeKey)
                .toList();
        if (!matched.isEmpty()) {
            log.info("[KEYS] Inferred key {} from {} common columns", matched, common.size());
            return KeySet.inferred(matched);
        }

        List<String> fallbackKey = switch (strategy) {
            case FIRST_COMMON_COLUMN -> List.of(common.get(0));
            case ALL_COMMON_COLUMNS -> common;
        };
        log.info("[KEYS] No common column matches {}; falling back to {} -> {}", keyPatterns, strategy, fallbackKey);
        return KeySet.inferred(fallbackKey);
    }

    /**
     * Case-insensitive intersection of column names, in the first schema's ordinal order and spelling.
     */
    public List<String> commonColumns(List<SchemaSnapshot> schemas) {
        List<Set<String>> others = schemas.subList(1, schemas.size()).stream()
                .map(s -> s.columns().stream()
                        .map(ColumnDescriptor::normalizedName)
                        .collect(Collectors.toSet()))
                .toList();

        List<String> common = new ArrayList<>();
        for (ColumnDescriptor column : schemas.get(0).columns()) {
            String normalized = column.normalizedName();
            if (others.stream().allMatch(names -> names.contains(normalized))) {
                common.add(column.name());
            }
        }
        return common;
    }

    private boolean looksLikeKey(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        return keyPatterns.stream().anyMatch(lower::contains);
    }
}
