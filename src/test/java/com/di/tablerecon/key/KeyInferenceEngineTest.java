package com.di.tablerecon.key;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.exception.EmptyKeySetException;
import com.di.tablerecon.exception.KeyColumnNotFoundException;
import com.di.tablerecon.exception.NoCommonKeyException;
import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyInferenceEngine Tests")
class KeyInferenceEngineTest {

    private final KeyInferenceEngine engine = new KeyInferenceEngine();

    private static SchemaSnapshot snapshot(String table, String... columns) {
        List<ColumnDescriptor> descriptors = new ArrayList<>();
        for (int i = 0; i < columns.length; i++) {
            descriptors.add(ColumnDescriptor.of(columns[i], "integer", true, i + 1));
        }
        return SchemaSnapshot.of(DatasetHandle.of("public", table), descriptors);
    }

    // ============================================================================
    // Pattern Matching
    // ============================================================================

    @Test
    @DisplayName("Should pick the id column shared by both datasets")
    void testInferKeys_IdColumn() {
        KeySet keys = engine.inferKeys(List.of(
                snapshot("orders", "id", "name", "amount"),
                snapshot("orders_copy", "id", "name")));

        assertEquals(List.of("id"), keys.columns());
        assertEquals(KeySet.Origin.INFERRED, keys.origin());
        assertFalse(keys.isExplicit());
    }

    @Test
    @DisplayName("Should use every common column that matches a key pattern, in first-schema order")
    void testInferKeys_CompositeKey() {
        KeySet keys = engine.inferKeys(List.of(
                snapshot("a", "customer_id", "amount", "order_key"),
                snapshot("b", "order_key", "customer_id", "amount")));

        assertEquals(List.of("customer_id", "order_key"), keys.columns());
    }

    @Test
    @DisplayName("Should match column names case-insensitively and keep the first spelling")
    void testInferKeys_CaseInsensitive() {
        KeySet keys = engine.inferKeys(List.of(
                snapshot("a", "Account_ID", "total"),
                snapshot("b", "account_id", "total")));

        assertEquals(List.of("Account_ID"), keys.columns());
    }

    // ============================================================================
    // Fallback
    // ============================================================================

    @Test
    @DisplayName("Should fall back to the first common column when nothing looks like a key")
    void testInferKeys_FirstCommonFallback() {
        KeySet keys = engine.inferKeys(List.of(
                snapshot("a", "name", "amount"),
                snapshot("b", "name", "region")));

        assertEquals(List.of("name"), keys.columns());
    }

    @Test
    @DisplayName("Should use all common columns with the ALL_COMMON_COLUMNS strategy")
    void testInferKeys_AllCommonFallback() {
        KeySet keys = engine.inferKeys(List.of(
                snapshot("a", "name", "region", "amount"),
                snapshot("b", "amount", "name", "region")),
                KeyFallbackStrategy.ALL_COMMON_COLUMNS);

        assertEquals(List.of("name", "region", "amount"), keys.columns());
    }

    @Test
    @DisplayName("Should honour custom key patterns")
    void testInferKeys_CustomPatterns() {
        KeyInferenceEngine custom = new KeyInferenceEngine(List.of("code"), KeyFallbackStrategy.FIRST_COMMON_COLUMN);
        KeySet keys = custom.inferKeys(List.of(
                snapshot("a", "id", "country_code"),
                snapshot("b", "id", "country_code")));

        assertEquals(List.of("country_code"), keys.columns());
    }

    @Test
    @DisplayName("Should fail when the datasets share no column")
    void testInferKeys_NoCommonColumn() {
        NoCommonKeyException ex = assertThrows(NoCommonKeyException.class,
                () -> engine.inferKeys(List.of(snapshot("a", "a"), snapshot("b", "b"))));
        assertTrue(ex.getMessage().contains("public.a"));
    }

    @Test
    @DisplayName("Should reject an empty schema list")
    void testInferKeys_NoSchemas() {
        assertThrows(IllegalArgumentException.class, () -> engine.inferKeys(List.of()));
    }

    // ============================================================================
    // KeySet
    // ============================================================================

    @Test
    @DisplayName("Should reject an explicit key list with no usable column")
    void testExplicit_Empty() {
        assertThrows(EmptyKeySetException.class, () -> KeySet.explicit(List.of(), "orders"));
        assertThrows(EmptyKeySetException.class, () -> KeySet.explicit(null, "orders"));
        assertThrows(EmptyKeySetException.class, () -> KeySet.explicit(List.of(" "), "orders"));
    }

    @Test
    @DisplayName("Should deduplicate key columns case-insensitively")
    void testExplicit_Deduplicates() {
        KeySet keys = KeySet.explicit(List.of("id", "ID", " region "), "orders");
        assertEquals(List.of("id", "region"), keys.columns());
        assertTrue(keys.isExplicit());
        assertTrue(keys.contains("REGION"));
    }

    @Test
    @DisplayName("Should resolve key columns to the spelling of each dataset")
    void testResolveAgainst_Spelling() {
        KeySet keys = KeySet.explicit(List.of("ID"), "orders");
        assertEquals(List.of("id"), keys.resolveAgainst(snapshot("orders", "id", "name")));
    }

    @Test
    @DisplayName("Should fail resolution when an authoritative schema lacks a key column")
    void testResolveAgainst_Missing() {
        KeySet keys = KeySet.explicit(List.of("id", "region"), "orders");
        KeyColumnNotFoundException ex = assertThrows(KeyColumnNotFoundException.class,
                () -> keys.resolveAgainst(snapshot("orders", "id", "name")));
        assertEquals("region", ex.getColumn());
    }

    @Test
    @DisplayName("Should pass unknown key columns through for a fallback schema")
    void testResolveAgainst_FallbackSnapshot() {
        KeySet keys = KeySet.explicit(List.of("id"), "orders");
        SchemaSnapshot fallback = SchemaSnapshot.fallback(DatasetHandle.of("public", "orders"), List.of("name"));
        assertEquals(List.of("id"), keys.resolveAgainst(fallback));
    }
}
