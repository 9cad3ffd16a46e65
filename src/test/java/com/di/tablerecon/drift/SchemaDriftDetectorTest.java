package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaDriftDetector Tests")
class SchemaDriftDetectorTest {

    private final SchemaDriftDetector detector = new SchemaDriftDetector();

    private static ColumnDescriptor col(String name, String type, int position) {
        return ColumnDescriptor.of(name, type, true, position);
    }

    // ============================================================================
    // Added / Removed
    // ============================================================================

    @Test
    @DisplayName("Should classify added and removed columns")
    void testDiff_AddedAndRemoved() {
        SchemaDiff diff = detector.diff(
                "before", List.of(col("col1", "integer", 1), col("col2", "varchar", 2)),
                "after", List.of(col("col1", "integer", 1), col("col3", "date", 2)));

        assertEquals(List.of("col3"), diff.addedNames());
        assertEquals(List.of("col2"), diff.removedNames());
        assertTrue(diff.changed().isEmpty());
        assertTrue(diff.hasDrift());
    }

    @Test
    @DisplayName("Should report no drift for identical column sets")
    void testDiff_NoDrift() {
        List<ColumnDescriptor> columns = List.of(col("id", "integer", 1), col("name", "varchar", 2));
        SchemaDiff diff = detector.diff("a", columns, "b", columns);

        assertFalse(diff.hasDrift());
        assertTrue(diff.requiredBefore().isEmpty());
    }

    @Test
    @DisplayName("Should treat a rename as one removal plus one addition")
    void testDiff_Rename() {
        SchemaDiff diff = detector.diff(
                "a", List.of(col("customer", "varchar", 1)),
                "b", List.of(col("customer_name", "varchar", 1)));

        assertEquals(List.of("customer_name"), diff.addedNames());
        assertEquals(List.of("customer"), diff.removedNames());
    }

    @Test
    @DisplayName("Should match column names case-insensitively")
    void testDiff_CaseInsensitiveNames() {
        SchemaDiff diff = detector.diff(
                "a", List.of(col("Amount", "INTEGER", 1)),
                "b", List.of(col("amount", "integer", 1)));

        assertFalse(diff.hasDrift());
    }

    // ============================================================================
    // Changed
    // ============================================================================

    @Test
    @DisplayName("Should flag a nullability change")
    void testDiff_NullableChange() {
        SchemaDiff diff = detector.diff(
                "a", List.of(ColumnDescriptor.of("email", "varchar", true, 1)),
                "b", List.of(ColumnDescriptor.of("email", "varchar", false, 1)));

        assertEquals(1, diff.changed().size());
        ColumnChange change = diff.changed().get(0);
        assertEquals(Set.of(ChangedField.NULLABLE), change.changedFields());
        assertTrue(change.before().nullable());
        assertFalse(change.after().nullable());
        assertEquals("email: nullable true -> false", change.describe());
    }

    @Test
    @DisplayName("Should flag type and length changes together")
    void testDiff_TypeAndLength() {
        SchemaDiff diff = detector.diff(
                "a", List.of(new ColumnDescriptor("code", "varchar", 10, true, 1)),
                "b", List.of(new ColumnDescriptor("code", "text", 20, true, 1)));

        ColumnChange change = diff.changed().get(0);
        assertTrue(change.changed(ChangedField.TYPE));
        assertTrue(change.changed(ChangedField.LENGTH));
        assertFalse(change.changed(ChangedField.NULLABLE));
        assertEquals("code: type varchar -> text, length 10 -> 20", change.describe());
    }

    @Test
    @DisplayName("Should collect NOT NULL columns of the before side")
    void testDiff_RequiredBefore() {
        SchemaDiff diff = detector.diff(
                "a", List.of(ColumnDescriptor.of("id", "integer", false, 1), col("note", "varchar", 2)),
                "b", List.of(col("note", "varchar", 1)));

        assertEquals(List.of("id"), diff.requiredBefore());
        assertEquals(Set.of("id"), diff.removedOrChangedAmong(diff.requiredBefore()));
    }

    @Test
    @DisplayName("Should find removed or changed columns among a given list")
    void testRemovedOrChangedAmong() {
        SchemaDiff diff = detector.diff(
                "a", List.of(col("id", "integer", 1), col("amount", "integer", 2), col("note", "varchar", 3)),
                "b", List.of(col("id", "integer", 1), col("amount", "bigint", 2)));

        assertEquals(Set.of("amount", "note"), diff.removedOrChangedAmong(List.of("AMOUNT", "note", "id")));
        assertTrue(diff.removedOrChangedAmong(List.of("id")).isEmpty());
    }
}
