package com.purchasingpower.chemflow.inference;

import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.chemflow.EntryFixtures.entry;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cluster Grouper Tests")
class ClusterGrouperTest {

    private final ClusterGrouper grouper = new ClusterGrouper();

    @Test
    @DisplayName("Partitions by cluster key in first-seen order")
    void testGroup_StablePartition() {
        // Given
        CalculationEntry a1 = entry("a1", "scf", "H2O", "A");
        CalculationEntry b1 = entry("b1", "scf", "H2O", "B");
        CalculationEntry a2 = entry("a2", "dos", "H2O", " A ");
        CalculationEntry loose = entry("x", "dos", "H2O", null);
        CalculationEntry blank = entry("y", "dos", "H2O", "");

        // When
        EntryClusters clusters = grouper.group(List.of(a1, b1, a2, loose, blank), false);

        // Then
        assertEquals(List.of("A", "B"), List.copyOf(clusters.clusters().keySet()));
        assertEquals(List.of(a1, a2), clusters.cluster("A"));
        assertEquals(List.of(b1), clusters.cluster("B"));
        assertEquals(List.of(loose, blank), clusters.unclustered());
        assertEquals(5, clusters.population().size());
        assertTrue(clusters.cluster("missing").isEmpty());
    }

    @Test
    @DisplayName("Duplicate id with conflicting fields is rejected")
    void testGroup_ConflictingDuplicate() {
        // Given: same id, different type
        List<CalculationEntry> entries = List.of(
                entry("dup", "geometry_optimization", "Au4", "C"),
                entry("dup", "scf_calculation", "Au4", "C"));

        // When / Then
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> grouper.group(entries, false));
        assertEquals(List.of("dup"), ex.getEntryIds());
    }

    @Test
    @DisplayName("Identical duplicates are rejected unless collapsing is configured")
    void testGroup_IdenticalDuplicates() {
        CalculationEntry e = entry("same", "scf", "Au4", "C");

        InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> grouper.group(List.of(e, e), InferenceOptions.defaults().isCollapseIdenticalDuplicates()));
        assertTrue(ex.getMessage().contains("same"));

        EntryClusters clusters = grouper.group(List.of(e, e), true);
        assertEquals(1, clusters.population().size());
        assertEquals(List.of(e), clusters.cluster("C"));
    }

    @Test
    @DisplayName("Blank ids are malformed")
    void testGroup_BlankId() {
        assertThrows(InvalidInputException.class,
                () -> grouper.group(List.of(entry("  ", "scf", "Au4", "C")), false));
        assertThrows(InvalidInputException.class,
                () -> grouper.group(List.of(entry(null, "scf", "Au4", "C")), false));
    }

    @Test
    @DisplayName("Empty population yields no clusters")
    void testGroup_Empty() {
        EntryClusters clusters = grouper.group(List.of(), false);

        assertTrue(clusters.clusters().isEmpty());
        assertTrue(clusters.unclustered().isEmpty());
    }
}
