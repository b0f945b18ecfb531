package io.taskgraph.graph;

import io.taskgraph.model.Reference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferencesTest {
    @Test
    void parseIdShouldReadTaskAndSubtaskIds() {
        assertEquals(Reference.task(7), References.parseId("7"));
        assertEquals(Reference.subtask(7, 2), References.parseId(" 7.2 "));
        assertEquals("7.2", References.parseId("7.2").toString());
    }

    @Test
    void parseIdShouldRejectMalformedInput() {
        for (String raw : List.of("", "  ", "abc", "7.", ".2", "7.x", "0.1")) {
            DependencyException e = assertThrows(DependencyException.class, () -> References.parseId(raw), raw);
            assertEquals(ErrorKind.MALFORMED_REFERENCE, e.kind());
        }
    }

    @Test
    void smallNumbersInsideSubtaskListNameSiblings() {
        assertEquals(Reference.subtask(7, 3), References.normalize(3, 7));
        assertEquals(Reference.subtask(7, 99), References.normalize(99L, 7));
        assertEquals(Reference.task(100), References.normalize(100, 7));
        assertEquals(Reference.task(3), References.normalize(3, 0));
    }

    @Test
    void quotedIdsAreAlwaysExplicitAddresses() {
        assertEquals(Reference.task(3), References.normalize("3", 7));
        assertEquals(Reference.subtask(4, 1), References.normalize("4.1", 7));
        assertEquals(Reference.subtask(4, 1), References.normalize("4.1", 0));
    }

    @Test
    void storageValueKeepsTaskIdsDistinctFromSiblings() {
        assertEquals(3, References.toStorageValue(Reference.task(3), 0));
        assertEquals("3", References.toStorageValue(Reference.task(3), 7));
        assertEquals(150, References.toStorageValue(Reference.task(150), 7));
        assertEquals("7.2", References.toStorageValue(Reference.subtask(7, 2), 7));

        Object stored = References.toStorageValue(Reference.task(3), 7);
        assertEquals(Reference.task(3), References.normalize(stored, 7));
    }

    @Test
    void sortedPutsTasksBeforeSubtasks() {
        List<Reference> in = List.of(
                Reference.subtask(7, 2), Reference.task(3), Reference.subtask(1, 5), Reference.task(1), Reference.subtask(1, 2));
        assertEquals(
                List.of(Reference.task(1), Reference.task(3), Reference.subtask(1, 2), Reference.subtask(1, 5), Reference.subtask(7, 2)),
                References.sorted(in));
    }

    @Test
    void sameTargetComparesCanonicalIds() {
        assertTrue(References.sameTarget(References.normalize(2, 5), References.parseId("5.2")));
        assertFalse(References.sameTarget(Reference.task(2), Reference.subtask(5, 2)));
        assertFalse(References.sameTarget(null, Reference.task(2)));
    }
}
