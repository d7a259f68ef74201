package de.bsommerfeld.spellbook.db;

import org.junit.jupiter.api.Test;

import static de.bsommerfeld.spellbook.db.BuildPhase.*;
import static org.junit.jupiter.api.Assertions.*;

class BuildPhaseTest {

    @Test
    void canAdvanceTo_shouldFollowLinearOrder() {
        assertTrue(INIT.canAdvanceTo(SCHEMA_CREATED));
        assertTrue(SCHEMA_CREATED.canAdvanceTo(SOURCE_IMPORTED));
        assertTrue(SOURCE_IMPORTED.canAdvanceTo(INDEXES_BUILT));
        assertTrue(INDEXES_BUILT.canAdvanceTo(SEARCH_INDEX_BUILT));
        assertTrue(SEARCH_INDEX_BUILT.canAdvanceTo(VERSION_STAMPED));
        assertTrue(VERSION_STAMPED.canAdvanceTo(DONE));
    }

    @Test
    void canAdvanceTo_shouldAllowRepeatedImports() {
        assertTrue(SOURCE_IMPORTED.canAdvanceTo(SOURCE_IMPORTED));
    }

    @Test
    void canAdvanceTo_shouldRejectSkipsAndRegressions() {
        assertFalse(INIT.canAdvanceTo(SOURCE_IMPORTED));
        assertFalse(SCHEMA_CREATED.canAdvanceTo(INDEXES_BUILT));
        assertFalse(SOURCE_IMPORTED.canAdvanceTo(SEARCH_INDEX_BUILT));
        assertFalse(INDEXES_BUILT.canAdvanceTo(SOURCE_IMPORTED));
        assertFalse(SEARCH_INDEX_BUILT.canAdvanceTo(DONE));
        assertFalse(DONE.canAdvanceTo(INIT));
        assertFalse(INIT.canAdvanceTo(INIT));
    }
}
