package com.threatattribution.engine.version;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseVersionTest {

    @Test
    void defaultShouldRenderAsTuple() {
        assertEquals("(0, 0, 1)", DatabaseVersion.DEFAULT.toString());
    }

    @Test
    void parseShouldAcceptTupleForm() {
        assertEquals(new DatabaseVersion(1, 2, 2), DatabaseVersion.parse("(1, 2, 2)"));
        assertEquals(new DatabaseVersion(1, 2, 2), DatabaseVersion.parse(" ( 1,2 ,  2 ) "));
    }

    @Test
    void parseShouldRejectOtherForms() {
        assertThrows(IllegalArgumentException.class, () -> DatabaseVersion.parse(null));
        assertThrows(IllegalArgumentException.class, () -> DatabaseVersion.parse("1.2.2"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseVersion.parse("(1, 2)"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseVersion.parse("(1, -2, 3)"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseVersion.parse("(99999999999, 0, 0)"));
    }

    @Test
    void shouldRejectNegativeComponents() {
        assertThrows(IllegalArgumentException.class, () -> new DatabaseVersion(0, -1, 0));
    }

    @Test
    void patchIncrementShouldOnlyTouchPatch() {
        assertEquals("(1, 2, 3)", DatabaseVersion.parse("(1, 2, 2)").increment(VersionIncrement.PATCH).toString());
    }

    @Test
    void higherIncrementsShouldResetLowerComponents() {
        DatabaseVersion version = new DatabaseVersion(1, 2, 2);

        assertEquals(new DatabaseVersion(1, 3, 0), version.increment(VersionIncrement.MINOR));
        assertEquals(new DatabaseVersion(2, 0, 0), version.increment(VersionIncrement.MAJOR));
    }

    @Test
    void everyIncrementShouldBeNewer() {
        DatabaseVersion version = new DatabaseVersion(3, 9, 9);
        for (VersionIncrement increment : VersionIncrement.values()) {
            assertTrue(version.increment(increment).isNewerThan(version), increment.name());
        }
    }

    @Test
    void orderingShouldBeLexicographic() {
        assertTrue(new DatabaseVersion(0, 10, 0).compareTo(new DatabaseVersion(0, 9, 99)) > 0);
        assertTrue(new DatabaseVersion(1, 0, 0).compareTo(new DatabaseVersion(0, 99, 99)) > 0);
        assertEquals(0, new DatabaseVersion(0, 0, 1).compareTo(DatabaseVersion.DEFAULT));
        assertFalse(DatabaseVersion.DEFAULT.isNewerThan(DatabaseVersion.DEFAULT));
    }
}
