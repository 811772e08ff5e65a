package io.github.cyfko.filtergate.jpa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatabaseVersion Tests")
class DatabaseVersionTest {

    @Test
    @DisplayName("Banners are parsed to their first dotted number")
    void parse() {
        assertEquals(new DatabaseVersion(14, 5, 0), DatabaseVersion.parse("PostgreSQL 14.5 on x86_64-pc-linux-gnu"));
        assertEquals(new DatabaseVersion(8, 0, 32), DatabaseVersion.parse("8.0.32-0ubuntu0.22.04.2"));
        assertEquals(new DatabaseVersion(10, 11, 6), DatabaseVersion.parse("10.11.6-MariaDB"));
        assertEquals(new DatabaseVersion(16, 0, 0), DatabaseVersion.parse("16"));
    }

    @Test
    @DisplayName("Missing or unparseable banners are unknown")
    void unknown() {
        assertTrue(DatabaseVersion.parse(null).isUnknown());
        assertTrue(DatabaseVersion.parse("no digits here").isUnknown());
        assertEquals("0.0.0", DatabaseVersion.UNKNOWN.toString());
    }

    @Test
    @DisplayName("Comparisons are numeric per component")
    void compare() {
        DatabaseVersion version = DatabaseVersion.parse("8.0.17");

        assertTrue(version.atLeast(8, 0, 17));
        assertTrue(version.atLeast(5, 7));
        assertFalse(version.atLeast(8, 0, 18));
        assertTrue(DatabaseVersion.parse("9.10").compareTo(DatabaseVersion.parse("9.4")) > 0);
    }
}
