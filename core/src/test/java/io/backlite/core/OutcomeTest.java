// file: core/src/test/java/io/backlite/core/OutcomeTest.java
package io.backlite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void success_unwraps_to_its_value() {
        Outcome<String> ok = Outcome.success("done");

        assertTrue(ok.isSuccess());
        assertEquals("done", ok.orElseThrow());
    }

    @Test
    void failure_rethrows_with_its_kind() {
        Outcome<String> failed = Outcome.failure(FailureKind.NOT_FOUND, "no backup with id x");

        assertFalse(failed.isSuccess());
        var ex = assertThrows(MaintenanceException.class, failed::orElseThrow);
        assertEquals(FailureKind.NOT_FOUND, ex.kind());
        assertEquals("no backup with id x", ex.getMessage());
    }

    @Test
    void failure_codes_are_stable_identifiers() {
        assertEquals("MalformedDocument", FailureKind.MALFORMED_DOCUMENT.code());
        assertEquals("LastAdminInvariantViolation", FailureKind.LAST_ADMIN_INVARIANT_VIOLATION.code());
    }
}
