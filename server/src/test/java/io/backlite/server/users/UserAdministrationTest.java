// file: server/src/test/java/io/backlite/server/users/UserAdministrationTest.java
package io.backlite.server.users;

import io.backlite.core.FailureKind;
import io.backlite.core.MaintenanceException;
import io.backlite.server.audit.AuditTrail;
import io.backlite.server.testutil.TestStack;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserAdministrationTest {

    @TempDir
    Path dir;

    @Test
    void admin_can_be_demoted_while_another_admin_remains() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.seed();

            Map<String, Object> u1 = stack.users.changeRole("u1", "EMPLOYEE", "root");

            assertEquals("EMPLOYEE", u1.get("role"));
            assertEquals("EMPLOYEE", stack.datastore.find("users", "u1").orElseThrow().get("role"));
            assertTrue(stack.auditActions().contains(AuditTrail.USER_ROLE_CHANGED));
        }
    }

    @Test
    void last_active_admin_cannot_be_demoted_or_deactivated() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.seed();
            stack.users.changeStatus("u2", false, "root");

            MaintenanceException demote = assertThrows(MaintenanceException.class,
                    () -> stack.users.changeRole("u1", "EMPLOYEE", "root"));
            MaintenanceException deactivate = assertThrows(MaintenanceException.class,
                    () -> stack.users.changeStatus("u1", false, "root"));

            assertEquals(FailureKind.LAST_ADMIN_INVARIANT_VIOLATION, demote.kind());
            assertEquals(FailureKind.LAST_ADMIN_INVARIANT_VIOLATION, deactivate.kind());
            var u1 = stack.datastore.find("users", "u1").orElseThrow();
            assertEquals("ADMIN", u1.get("role"));
            assertEquals(true, u1.get("isActive"));
        }
    }

    @Test
    void employees_can_be_changed_freely() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.seed();

            stack.users.changeStatus("u3", false, "root");
            Map<String, Object> promoted = stack.users.changeRole("u3", "admin", "root");

            assertEquals("ADMIN", promoted.get("role"));
            assertEquals(false, promoted.get("isActive"));
        }
    }

    @Test
    void unknown_user_and_bad_role_are_rejected() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.seed();

            assertEquals(FailureKind.NOT_FOUND, assertThrows(MaintenanceException.class,
                    () -> stack.users.changeRole("nobody", "ADMIN", "root")).kind());
            assertEquals(FailureKind.VALIDATION_FAILED, assertThrows(MaintenanceException.class,
                    () -> stack.users.changeRole("u3", "OWNER", "root")).kind());
        }
    }

    @Test
    void missing_is_active_counts_as_active() {
        assertTrue(UserAdministration.isActiveAdmin(Map.of("role", "ADMIN")));
        assertFalse(UserAdministration.isActiveAdmin(Map.of("role", "ADMIN", "isActive", false)));
        assertFalse(UserAdministration.isActiveAdmin(Map.of("role", "EMPLOYEE")));
    }
}
