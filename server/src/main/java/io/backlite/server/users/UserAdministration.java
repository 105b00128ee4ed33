// file: server/src/main/java/io/backlite/server/users/UserAdministration.java
package io.backlite.server.users;

import io.backlite.core.MaintenanceException;
import io.backlite.server.audit.AuditTrail;
import io.backlite.storage.Datastore;
import io.backlite.storage.MaintenanceLock;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role and status changes on {@code users} records.
 * <p>
 * Guards the last-admin rule: the system always keeps at least one active ADMIN.
 * The check and the write run under the maintenance lock so a concurrent restore
 * cannot slip in between them.
 * <p>
 * A user record is an active admin when {@code role == "ADMIN"} and
 * {@code isActive} is not {@code false} (absent means active).
 */
public final class UserAdministration {
    public static final String COLLECTION = "users";

    private final Datastore datastore;
    private final MaintenanceLock lock;
    private final AuditTrail audit;

    public UserAdministration(Datastore datastore, MaintenanceLock lock, AuditTrail audit) {
        this.datastore = datastore;
        this.lock = lock;
        this.audit = audit;
    }

    public Map<String, Object> changeRole(String userId, String role, String actor) {
        Role newRole;
        try {
            newRole = Role.parse(role);
        } catch (IllegalArgumentException e) {
            throw MaintenanceException.validationFailed(e.getMessage());
        }
        Map<String, Object> updated = lock.callExclusive(() -> {
            Map<String, Object> user = load(userId);
            if (isActiveAdmin(user) && newRole != Role.ADMIN) {
                requireAnotherActiveAdmin(userId);
            }
            Map<String, Object> next = new LinkedHashMap<>(user);
            next.put("role", newRole.name());
            return datastore.put(COLLECTION, next);
        });
        audit.record(AuditTrail.USER_ROLE_CHANGED, actor, userId, Map.of("role", newRole.name()));
        return updated;
    }

    public Map<String, Object> changeStatus(String userId, boolean active, String actor) {
        Map<String, Object> updated = lock.callExclusive(() -> {
            Map<String, Object> user = load(userId);
            if (isActiveAdmin(user) && !active) {
                requireAnotherActiveAdmin(userId);
            }
            Map<String, Object> next = new LinkedHashMap<>(user);
            next.put("isActive", active);
            return datastore.put(COLLECTION, next);
        });
        audit.record(AuditTrail.USER_STATUS_CHANGED, actor, userId, Map.of("isActive", active));
        return updated;
    }

    static boolean isActiveAdmin(Map<String, Object> user) {
        return Role.ADMIN.name().equals(user.get("role")) && !Boolean.FALSE.equals(user.get("isActive"));
    }

    private Map<String, Object> load(String userId) {
        return datastore.find(COLLECTION, userId)
                .orElseThrow(() -> MaintenanceException.notFound("no user with id " + userId));
    }

    private void requireAnotherActiveAdmin(String userId) {
        List<Map<String, Object>> users = datastore.read(COLLECTION);
        long others = users.stream()
                .filter(UserAdministration::isActiveAdmin)
                .filter(u -> !userId.equals(u.get(Datastore.ID_FIELD)))
                .count();
        if (others == 0) {
            throw MaintenanceException.lastAdmin("user " + userId + " is the last active admin");
        }
    }
}
