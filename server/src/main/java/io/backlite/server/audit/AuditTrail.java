// file: server/src/main/java/io/backlite/server/audit/AuditTrail.java
package io.backlite.server.audit;

import java.util.Map;

/**
 * Append-only record of administrative actions.
 * <p>
 * Implementations must never throw: an audit failure is logged and the
 * operation that produced it still succeeds.
 */
public interface AuditTrail {

    String BACKUP_CREATED = "BACKUP_CREATED";
    String BACKUP_EXPORTED = "BACKUP_EXPORTED";
    String AUTO_BACKUP_RUN = "AUTO_BACKUP_RUN";
    String AUTO_BACKUP_TRIGGERED = "AUTO_BACKUP_TRIGGERED";
    String BACKUP_RESTORED = "BACKUP_RESTORED";
    String BACKUP_DELETED = "BACKUP_DELETED";
    String AUTO_BACKUP_SETTINGS_CHANGED = "AUTO_BACKUP_SETTINGS_CHANGED";
    String USER_ROLE_CHANGED = "USER_ROLE_CHANGED";
    String USER_STATUS_CHANGED = "USER_STATUS_CHANGED";
    String SYSTEM_WIPE = "SYSTEM_WIPE";

    void record(String action, String actor, String target, Map<String, Object> metadata);

    static AuditTrail noop() {
        return (action, actor, target, metadata) -> { };
    }
}
