// file: server/src/main/java/io/backlite/server/maintenance/SettingsUpdate.java
package io.backlite.server.maintenance;

/**
 * Partial settings change as received from a caller. Null fields keep their
 * current value; {@code intervalUnit} is still unparsed text.
 */
public record SettingsUpdate(Boolean enabled, Integer intervalValue, String intervalUnit) {
}
