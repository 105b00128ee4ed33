// file: server/src/main/java/io/backlite/server/dto/SettingsRequest.java
package io.backlite.server.dto;

/**
 * JSON body for PATCH /api/maintenance/auto-backup/settings. Every field is optional.
 * Example:
 *   {
 *     "enabled": true,
 *     "intervalValue": 12,
 *     "intervalUnit": "hours"
 *   }
 */
public class SettingsRequest {
    public Boolean enabled;
    public Integer intervalValue;
    public String intervalUnit;  // "hours" | "days" | "weeks"
}
