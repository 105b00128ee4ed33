// file: server/src/main/java/io/backlite/server/dto/SettingsResponse.java
package io.backlite.server.dto;

import java.time.Instant;

public class SettingsResponse {
    public boolean enabled;
    public int intervalValue;
    public String intervalUnit;
    public Instant lastRunAt;   // null until the first run
    public Instant nextRunAt;   // null while disabled
}
