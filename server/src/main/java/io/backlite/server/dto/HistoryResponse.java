// file: server/src/main/java/io/backlite/server/dto/HistoryResponse.java
package io.backlite.server.dto;

import java.util.List;

/** Body of GET /api/maintenance/backup/history. */
public class HistoryResponse {
    public List<BackupRecordResponse> history;
    public long total;
    public int page;
    public int pageSize;
}
