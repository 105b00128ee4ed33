// file: core/src/main/java/io/backlite/core/HistoryPage.java
package io.backlite.core;

import java.util.List;

/** One page of backup history, newest first. {@code total} counts all records. */
public record HistoryPage(List<BackupRecord> records, long total, int page, int pageSize) {
    public HistoryPage {
        records = List.copyOf(records);
    }
}
