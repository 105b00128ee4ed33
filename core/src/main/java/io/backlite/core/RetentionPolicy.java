// file: core/src/main/java/io/backlite/core/RetentionPolicy.java
package io.backlite.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Which stored backups may be pruned.
 *
 * @param keepLatest keep at most this many newest backups; 0 means unlimited
 * @param maxAge     prune backups older than this; null means unlimited
 */
public record RetentionPolicy(int keepLatest, Duration maxAge) {

    public RetentionPolicy {
        if (keepLatest < 0) throw new IllegalArgumentException("keepLatest must be >= 0");
        if (maxAge != null && (maxAge.isNegative() || maxAge.isZero())) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
    }

    public static RetentionPolicy keepLatest(int n) {
        if (n < 1) throw new IllegalArgumentException("keepLatest must be >= 1");
        return new RetentionPolicy(n, null);
    }

    public static RetentionPolicy olderThan(Duration maxAge) {
        return new RetentionPolicy(0, maxAge);
    }

    public boolean isUnlimited() {
        return keepLatest == 0 && maxAge == null;
    }

    /**
     * Select the records to prune.
     *
     * @param newestFirst full history, newest first
     * @param now         reference time for the age limit
     * @return records to delete, in the same order
     */
    public List<BackupRecord> expired(List<BackupRecord> newestFirst, Instant now) {
        List<BackupRecord> out = new ArrayList<>();
        Instant cutoff = maxAge == null ? null : now.minus(maxAge);
        for (int i = 0; i < newestFirst.size(); i++) {
            BackupRecord r = newestFirst.get(i);
            boolean beyondCount = keepLatest > 0 && i >= keepLatest;
            boolean tooOld = cutoff != null && r.createdAt().isBefore(cutoff);
            if (beyondCount || tooOld) {
                out.add(r);
            }
        }
        return out;
    }
}
