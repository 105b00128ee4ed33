// file: core/src/test/java/io/backlite/core/RetentionPolicyTest.java
package io.backlite.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-10T12:00:00Z");

    private static BackupRecord rec(String id, Duration age) {
        return new BackupRecord(id, id + ".json", 10, BackupSource.AUTO, "system", NOW.minus(age));
    }

    @Test
    void keep_latest_prunes_everything_beyond_the_newest_n() {
        var history = List.of(
                rec("a", Duration.ofHours(1)),
                rec("b", Duration.ofHours(2)),
                rec("c", Duration.ofHours(3)));

        var expired = RetentionPolicy.keepLatest(2).expired(history, NOW);

        assertEquals(1, expired.size());
        assertEquals("c", expired.get(0).id());
    }

    @Test
    void max_age_prunes_only_older_records() {
        var history = List.of(
                rec("fresh", Duration.ofDays(1)),
                rec("old", Duration.ofDays(40)));

        var expired = RetentionPolicy.olderThan(Duration.ofDays(30)).expired(history, NOW);

        assertEquals(List.of("old"), expired.stream().map(BackupRecord::id).toList());
    }

    @Test
    void unlimited_policy_prunes_nothing() {
        var policy = new RetentionPolicy(0, null);
        assertTrue(policy.isUnlimited());
        assertTrue(policy.expired(List.of(rec("a", Duration.ofDays(999))), NOW).isEmpty());
    }
}
