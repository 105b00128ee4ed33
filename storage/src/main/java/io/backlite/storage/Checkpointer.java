// file: storage/src/main/java/io/backlite/storage/Checkpointer.java
package io.backlite.storage;

import java.util.List;
import java.util.Map;

/**
 * Full copies of the datastore, used to bound recovery time.
 * <p>
 * On restart the latest checkpoint seeds memory, then the WAL is replayed on top.
 */
public interface Checkpointer {

    /**
     * Persist a full copy of the datastore atomically.
     *
     * @return checkpoint identifier (file name)
     */
    String write(Map<String, List<Map<String, Object>>> collections);

    /** @return latest checkpoint, or null when none exists */
    Loaded loadLatest();

    record Loaded(String id, Map<String, List<Map<String, Object>>> collections) {}
}
