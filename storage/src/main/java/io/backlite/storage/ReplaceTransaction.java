// file: storage/src/main/java/io/backlite/storage/ReplaceTransaction.java
package io.backlite.storage;

import java.util.List;
import java.util.Map;

/**
 * Staged replacement of the whole datastore.
 * <p>
 * Collections that are never staged end up empty after commit. Either every
 * staged collection becomes visible at once or none does.
 */
public interface ReplaceTransaction extends AutoCloseable {

    /**
     * Stage the complete content of one collection.
     *
     * @throws IllegalArgumentException unknown collection, duplicate or non-string {@code _id}
     * @throws IllegalStateException    collection already staged, or transaction finished
     */
    void stage(String collection, List<? extends Map<String, ?>> records);

    /** Make all staged content durable and visible atomically. */
    void commit();

    /** Discard staged content unless committed. */
    @Override
    void close();
}
