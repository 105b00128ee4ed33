// file: storage/src/main/java/io/backlite/storage/Datastore.java
package io.backlite.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live document datastore: a fixed, ordered set of named collections of JSON records.
 * <p>
 * Every record carries a string identity under {@link #ID_FIELD}. Writes are
 * durable when the call returns. Operations on an unregistered collection name
 * throw {@link IllegalArgumentException}.
 */
public interface Datastore {

    String ID_FIELD = "_id";

    /** Registered collection names, in their fixed order. */
    List<String> collections();

    /**
     * Insert or overwrite a record by its {@code _id}. A missing id is assigned.
     *
     * @return the stored (normalized) record, including its {@code _id}
     */
    Map<String, Object> put(String collection, Map<String, ?> record);

    /** @return true when a record was removed */
    boolean delete(String collection, String id);

    Optional<Map<String, Object>> find(String collection, String id);

    /** All records of one collection in insertion order. */
    List<Map<String, Object>> read(String collection);

    /**
     * Consistent read of every collection at a single point in time.
     * Keys follow {@link #collections()} order.
     */
    Map<String, List<Map<String, Object>>> view();

    /**
     * Start a whole-datastore replacement. Nothing is visible until
     * {@link ReplaceTransaction#commit()}; closing without commit discards it.
     */
    ReplaceTransaction beginReplace();
}
