// file: server/src/main/java/io/backlite/server/restore/RestorePolicy.java
package io.backlite.server.restore;

import java.util.Objects;
import java.util.Set;

/**
 * What a restore does with collections the datastore does not register.
 *
 * @param allowlist with {@link UnknownCollections#REJECT}, names that are skipped instead of rejected
 */
public record RestorePolicy(UnknownCollections unknownCollections, Set<String> allowlist) {

    public enum UnknownCollections { IGNORE, REJECT }

    public RestorePolicy {
        Objects.requireNonNull(unknownCollections, "unknownCollections");
        allowlist = allowlist == null ? Set.of() : Set.copyOf(allowlist);
    }

    public static RestorePolicy ignoreUnknown() {
        return new RestorePolicy(UnknownCollections.IGNORE, Set.of());
    }

    public static RestorePolicy rejectUnknown(Set<String> allowlist) {
        return new RestorePolicy(UnknownCollections.REJECT, allowlist);
    }

    boolean rejects(String collection) {
        return unknownCollections == UnknownCollections.REJECT && !allowlist.contains(collection);
    }
}
