// file: core/src/main/java/io/backlite/core/FailureKind.java
package io.backlite.core;

/**
 * Typed failure categories surfaced by maintenance operations.
 * <p>
 * {@link #code()} is the stable identifier used in HTTP error bodies and logs.
 */
public enum FailureKind {
    MALFORMED_DOCUMENT("MalformedDocument"),
    UNSUPPORTED_VERSION("UnsupportedVersion"),
    VALIDATION_FAILED("ValidationFailed"),
    STORAGE_FAILURE("StorageFailure"),
    NOT_FOUND("NotFound"),
    INVALID_SETTINGS("InvalidSettings"),
    LAST_ADMIN_INVARIANT_VIOLATION("LastAdminInvariantViolation"),
    CONFIRMATION_REQUIRED("ConfirmationRequired");

    private final String code;

    FailureKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
