// file: core/src/main/java/io/backlite/core/MaintenanceException.java
package io.backlite.core;

import java.util.Objects;

/**
 * Unchecked failure carrying a {@link FailureKind}.
 * <p>
 * Thrown by the storage and restore layers; the maintenance gateway converts it
 * into an {@link Outcome.Failure} so callers never see a raw exception.
 */
public class MaintenanceException extends RuntimeException {
    private final FailureKind kind;

    public MaintenanceException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public MaintenanceException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }

    public static MaintenanceException malformed(String message) {
        return new MaintenanceException(FailureKind.MALFORMED_DOCUMENT, message);
    }

    public static MaintenanceException unsupportedVersion(int found, int supported) {
        return new MaintenanceException(FailureKind.UNSUPPORTED_VERSION,
                "schemaVersion " + found + " is newer than supported version " + supported);
    }

    public static MaintenanceException validationFailed(String message) {
        return new MaintenanceException(FailureKind.VALIDATION_FAILED, message);
    }

    public static MaintenanceException storageFailure(String message, Throwable cause) {
        return new MaintenanceException(FailureKind.STORAGE_FAILURE, message, cause);
    }

    public static MaintenanceException notFound(String message) {
        return new MaintenanceException(FailureKind.NOT_FOUND, message);
    }

    public static MaintenanceException invalidSettings(String message) {
        return new MaintenanceException(FailureKind.INVALID_SETTINGS, message);
    }

    public static MaintenanceException lastAdmin(String message) {
        return new MaintenanceException(FailureKind.LAST_ADMIN_INVARIANT_VIOLATION, message);
    }

    public static MaintenanceException confirmationRequired() {
        return new MaintenanceException(FailureKind.CONFIRMATION_REQUIRED,
                "restore replaces all live data; resend with explicit confirmation");
    }
}
