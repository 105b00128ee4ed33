// file: core/src/main/java/io/backlite/core/Outcome.java
package io.backlite.core;

import java.util.Objects;

/**
 * Result of a maintenance operation: either a value or a typed failure.
 * <p>
 * Sealed so callers can branch exhaustively:
 * <pre>
 *   if (outcome instanceof Outcome.Success&lt;HistoryPage&gt; s) { ... s.value() ... }
 *   else if (outcome instanceof Outcome.Failure&lt;HistoryPage&gt; f) { ... f.kind() ... }
 * </pre>
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    record Success<T>(T value) implements Outcome<T> {
    }

    record Failure<T>(FailureKind kind, String message) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(FailureKind kind, String message) {
        return new Failure<>(kind, message);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** Unwrap the value, rethrowing a failure as {@link MaintenanceException}. */
    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        Failure<T> f = (Failure<T>) this;
        throw new MaintenanceException(f.kind(), f.message());
    }
}
