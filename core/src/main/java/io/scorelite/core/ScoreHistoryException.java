// file: src/main/java/io/scorelite/core/ScoreHistoryException.java
package io.scorelite.core;

import java.util.Set;
import java.util.TreeSet;

/**
 * Base class for failures of the versioning engine.
 * <p>
 * Every subclass carries a stable {@link ErrorKind}. A thrown exception always
 * means the whole write batch was rejected and no head pointer moved.
 */
public abstract class ScoreHistoryException extends RuntimeException {

    private final ErrorKind kind;

    protected ScoreHistoryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ScoreHistoryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    /** Raised when (owner, scoreName) has no head. */
    public static class ScoreNotFound extends ScoreHistoryException {
        public ScoreNotFound(ScoreId id) {
            super(ErrorKind.SCORE_NOT_FOUND, "score not found: " + id);
        }
    }

    /** Raised when a version label does not name a recorded version. */
    public static class VersionNotFound extends ScoreHistoryException {
        public VersionNotFound(ScoreId id, String label) {
            super(ErrorKind.VERSION_NOT_FOUND, "version '" + label + "' not found for " + id);
        }
    }

    /** Raised when one or more hashes of a batch lookup are absent. */
    public static class ObjectNotFound extends ScoreHistoryException {
        private final Set<String> missing;

        public ObjectNotFound(Set<String> missing) {
            super(ErrorKind.OBJECT_NOT_FOUND, "objects not found: " + new TreeSet<>(missing));
            this.missing = Set.copyOf(missing);
        }

        public Set<String> missing() { return missing; }
    }

    /** Raised when creating a score whose (owner, scoreName) already has a head. */
    public static class ScoreAlreadyExists extends ScoreHistoryException {
        public ScoreAlreadyExists(ScoreId id) {
            super(ErrorKind.SCORE_ALREADY_EXISTS, "score already exists: " + id);
        }
    }

    /** Raised when the declared parent is not the current head. */
    public static class ConcurrencyConflict extends ScoreHistoryException {
        public ConcurrencyConflict(String message) {
            super(ErrorKind.CONCURRENCY_CONFLICT, message);
        }
    }

    /** Raised for out-of-range indices and malformed payloads. */
    public static class InvalidOperation extends ScoreHistoryException {
        public InvalidOperation(String message) {
            super(ErrorKind.INVALID_OPERATION, message);
        }
    }

    /** Raised when a property update would not change anything. */
    public static class NoChange extends ScoreHistoryException {
        public NoChange(ScoreId id) {
            super(ErrorKind.NO_CHANGE, "property of " + id + " is unchanged");
        }
    }

    /** Raised for an operation type tag this engine does not know. */
    public static class UnsupportedOperation extends ScoreHistoryException {
        public UnsupportedOperation(String type) {
            super(ErrorKind.UNSUPPORTED_OPERATION, "unsupported operation type: " + type);
        }
    }
}
