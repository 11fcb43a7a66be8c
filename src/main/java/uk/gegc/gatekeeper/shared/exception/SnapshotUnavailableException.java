package uk.gegc.gatekeeper.shared.exception;

import lombok.Getter;

/**
 * The assignment store could not be read for a subject: timeout, connection
 * failure, rejected read or malformed data.
 */
@Getter
public class SnapshotUnavailableException extends RuntimeException {

    private final String subjectId;

    public SnapshotUnavailableException(String subjectId, String message, Throwable cause) {
        super(message, cause);
        this.subjectId = subjectId;
    }

    public SnapshotUnavailableException(String subjectId, Throwable cause) {
        this(subjectId, "Assignment snapshot unavailable for subject " + subjectId, cause);
    }
}
