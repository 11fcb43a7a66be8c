package uk.gegc.gatekeeper.shared.exception;

import lombok.Getter;

/**
 * Raised by the guard when a decision comes out negative. Carries only the name
 * of the permission (or role) that failed, never resource details.
 */
@Getter
public class ForbiddenException extends RuntimeException {

    private final String requirement;

    public ForbiddenException(String requirement) {
        super("Insufficient permissions: " + requirement);
        this.requirement = requirement;
    }

    public ForbiddenException(String requirement, Throwable cause) {
        super("Insufficient permissions: " + requirement, cause);
        this.requirement = requirement;
    }

    /**
     * True when the denial came from an unreadable assignment store rather than a
     * negative decision.
     */
    public boolean isSnapshotUnavailable() {
        return getCause() instanceof SnapshotUnavailableException;
    }
}
