package uk.gegc.gatekeeper.shared.security;

import uk.gegc.gatekeeper.shared.exception.SnapshotUnavailableException;

/**
 * Result of one access decision.
 *
 * @param outcome     what was decided
 * @param requirement the permission or role that failed; {@code null} when granted
 * @param failure     the store failure behind a {@link Outcome#SNAPSHOT_UNAVAILABLE} outcome
 */
public record AccessDecision(Outcome outcome, String requirement, SnapshotUnavailableException failure) {

    private static final AccessDecision GRANTED = new AccessDecision(Outcome.GRANTED, null, null);

    public enum Outcome {
        GRANTED,
        DENIED,
        SNAPSHOT_UNAVAILABLE
    }

    public static AccessDecision granted() {
        return GRANTED;
    }

    public static AccessDecision denied(String requirement) {
        return new AccessDecision(Outcome.DENIED, requirement, null);
    }

    public static AccessDecision unavailable(String requirement, SnapshotUnavailableException failure) {
        return new AccessDecision(Outcome.SNAPSHOT_UNAVAILABLE, requirement, failure);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }
}
