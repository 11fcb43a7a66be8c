package uk.gegc.gatekeeper.features.snapshot.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Materialized view of what a subject holds at decision time. Immutable; a new
 * snapshot is built rather than updating one in place.
 *
 * @param subjectId      the subject the snapshot was built for, carried explicitly
 *                       so ownership checks never rely on caller bookkeeping
 * @param organizationId organization whose scoped grants were included, or {@code null}
 * @param roles          role names held
 * @param permissions    union of the permission names carried by {@code roles}
 * @param teamIds        teams the subject belongs to
 * @param builtAt        when the assignment store was read
 */
public record AccessSnapshot(String subjectId,
                             String organizationId,
                             Set<String> roles,
                             Set<String> permissions,
                             Set<String> teamIds,
                             Instant builtAt) {

    public AccessSnapshot {
        Objects.requireNonNull(subjectId, "Subject id must not be null");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        teamIds = teamIds == null ? Set.of() : Set.copyOf(teamIds);
    }

    public static AccessSnapshot of(String subjectId, Set<String> roles, Set<String> permissions, Set<String> teamIds) {
        return new AccessSnapshot(subjectId, null, roles, permissions, teamIds, null);
    }

    public static AccessSnapshot empty(String subjectId) {
        return of(subjectId, Set.of(), Set.of(), Set.of());
    }
}
