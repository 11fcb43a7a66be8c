package uk.gegc.gatekeeper.features.snapshot.domain;

import java.util.Set;

/**
 * Raw rows read from the assignment store for one subject, before catalog
 * filtering.
 */
public record SubjectAssignments(Set<String> roles, Set<String> permissions, Set<String> teamIds) {

    public SubjectAssignments {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        teamIds = teamIds == null ? Set.of() : Set.copyOf(teamIds);
    }
}
