package uk.gegc.gatekeeper.features.snapshot.application;

import uk.gegc.gatekeeper.features.snapshot.domain.SubjectAssignments;

/**
 * Read side of the persistence layer holding role assignments, role
 * permissions and team memberships. Implementations perform read-only queries
 * and may block; callers bound every call with a timeout.
 */
public interface AssignmentStore {

    /**
     * @param organizationId when non-null, assignments scoped to this
     *                       organization are included next to unscoped ones
     */
    SubjectAssignments load(String subjectId, String organizationId);
}
