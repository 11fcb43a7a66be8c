package uk.gegc.gatekeeper.features.assignment.application;

import uk.gegc.gatekeeper.features.assignment.domain.model.Team;
import uk.gegc.gatekeeper.features.assignment.domain.model.UserRoleAssignment;

import java.util.List;

/**
 * Administrative writes over subject role assignments and team memberships.
 * Each operation runs in a single transaction.
 */
public interface AssignmentService {

    /**
     * Grants a role to a subject. Granting an assignment that already exists
     * returns the existing one unchanged.
     *
     * @param organizationId optional organization scope, {@code null} for a global grant
     * @param assignedBy     id of the administrator making the grant
     */
    UserRoleAssignment grantRole(String subjectId, String roleName, String organizationId, String assignedBy);

    /**
     * @return {@code true} if an assignment was removed
     */
    boolean revokeRole(String subjectId, String roleName, String organizationId);

    List<UserRoleAssignment> getAssignments(String subjectId);

    Team createTeam(String teamId, String name);

    void addTeamMember(String teamId, String subjectId);

    /**
     * @return {@code true} if a membership was removed
     */
    boolean removeTeamMember(String teamId, String subjectId);
}
