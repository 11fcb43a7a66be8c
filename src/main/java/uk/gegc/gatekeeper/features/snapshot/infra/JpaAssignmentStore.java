package uk.gegc.gatekeeper.features.snapshot.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gatekeeper.features.assignment.domain.repository.TeamMemberRepository;
import uk.gegc.gatekeeper.features.assignment.domain.repository.UserRoleAssignmentRepository;
import uk.gegc.gatekeeper.features.snapshot.application.AssignmentStore;
import uk.gegc.gatekeeper.features.snapshot.domain.SubjectAssignments;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class JpaAssignmentStore implements AssignmentStore {

    private final UserRoleAssignmentRepository assignmentRepository;
    private final TeamMemberRepository teamMemberRepository;

    @Override
    @Transactional(readOnly = true)
    public SubjectAssignments load(String subjectId, String organizationId) {
        List<Object[]> pairs = organizationId == null
                ? assignmentRepository.findGlobalRolePermissionPairs(subjectId)
                : assignmentRepository.findRolePermissionPairs(subjectId, organizationId);

        Set<String> roles = new HashSet<>();
        Set<String> permissions = new HashSet<>();
        for (Object[] row : pairs) {
            if (row.length != 2 || !(row[0] instanceof String roleName)) {
                throw new IllegalStateException("Malformed role assignment row for subject " + subjectId);
            }
            roles.add(roleName);
            if (row[1] instanceof String permissionName) {
                permissions.add(permissionName);
            }
        }

        Set<String> teamIds = new HashSet<>(teamMemberRepository.findTeamIdsBySubjectId(subjectId));
        return new SubjectAssignments(roles, permissions, teamIds);
    }
}
