package uk.gegc.gatekeeper.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gatekeeper.features.assignment.application.AssignmentService;
import uk.gegc.gatekeeper.features.assignment.domain.event.SubjectAssignmentsChangedEvent;
import uk.gegc.gatekeeper.features.assignment.domain.event.SubjectAssignmentsChangedEvent.ChangeType;
import uk.gegc.gatekeeper.features.assignment.domain.model.Team;
import uk.gegc.gatekeeper.features.assignment.domain.model.TeamMember;
import uk.gegc.gatekeeper.features.assignment.domain.model.TeamMemberId;
import uk.gegc.gatekeeper.features.assignment.domain.model.UserRoleAssignment;
import uk.gegc.gatekeeper.features.assignment.domain.repository.TeamMemberRepository;
import uk.gegc.gatekeeper.features.assignment.domain.repository.TeamRepository;
import uk.gegc.gatekeeper.features.assignment.domain.repository.UserRoleAssignmentRepository;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;
import uk.gegc.gatekeeper.features.catalog.domain.repository.RoleRepository;
import uk.gegc.gatekeeper.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class AssignmentServiceImpl implements AssignmentService {

    private final UserRoleAssignmentRepository assignmentRepository;
    private final RoleRepository roleRepository;
    private final TeamRepository teamRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public UserRoleAssignment grantRole(String subjectId, String roleName, String organizationId, String assignedBy) {
        requireId(subjectId, "Subject id");
        String orgId = normalize(organizationId);

        Role role = lockRole(roleName);

        Optional<UserRoleAssignment> existing =
                assignmentRepository.findAssignment(subjectId, role, UserRoleAssignment.scopeKeyOf(orgId));
        if (existing.isPresent()) {
            log.debug("Role {} already granted to subject {} (organization {})", roleName, subjectId, orgId);
            return existing.get();
        }

        UserRoleAssignment assignment = UserRoleAssignment.builder()
                .subjectId(subjectId)
                .role(role)
                .organizationId(orgId)
                .assignedBy(assignedBy)
                .assignedAt(clock.instant())
                .build();
        UserRoleAssignment saved = assignmentRepository.save(assignment);

        eventPublisher.publishEvent(new SubjectAssignmentsChangedEvent(this, subjectId, ChangeType.ROLE_GRANTED));
        log.info("Granted role {} to subject {} (organization {}) by {}", roleName, subjectId, orgId, assignedBy);
        return saved;
    }

    @Override
    public boolean revokeRole(String subjectId, String roleName, String organizationId) {
        requireId(subjectId, "Subject id");
        String orgId = normalize(organizationId);

        Role role = lockRole(roleName);

        int removed = assignmentRepository.deleteAssignment(subjectId, role, UserRoleAssignment.scopeKeyOf(orgId));
        if (removed == 0) {
            log.debug("Role {} not held by subject {} (organization {}); nothing to revoke", roleName, subjectId, orgId);
            return false;
        }

        eventPublisher.publishEvent(new SubjectAssignmentsChangedEvent(this, subjectId, ChangeType.ROLE_REVOKED));
        log.info("Revoked role {} from subject {} (organization {})", roleName, subjectId, orgId);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserRoleAssignment> getAssignments(String subjectId) {
        requireId(subjectId, "Subject id");
        return assignmentRepository.findAllBySubjectIdWithRole(subjectId);
    }

    @Override
    public Team createTeam(String teamId, String name) {
        requireId(teamId, "Team id");
        if (teamRepository.existsById(teamId)) {
            throw new IllegalArgumentException("Team already exists: " + teamId);
        }
        Team saved = teamRepository.save(Team.builder().id(teamId).name(name).build());
        log.info("Created team {} ({})", teamId, name);
        return saved;
    }

    @Override
    public void addTeamMember(String teamId, String subjectId) {
        requireId(subjectId, "Subject id");
        if (!teamRepository.existsById(teamId)) {
            throw new ResourceNotFoundException("Team not found: " + teamId);
        }

        TeamMemberId id = new TeamMemberId(teamId, subjectId);
        if (teamMemberRepository.existsById(id)) {
            log.debug("Subject {} already member of team {}", subjectId, teamId);
            return;
        }

        teamMemberRepository.save(new TeamMember(id, clock.instant()));
        eventPublisher.publishEvent(new SubjectAssignmentsChangedEvent(this, subjectId, ChangeType.TEAM_JOINED));
        log.info("Added subject {} to team {}", subjectId, teamId);
    }

    @Override
    public boolean removeTeamMember(String teamId, String subjectId) {
        requireId(subjectId, "Subject id");
        if (!teamRepository.existsById(teamId)) {
            throw new ResourceNotFoundException("Team not found: " + teamId);
        }

        TeamMemberId id = new TeamMemberId(teamId, subjectId);
        if (!teamMemberRepository.existsById(id)) {
            return false;
        }

        teamMemberRepository.deleteById(id);
        eventPublisher.publishEvent(new SubjectAssignmentsChangedEvent(this, subjectId, ChangeType.TEAM_LEFT));
        log.info("Removed subject {} from team {}", subjectId, teamId);
        return true;
    }

    // Grants and revokes of one role queue on its row lock, so check-then-insert cannot interleave.
    private Role lockRole(String roleName) {
        return roleRepository.findByNameForUpdate(roleName)
                .orElseThrow(() -> new ResourceNotFoundException("Role not found: " + roleName));
    }

    private static void requireId(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " must not be blank");
        }
    }

    private static String normalize(String organizationId) {
        return organizationId == null || organizationId.isBlank() ? null : organizationId.trim();
    }
}
