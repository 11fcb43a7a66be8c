package uk.gegc.gatekeeper.features.snapshot.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.gatekeeper.features.assignment.domain.model.Team;
import uk.gegc.gatekeeper.features.assignment.domain.model.TeamMember;
import uk.gegc.gatekeeper.features.assignment.domain.model.TeamMemberId;
import uk.gegc.gatekeeper.features.assignment.domain.model.UserRoleAssignment;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;
import uk.gegc.gatekeeper.features.catalog.domain.repository.RoleRepository;
import uk.gegc.gatekeeper.features.snapshot.domain.SubjectAssignments;

import java.time.Instant;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaAssignmentStore.class)
@DisplayName("JpaAssignmentStore")
class JpaAssignmentStoreTest {

    private static final Instant ASSIGNED_AT = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private JpaAssignmentStore assignmentStore;

    @Autowired
    private RoleRepository roleRepository;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void setUp() {
        assign("store-alice", "user", null);
        assign("store-alice", "manager", "org-1");

        entityManager.persist(Team.builder().id("store-team-1").name("Growth").build());
        entityManager.persist(new TeamMember(new TeamMemberId("store-team-1", "store-alice"), ASSIGNED_AT));
        entityManager.flush();
    }

    @Test
    @DisplayName("load: global read includes only unscoped roles and their seeded permissions")
    void load_global() {
        // When
        SubjectAssignments assignments = assignmentStore.load("store-alice", null);

        // Then
        assertThat(assignments.roles()).containsExactly("user");
        assertThat(assignments.permissions())
                .contains("campaigns.create", "campaigns.read.own", "campaigns.update.own")
                .doesNotContain("campaigns.read.team", "campaigns.delete.all");
        assertThat(assignments.teamIds()).containsExactly("store-team-1");
    }

    @Test
    @DisplayName("load: organization read adds the roles scoped to that organization")
    void load_organization() {
        // When
        SubjectAssignments assignments = assignmentStore.load("store-alice", "org-1");

        // Then
        assertThat(assignments.roles()).containsExactlyInAnyOrder("user", "manager");
        assertThat(assignments.permissions()).contains("campaigns.read.team", "budgets.read.team");
    }

    @Test
    @DisplayName("load: another organization does not see org-1 grants")
    void load_otherOrganization() {
        SubjectAssignments assignments = assignmentStore.load("store-alice", "org-2");

        assertThat(assignments.roles()).containsExactly("user");
    }

    @Test
    @DisplayName("load: a role without permissions still appears")
    void load_roleWithoutPermissions() {
        // Given
        Role observer = entityManager.persist(Role.builder().name("observer").level(42)
                .description("No permissions").permissions(new HashSet<>()).build());
        entityManager.persist(UserRoleAssignment.builder().subjectId("store-bob").role(observer)
                .assignedAt(ASSIGNED_AT).build());
        entityManager.flush();

        // When
        SubjectAssignments assignments = assignmentStore.load("store-bob", null);

        // Then
        assertThat(assignments.roles()).containsExactly("observer");
        assertThat(assignments.permissions()).isEmpty();
        assertThat(assignments.teamIds()).isEmpty();
    }

    @Test
    @DisplayName("load: unknown subject has nothing")
    void load_unknownSubject() {
        SubjectAssignments assignments = assignmentStore.load("store-nobody", null);

        assertThat(assignments.roles()).isEmpty();
        assertThat(assignments.permissions()).isEmpty();
        assertThat(assignments.teamIds()).isEmpty();
    }

    private void assign(String subjectId, String roleName, String organizationId) {
        Role role = roleRepository.findByNameWithPermissions(roleName).orElseThrow();
        entityManager.persist(UserRoleAssignment.builder()
                .subjectId(subjectId)
                .role(role)
                .organizationId(organizationId)
                .assignedBy("test")
                .assignedAt(ASSIGNED_AT)
                .build());
    }
}
