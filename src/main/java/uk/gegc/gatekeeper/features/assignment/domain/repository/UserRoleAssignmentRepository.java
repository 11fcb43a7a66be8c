package uk.gegc.gatekeeper.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.gatekeeper.features.assignment.domain.model.UserRoleAssignment;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRoleAssignmentRepository extends JpaRepository<UserRoleAssignment, Long> {

    /**
     * Role/permission pairs for the subject's unscoped assignments, read in one
     * statement so roles and permissions come from the same committed state.
     * Roles without permissions yield a row with a null permission name.
     */
    @Query("SELECT r.name, p.name FROM UserRoleAssignment a JOIN a.role r LEFT JOIN r.permissions p "
            + "WHERE a.subjectId = :subjectId AND a.organizationId IS NULL")
    List<Object[]> findGlobalRolePermissionPairs(@Param("subjectId") String subjectId);

    /**
     * Same as {@link #findGlobalRolePermissionPairs(String)} plus assignments
     * scoped to the given organization.
     */
    @Query("SELECT r.name, p.name FROM UserRoleAssignment a JOIN a.role r LEFT JOIN r.permissions p "
            + "WHERE a.subjectId = :subjectId AND (a.organizationId IS NULL OR a.organizationId = :organizationId)")
    List<Object[]> findRolePermissionPairs(@Param("subjectId") String subjectId,
                                           @Param("organizationId") String organizationId);

    /**
     * @param scopeKey organization id, or {@code ""} for the global grant
     */
    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role "
            + "WHERE a.subjectId = :subjectId AND a.role = :role AND a.scopeKey = :scopeKey")
    Optional<UserRoleAssignment> findAssignment(@Param("subjectId") String subjectId,
                                                @Param("role") Role role,
                                                @Param("scopeKey") String scopeKey);

    @Modifying
    @Query("DELETE FROM UserRoleAssignment a "
            + "WHERE a.subjectId = :subjectId AND a.role = :role AND a.scopeKey = :scopeKey")
    int deleteAssignment(@Param("subjectId") String subjectId,
                         @Param("role") Role role,
                         @Param("scopeKey") String scopeKey);

    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role WHERE a.subjectId = :subjectId")
    List<UserRoleAssignment> findAllBySubjectIdWithRole(@Param("subjectId") String subjectId);
}
