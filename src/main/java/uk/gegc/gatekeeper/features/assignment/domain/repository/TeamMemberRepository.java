package uk.gegc.gatekeeper.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.gatekeeper.features.assignment.domain.model.TeamMember;
import uk.gegc.gatekeeper.features.assignment.domain.model.TeamMemberId;

import java.util.List;

@Repository
public interface TeamMemberRepository extends JpaRepository<TeamMember, TeamMemberId> {

    @Query("SELECT m.id.teamId FROM TeamMember m WHERE m.id.subjectId = :subjectId")
    List<String> findTeamIdsBySubjectId(@Param("subjectId") String subjectId);
}
