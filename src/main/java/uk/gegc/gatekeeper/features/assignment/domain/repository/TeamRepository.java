package uk.gegc.gatekeeper.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.gatekeeper.features.assignment.domain.model.Team;

@Repository
public interface TeamRepository extends JpaRepository<Team, String> {
}
