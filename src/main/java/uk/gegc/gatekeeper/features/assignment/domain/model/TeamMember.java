package uk.gegc.gatekeeper.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString
@Table(name = "team_members")
public class TeamMember {

    @EmbeddedId
    private TeamMemberId id;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    public String getTeamId() {
        return id.getTeamId();
    }

    public String getSubjectId() {
        return id.getSubjectId();
    }
}
