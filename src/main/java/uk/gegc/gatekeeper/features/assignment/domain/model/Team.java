package uk.gegc.gatekeeper.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Table(name = "teams")
public class Team {

    @Id
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;
}
