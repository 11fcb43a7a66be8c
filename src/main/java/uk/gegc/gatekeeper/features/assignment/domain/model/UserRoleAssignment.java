package uk.gegc.gatekeeper.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.*;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;

import java.time.Instant;

/**
 * Grant of a role to a subject, optionally scoped to an organization. The
 * {@code assignedBy}/{@code assignedAt} metadata is read by external audit
 * collaborators.
 *
 * <p>{@code scopeKey} mirrors the organization id with {@code ""} for a global
 * grant; the unique key over it keeps one row per subject, role and scope.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "role")
@Table(name = "user_roles")
public class UserRoleAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String subjectId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @Column(name = "organization_id", length = 64)
    private String organizationId;

    @Column(name = "scope_key", nullable = false, length = 64)
    private String scopeKey;

    @Column(name = "assigned_by", length = 64)
    private String assignedBy;

    @Column(name = "assigned_at", nullable = false)
    private Instant assignedAt;

    public static String scopeKeyOf(String organizationId) {
        return organizationId == null ? "" : organizationId;
    }

    @PrePersist
    @PreUpdate
    void syncScopeKey() {
        scopeKey = scopeKeyOf(organizationId);
    }
}
