package uk.gegc.gatekeeper.features.catalog.domain.model;

import java.util.Objects;

/**
 * Immutable catalog entry for a role.
 */
public record RoleDefinition(String name, int level) {

    public RoleDefinition {
        Objects.requireNonNull(name, "Role name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        if (level < 1) {
            throw new IllegalArgumentException("Role level must be positive: " + name);
        }
    }

    public static RoleDefinition of(RoleName roleName) {
        return new RoleDefinition(roleName.getRoleName(), roleName.getLevel());
    }
}
