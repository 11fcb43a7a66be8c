package uk.gegc.gatekeeper.features.catalog.domain.model;

import java.util.Objects;

/**
 * Immutable catalog entry for a permission named {@code resource.action[.scope]}.
 * The declared scope must agree with the name suffix.
 */
public record PermissionDefinition(String name, String resource, String action, PermissionScope scope) {

    public PermissionDefinition {
        Objects.requireNonNull(name, "Permission name must not be null");
        Objects.requireNonNull(resource, "Permission resource must not be null");
        Objects.requireNonNull(action, "Permission action must not be null");
        scope = scope == null ? PermissionScope.NONE : scope;

        PermissionScope suffixScope = PermissionScope.fromPermissionName(name);
        boolean consistent = suffixScope == scope
                || (suffixScope == PermissionScope.NONE && scope == PermissionScope.ALL)
                || (suffixScope == PermissionScope.ALL && scope == PermissionScope.NONE);
        if (!consistent) {
            throw new IllegalArgumentException(
                    "Permission " + name + " declares scope " + scope.getTag() + " but its name implies " + suffixScope.getTag());
        }
    }

    public static PermissionDefinition from(Permission permission) {
        return new PermissionDefinition(permission.getName(), permission.getResource(),
                permission.getAction(), permission.getScope());
    }
}
