package uk.gegc.gatekeeper.features.catalog.domain.model;

import uk.gegc.gatekeeper.shared.exception.CatalogMisuseException;

import java.util.*;

/**
 * Read-only vocabulary of roles and permissions, loaded once from provisioned
 * data and passed by injection to the evaluator and the snapshot builder.
 *
 * <p>Role levels form a strict total order: no two roles share a level, so the
 * role with the highest level is well defined and is the single bypass role.
 */
public final class Catalog {

    private final Map<String, RoleDefinition> roles;
    private final Map<String, PermissionDefinition> permissions;
    private final RoleDefinition topRole;

    private Catalog(Map<String, RoleDefinition> roles, Map<String, PermissionDefinition> permissions) {
        this.roles = Collections.unmodifiableMap(roles);
        this.permissions = Collections.unmodifiableMap(permissions);
        this.topRole = roles.values().stream()
                .max(Comparator.comparingInt(RoleDefinition::level))
                .orElse(null);
    }

    public static Catalog of(Collection<RoleDefinition> roles, Collection<PermissionDefinition> permissions) {
        Map<String, RoleDefinition> roleMap = new LinkedHashMap<>();
        Map<Integer, String> levels = new HashMap<>();
        for (RoleDefinition role : roles) {
            if (roleMap.putIfAbsent(role.name(), role) != null) {
                throw new IllegalArgumentException("Duplicate role in catalog: " + role.name());
            }
            String clash = levels.putIfAbsent(role.level(), role.name());
            if (clash != null) {
                throw new IllegalArgumentException(
                        "Roles " + clash + " and " + role.name() + " share level " + role.level());
            }
        }

        Map<String, PermissionDefinition> permissionMap = new LinkedHashMap<>();
        for (PermissionDefinition permission : permissions) {
            if (permissionMap.putIfAbsent(permission.name(), permission) != null) {
                throw new IllegalArgumentException("Duplicate permission in catalog: " + permission.name());
            }
        }
        return new Catalog(roleMap, permissionMap);
    }

    public Optional<RoleDefinition> findRole(String roleName) {
        return roleName == null ? Optional.empty() : Optional.ofNullable(roles.get(roleName));
    }

    public Optional<PermissionDefinition> findPermission(String permissionName) {
        return permissionName == null ? Optional.empty() : Optional.ofNullable(permissions.get(permissionName));
    }

    /**
     * @throws CatalogMisuseException when the catalog has no such role
     */
    public RoleDefinition role(String roleName) {
        return findRole(roleName).orElseThrow(() -> CatalogMisuseException.unknownRole(roleName));
    }

    /**
     * @throws CatalogMisuseException when the catalog has no such permission
     */
    public PermissionDefinition permission(String permissionName) {
        return findPermission(permissionName)
                .orElseThrow(() -> CatalogMisuseException.unknownPermission(permissionName));
    }

    public boolean containsRole(String roleName) {
        return findRole(roleName).isPresent();
    }

    public boolean containsPermission(String permissionName) {
        return findPermission(permissionName).isPresent();
    }

    /**
     * Level of a role held by a subject; names the catalog does not know count as 0.
     */
    public int levelOf(String roleName) {
        return findRole(roleName).map(RoleDefinition::level).orElse(0);
    }

    public boolean isTopRole(String roleName) {
        return topRole != null && topRole.name().equals(roleName);
    }

    public Optional<RoleDefinition> topRole() {
        return Optional.ofNullable(topRole);
    }

    public Collection<RoleDefinition> roles() {
        return roles.values();
    }

    public Collection<PermissionDefinition> permissions() {
        return permissions.values();
    }

    @Override
    public String toString() {
        return "Catalog{roles=" + roles.keySet() + ", permissions=" + permissions.size() + "}";
    }
}
