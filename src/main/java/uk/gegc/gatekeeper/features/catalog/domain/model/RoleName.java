package uk.gegc.gatekeeper.features.catalog.domain.model;

/**
 * The provisioned role ladder. Levels grow with authority; {@link #SUPER_ADMIN}
 * sits at the top and is the only role that bypasses permission checks.
 */
public enum RoleName {
    VIEWER("viewer", 1),           // Read-only access to own work
    USER("user", 2),               // Creates and manages own campaigns and assets
    MANAGER("manager", 3),         // Manages team content, budgets and jobs
    ADMIN("admin", 4),             // Manages every resource, users and role grants
    SUPER_ADMIN("super_admin", 5); // Full system access

    private final String roleName;
    private final int level;

    RoleName(String roleName, int level) {
        this.roleName = roleName;
        this.level = level;
    }

    public String getRoleName() {
        return roleName;
    }

    public int getLevel() {
        return level;
    }
}
