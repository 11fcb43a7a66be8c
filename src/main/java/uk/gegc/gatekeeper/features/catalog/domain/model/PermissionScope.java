package uk.gegc.gatekeeper.features.catalog.domain.model;

import java.util.Locale;

/**
 * Ownership restriction carried by a permission. Only {@link #OWN} and
 * {@link #TEAM} need a resource context to be evaluated.
 */
public enum PermissionScope {
    NONE("none"),
    OWN("own"),
    TEAM("team"),
    ALL("all");

    private final String tag;

    PermissionScope(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static PermissionScope fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return NONE;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (PermissionScope scope : values()) {
            if (scope.tag.equals(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown permission scope: " + tag);
    }

    /**
     * Scope implied by the last segment of a {@code resource.action[.scope]} name.
     * A name without a recognised suffix is unrestricted.
     */
    public static PermissionScope fromPermissionName(String permissionName) {
        int lastDot = permissionName.lastIndexOf('.');
        if (lastDot < 0) {
            return NONE;
        }
        String suffix = permissionName.substring(lastDot + 1);
        return switch (suffix) {
            case "own" -> OWN;
            case "team" -> TEAM;
            case "all" -> ALL;
            default -> NONE;
        };
    }
}
