package uk.gegc.gatekeeper.shared.security;

/**
 * Ownership facts about the resource a permission is checked against. Both
 * fields are optional; blank values are treated as absent.
 *
 * @param resourceOwnerId subject id of the resource owner
 * @param resourceTeamId  id of the team that owns the resource
 */
public record ResourceContext(String resourceOwnerId, String resourceTeamId) {

    private static final ResourceContext NONE = new ResourceContext(null, null);

    public ResourceContext {
        resourceOwnerId = blankToNull(resourceOwnerId);
        resourceTeamId = blankToNull(resourceTeamId);
    }

    public static ResourceContext ownedBy(String resourceOwnerId) {
        return new ResourceContext(resourceOwnerId, null);
    }

    public static ResourceContext ownedByTeam(String resourceTeamId) {
        return new ResourceContext(null, resourceTeamId);
    }

    public static ResourceContext of(String resourceOwnerId, String resourceTeamId) {
        return new ResourceContext(resourceOwnerId, resourceTeamId);
    }

    public static ResourceContext none() {
        return NONE;
    }

    public boolean hasOwner() {
        return resourceOwnerId != null;
    }

    public boolean hasTeam() {
        return resourceTeamId != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
