package uk.gegc.gatekeeper.shared.exception;

/**
 * Programmer error: a role or permission name was referenced that the catalog
 * does not define. Never an authorization outcome.
 */
public class CatalogMisuseException extends RuntimeException {

    public CatalogMisuseException(String message) {
        super(message);
    }

    public static CatalogMisuseException unknownRole(String roleName) {
        return new CatalogMisuseException("Unknown role: " + roleName);
    }

    public static CatalogMisuseException unknownPermission(String permissionName) {
        return new CatalogMisuseException("Unknown permission: " + permissionName);
    }
}
