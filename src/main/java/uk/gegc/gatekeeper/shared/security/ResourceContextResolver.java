package uk.gegc.gatekeeper.shared.security;

/**
 * Supplies the owner and team of the resource being protected. Owned by the
 * caller; the access-control core never looks resources up itself.
 */
@FunctionalInterface
public interface ResourceContextResolver {

    ResourceContextResolver NONE = () -> null;

    /**
     * @return the resource context, or {@code null} when the resource has none
     */
    ResourceContext resolve();

    static ResourceContextResolver of(ResourceContext context) {
        return () -> context;
    }
}
