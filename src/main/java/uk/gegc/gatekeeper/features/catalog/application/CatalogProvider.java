package uk.gegc.gatekeeper.features.catalog.application;

import uk.gegc.gatekeeper.features.catalog.domain.model.Catalog;

/**
 * Source of the process-wide catalog. Tests substitute a fixed catalog with a
 * lambda.
 */
@FunctionalInterface
public interface CatalogProvider {

    Catalog getCatalog();

    /**
     * Replaces the held catalog with a fresh load. Providers with a fixed
     * catalog have nothing to reload.
     */
    default Catalog reload() {
        return getCatalog();
    }
}
