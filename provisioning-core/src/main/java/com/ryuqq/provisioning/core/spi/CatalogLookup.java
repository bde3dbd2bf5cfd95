package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.catalog.CatalogEntry;

import java.util.Optional;

/**
 * Read-only catalog SPI.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface CatalogLookup {

    /**
     * Resolves a catalog entry.
     *
     * @param catalogItemId the template id
     * @return the entry, or empty if the catalog does not know it
     */
    Optional<CatalogEntry> find(String catalogItemId);
}
