/**
 * Catalog value types consumed from the external template catalog.
 *
 * <p>The catalog loader itself is out of scope; the engine only reads entries
 * through {@link com.ryuqq.provisioning.core.spi.CatalogLookup}.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.catalog;
