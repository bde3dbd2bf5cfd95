package com.ryuqq.provisioning.adapter.inmemory.catalog;

import com.ryuqq.provisioning.core.catalog.CatalogEntry;
import com.ryuqq.provisioning.core.spi.CatalogLookup;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed set of catalog entries held in memory.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class StaticCatalog implements CatalogLookup {

    private final ConcurrentHashMap<String, CatalogEntry> entries = new ConcurrentHashMap<>();

    public StaticCatalog(CatalogEntry... entries) {
        this(List.of(entries));
    }

    public StaticCatalog(Collection<CatalogEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        entries.forEach(this::register);
    }

    /**
     * Adds or replaces an entry.
     *
     * @param entry the entry
     * @throws IllegalArgumentException if entry is null
     */
    public void register(CatalogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.put(entry.id(), entry);
    }

    @Override
    public Optional<CatalogEntry> find(String catalogItemId) {
        if (catalogItemId == null) {
            throw new IllegalArgumentException("catalogItemId cannot be null");
        }
        return Optional.ofNullable(entries.get(catalogItemId));
    }
}
