package com.example.sickrock.service;

import com.example.sickrock.config.EngineProperties;
import com.example.sickrock.model.TableStructure;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Introspection results keyed by table name, used on the CRUD hot path. The mutation engine
 * invalidates a table after every structural change; the TTL bounds staleness from changes made
 * outside the engine.
 */
@Component
public class TableStructureCache {

    private final boolean enabled;
    private final Cache<String, TableStructure> cache;

    public TableStructureCache(EngineProperties properties) {
        EngineProperties.StructureCache settings = properties.structureCache();
        this.enabled = settings.enabled();
        this.cache = enabled
                ? Caffeine.newBuilder()
                        .maximumSize(settings.maximumSize())
                        .expireAfterWrite(settings.ttl())
                        .build()
                : null;
    }

    public TableStructure get(String tableName, Function<String, TableStructure> loader) {
        if (!enabled) {
            return loader.apply(tableName);
        }
        return cache.get(tableName, loader);
    }

    public void invalidate(String tableName) {
        if (enabled) {
            cache.invalidate(tableName);
        }
    }

    /**
     * Invalidates the given tables when closed. Opened after a table lock so that the entries are
     * gone before the lock is released.
     */
    public Invalidation invalidateOnClose(String... tableNames) {
        return new Invalidation(List.of(tableNames));
    }

    public final class Invalidation implements AutoCloseable {
        private final List<String> tableNames;

        private Invalidation(List<String> tableNames) {
            this.tableNames = tableNames;
        }

        @Override
        public void close() {
            tableNames.forEach(TableStructureCache.this::invalidate);
        }
    }

    public void invalidateAll() {
        if (enabled) {
            cache.invalidateAll();
        }
    }

    public boolean isCached(String tableName) {
        return enabled && cache.getIfPresent(tableName) != null;
    }
}
