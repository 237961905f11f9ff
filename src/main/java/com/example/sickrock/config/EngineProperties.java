package com.example.sickrock.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Engine behaviour bound from {@code sickrock.engine.*}.
 *
 * @param lockTimeout         how long CRUD and schema mutations wait for a table lock
 * @param tableDeletionPolicy what happens to the physical table when its configuration is deleted
 * @param defaultPageSize     page size of list requests that do not specify one
 * @param maxPageSize         upper bound on any requested page size
 */
@ConfigurationProperties(prefix = "sickrock.engine")
public record EngineProperties(
        @DefaultValue("10s") Duration lockTimeout,
        @DefaultValue("RETAIN") TableDeletionPolicy tableDeletionPolicy,
        @DefaultValue("100") int defaultPageSize,
        @DefaultValue("1000") int maxPageSize,
        @DefaultValue StructureCache structureCache
) {

    public enum TableDeletionPolicy {
        /**
         * Only the configuration goes away; the physical table stays and shows up as unconfigured.
         */
        RETAIN,
        DROP
    }

    public record StructureCache(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("256") long maximumSize,
            @DefaultValue("60s") Duration ttl
    ) {
    }

    public static EngineProperties defaults() {
        return new EngineProperties(Duration.ofSeconds(10), TableDeletionPolicy.RETAIN, 100, 1000,
                new StructureCache(true, 256, Duration.ofSeconds(60)));
    }

    public EngineProperties withTableDeletionPolicy(TableDeletionPolicy policy) {
        return new EngineProperties(lockTimeout, policy, defaultPageSize, maxPageSize, structureCache);
    }

    public EngineProperties withLockTimeout(Duration timeout) {
        return new EngineProperties(timeout, tableDeletionPolicy, defaultPageSize, maxPageSize, structureCache);
    }
}
