package com.example.sickrock.service;

import com.example.sickrock.config.EngineProperties;
import com.example.sickrock.dialect.Identifiers;
import com.example.sickrock.exception.TransientException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Named read/write locks keyed by physical table name. CRUD holds the shared side, schema
 * mutations the exclusive side, so a mutation never interleaves with writes to the same table.
 * Waiters give up after the configured timeout.
 */
@Component
public class TableLockRegistry {

    private final ConcurrentMap<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public TableLockRegistry(EngineProperties properties) {
        this.timeout = properties.lockTimeout();
    }

    /**
     * Releases the held locks. Closing twice is harmless.
     */
    public static final class Lease implements AutoCloseable {
        private final List<Lock> held;
        private boolean released;

        private Lease(List<Lock> held) {
            this.held = held;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    public Lease acquireShared(String tableName) {
        return acquire(List.of(tableName), false);
    }

    /**
     * Shared locks on several tables, for writes that reach into referencing tables.
     */
    public Lease acquireShared(Collection<String> tableNames) {
        return acquire(List.copyOf(tableNames), false);
    }

    public Lease acquireExclusive(String tableName) {
        return acquire(List.of(tableName), true);
    }

    /**
     * Exclusive locks on several tables, taken in name order so two callers cannot deadlock.
     */
    public Lease acquireExclusive(String first, String second) {
        return acquire(List.of(first, second), true);
    }

    private Lease acquire(Collection<String> tableNames, boolean exclusive) {
        TreeSet<String> keys = new TreeSet<>();
        tableNames.forEach(name -> keys.add(key(name)));
        List<Lock> held = new ArrayList<>(keys.size());
        try {
            for (String key : keys) {
                ReentrantReadWriteLock lock = locks.computeIfAbsent(key, k -> new ReentrantReadWriteLock(true));
                Lock side = exclusive ? lock.writeLock() : lock.readLock();
                if (!side.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new TransientException("Timed out after " + timeout.toMillis() + " ms waiting for "
                            + (exclusive ? "exclusive" : "shared") + " lock on table " + key);
                }
                held.add(side);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            new Lease(held).close();
            throw new TransientException("Interrupted while waiting for lock on " + keys, ex);
        } catch (RuntimeException ex) {
            new Lease(held).close();
            throw ex;
        }
        return new Lease(held);
    }

    private static String key(String tableName) {
        return Identifiers.validate(tableName, "table").toLowerCase(Locale.ROOT);
    }
}
