package me.golemcore.gateway.domain.system;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion. Writers to the same key are serialized; writers to
 * different keys never contend.
 *
 * <p>
 * Permits are not bound to threads, so a lock taken on one thread may be
 * released from another (reactive pipelines complete on I/O threads). An entry
 * lives only while some caller holds or waits for its key.
 */
@Slf4j
public class KeyedLocks {

    private final String name;
    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public KeyedLocks(String name) {
        this.name = name;
    }

    /**
     * Blocks until the lock for {@code key} is free, then holds it.
     *
     * @return handle that releases the lock when closed
     */
    public Handle acquire(String key) throws InterruptedException {
        Entry entry = enter(key);
        try {
            entry.semaphore.acquire();
        } catch (InterruptedException e) {
            leave(key);
            throw e;
        }
        return new Handle(key, entry);
    }

    /**
     * Like {@link #acquire(String)} but gives up after {@code timeout}.
     *
     * @throws IllegalStateException
     *             if the lock could not be obtained in time
     */
    public Handle acquire(String key, Duration timeout) throws InterruptedException {
        Entry entry = enter(key);
        boolean acquired = false;
        try {
            acquired = entry.semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            if (!acquired) {
                leave(key);
            }
        }
        if (!acquired) {
            throw new IllegalStateException(name + " lock busy for key " + key);
        }
        return new Handle(key, entry);
    }

    public <T> T withLock(String key, Supplier<T> action) {
        try (Handle ignored = acquire(key)) {
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + name + " lock " + key, e);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isLocked(String key) {
        Entry entry = locks.get(key);
        return entry != null && entry.semaphore.availablePermits() == 0;
    }

    /** Number of keys currently held or waited for. */
    public int size() {
        return locks.size();
    }

    private Entry enter(String key) {
        return locks.compute(key, (k, existing) -> {
            Entry entry = existing != null ? existing : new Entry();
            entry.users++;
            return entry;
        });
    }

    private void leave(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class Entry {
        private final Semaphore semaphore = new Semaphore(1, true);
        // guarded by the map's per-key compute
        private int users;
    }

    public final class Handle implements AutoCloseable {

        private final String key;
        private final Entry entry;
        private boolean released;

        private Handle(String key, Entry entry) {
            this.key = key;
            this.entry = entry;
        }

        @Override
        public synchronized void close() {
            if (released) {
                return;
            }
            released = true;
            entry.semaphore.release();
            leave(key);
            log.trace("[{}] released {}", name, key);
        }
    }
}
