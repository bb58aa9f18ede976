// file: server/src/main/java/io/scorelite/server/SnapshotCache.java
package io.scorelite.server;

import io.scorelite.core.Annotation;
import io.scorelite.core.Page;
import io.scorelite.core.Snapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded LRU of materialized snapshots: snapshot hash -> (snapshot, pages, annotations).
 * <p>
 * Snapshots are immutable, so an entry never goes stale; eviction only bounds
 * memory. A capacity of 0 disables caching.
 */
final class SnapshotCache {

    /** A snapshot with its pages and annotations resolved, both in snapshot order. */
    record Materialized(Snapshot snapshot, List<Page> pages, List<Annotation> annotations) {
        Materialized {
            pages = List.copyOf(pages);
            annotations = List.copyOf(annotations);
        }

        List<String> pageHashes() { return snapshot.pages(); }

        List<String> annotationHashes() { return snapshot.annotations(); }
    }

    private final int capacity;
    private final LinkedHashMap<String, Materialized> entries;

    SnapshotCache(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Materialized> eldest) {
                return size() > SnapshotCache.this.capacity;
            }
        };
    }

    synchronized Materialized get(String snapshotHash) {
        return entries.get(snapshotHash);
    }

    synchronized void put(String snapshotHash, Materialized value) {
        if (capacity == 0) return;
        entries.put(snapshotHash, value);
    }

    synchronized int size() {
        return entries.size();
    }
}
