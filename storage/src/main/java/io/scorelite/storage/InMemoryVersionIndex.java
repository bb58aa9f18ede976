// file: src/main/java/io/scorelite/storage/InMemoryVersionIndex.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHistoryException.VersionNotFound;
import io.scorelite.core.ScoreId;
import io.scorelite.core.VersionEntry;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Version index backed by one copy-on-write list per score; element i is version i + 1.
 * <p>
 * Allocation runs inside ConcurrentHashMap.compute(), which serializes
 * concurrent recordVersion() calls for the same score while leaving other
 * scores uncontended. Readers iterate a copy-on-write array and never block.
 */
public final class InMemoryVersionIndex implements VersionIndex {
    private final Map<ScoreId, List<String>> versions = new ConcurrentHashMap<>();

    @Override
    public int recordVersion(ScoreId id, String snapshotHash) {
        Objects.requireNonNull(snapshotHash, "snapshotHash");
        int[] allocated = new int[1];
        versions.compute(id, (k, list) -> {
            List<String> l = list == null ? new CopyOnWriteArrayList<>() : list;
            l.add(snapshotHash);
            allocated[0] = l.size() - 1 + BASE_VERSION;
            return l;
        });
        return allocated[0];
    }

    @Override
    public String resolve(ScoreId id, String label) {
        int version;
        try {
            version = Integer.parseInt(label == null ? "" : label.trim());
        } catch (NumberFormatException e) {
            throw new VersionNotFound(id, label);
        }
        List<String> list = versions.get(id);
        int idx = version - BASE_VERSION;
        if (list == null || idx < 0 || idx >= list.size()) {
            throw new VersionNotFound(id, label);
        }
        return list.get(idx);
    }

    @Override
    public Iterable<VersionEntry> listVersions(ScoreId id) {
        return () -> {
            List<String> list = versions.getOrDefault(id, List.of());
            Iterator<String> it = list.iterator();
            return new Iterator<>() {
                private int next = BASE_VERSION;

                @Override
                public boolean hasNext() { return it.hasNext(); }

                @Override
                public VersionEntry next() {
                    if (!it.hasNext()) throw new NoSuchElementException();
                    return new VersionEntry(next++, it.next());
                }
            };
        };
    }

    @Override
    public OptionalInt latestVersion(ScoreId id) {
        List<String> list = versions.get(id);
        if (list == null || list.isEmpty()) return OptionalInt.empty();
        return OptionalInt.of(list.size() - 1 + BASE_VERSION);
    }

    /**
     * Re-apply a logged entry. Entries replay in the order they were allocated,
     * so a replayed number is either already present (skip) or the next one.
     */
    void restore(ScoreId id, VersionEntry entry) {
        versions.compute(id, (k, list) -> {
            List<String> l = list == null ? new CopyOnWriteArrayList<>() : list;
            int idx = entry.version() - BASE_VERSION;
            if (idx == l.size()) {
                l.add(entry.snapshotHash());
            } else if (idx > l.size()) {
                throw new IllegalStateException("version gap for " + id + ": have "
                        + l.size() + ", got " + entry.version());
            }
            return l;
        });
    }

    void drop(ScoreId id) {
        versions.remove(id);
    }

    Map<ScoreId, List<String>> view() {
        Map<ScoreId, List<String>> out = new java.util.HashMap<>();
        versions.forEach((id, list) -> out.put(id, List.copyOf(list)));
        return out;
    }
}
